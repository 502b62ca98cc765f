package zookeep.staffing.path;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous route finding. Results complete on the service's own
 * threads; callers poll the future from their update loop.
 */
public interface PathService extends AutoCloseable {

    CompletableFuture<PathResult> findPath(PathRequest request);

    @Override
    default void close() {
    }
}
