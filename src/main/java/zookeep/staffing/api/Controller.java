package zookeep.staffing.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import zookeep.staffing.server.RouterHandler;

import java.util.Map;

/**
 * An HTTP endpoint group under /api/v1. The router asks each controller in
 * registration order whether it takes a request; the first match answers.
 */
public interface Controller {

    /**
     * @param path request path without query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Validation problems are thrown as {@link IllegalArgumentException} and
     * become a 400 in the router.
     */
    ControllerResponse handle(FullHttpRequest req, String path);

    /**
     * A JSON response. Controllers and the router both build their bodies here.
     */
    record ControllerResponse(HttpResponseStatus status, String body) {

        public static ControllerResponse ok(Object value) {
            return of(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse of(HttpResponseStatus status, Object value) {
            try {
                return new ControllerResponse(status, RouterHandler.mapper().writeValueAsString(value));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
            }
        }

        /** {"error": message} with the given status */
        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return of(status, Map.of("error", message == null ? "" : message));
        }
    }
}
