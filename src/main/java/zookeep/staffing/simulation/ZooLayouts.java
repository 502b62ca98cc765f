package zookeep.staffing.simulation;

import zookeep.staffing.model.EdgeDirection;
import zookeep.staffing.model.FenceEdge;
import zookeep.staffing.model.FoodType;
import zookeep.staffing.model.GridPos;
import zookeep.staffing.model.StaffRole;
import zookeep.staffing.staff.StaffWorker;
import zookeep.staffing.world.Zone;
import zookeep.staffing.world.ZooWorld;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ready-made zoos for the server and for tests.
 */
public final class ZooLayouts {

    public static final int DEMO_WIDTH = 40;
    public static final int DEMO_HEIGHT = 24;

    /** Where new staff are spawned in the demo zoo */
    public static final GridPos DEMO_ENTRANCE = GridPos.of(1, 12);

    private ZooLayouts() {
    }

    /**
     * Two fenced exhibits joined by a path network, a pond, and a couple of bins.
     * Zookeepers are spread over the exhibits round-robin; maintenance
     * workers cover all of them.
     */
    public static void demo(Simulation sim, int zookeepers, int maintenance) {
        ZooWorld world = sim.world();

        for (int x = 1; x < DEMO_WIDTH - 1; x++) {
            world.addPath(GridPos.of(x, 12));
        }
        for (int y = 2; y < DEMO_HEIGHT - 2; y++) {
            world.addPath(GridPos.of(20, y));
        }
        for (int y = 10; y <= 11; y++) {
            world.addPath(GridPos.of(7, y));
            world.addPath(GridPos.of(28, y));
        }
        for (int x = 5; x <= 9; x++) {
            for (int y = 15; y <= 18; y++) {
                world.addWater(GridPos.of(x, y));
            }
        }

        Zone savanna = rectangle(sim, "Lion Savanna", 3, 3, 8, 7, GridPos.of(7, 9));
        Zone plains = rectangle(sim, "Bison Plains", 24, 3, 10, 7, GridPos.of(28, 9));

        world.addAnimal(savanna.id(), GridPos.of(5, 5), FoodType.MEAT);
        world.addAnimal(savanna.id(), GridPos.of(8, 6), FoodType.MEAT);
        world.addAnimal(plains.id(), GridPos.of(26, 4), FoodType.HAY);
        world.addAnimal(plains.id(), GridPos.of(30, 6), FoodType.HAY);
        world.addAnimal(plains.id(), GridPos.of(32, 8), FoodType.HAY);

        world.addBin(GridPos.of(15, 11));
        world.addBin(GridPos.of(25, 13));

        List<Zone> zones = List.of(savanna, plains);
        for (int i = 0; i < zookeepers; i++) {
            StaffWorker keeper = sim.hire(StaffRole.ZOOKEEPER, DEMO_ENTRANCE);
            if (zookeepers == 1) {
                for (Zone zone : zones) {
                    sim.assignZone(keeper.id(), zone.id());
                }
            } else {
                sim.assignZone(keeper.id(), zones.get(i % zones.size()).id());
            }
        }
        // Exhibit fence repairs are filed under their zone, so maintenance covers every exhibit
        for (int i = 0; i < maintenance; i++) {
            StaffWorker worker = sim.hire(StaffRole.MAINTENANCE, DEMO_ENTRANCE);
            for (Zone zone : zones) {
                sim.assignZone(worker.id(), zone.id());
            }
        }
    }

    /**
     * Rectangular exhibit with a fence all around and a gate on the south
     * edge of {@code gateTile}.
     */
    public static Zone rectangle(Simulation sim, String name, int x0, int y0, int width, int height, GridPos gateTile) {
        Set<GridPos> interior = new LinkedHashSet<>();
        for (int y = y0; y < y0 + height; y++) {
            for (int x = x0; x < x0 + width; x++) {
                interior.add(GridPos.of(x, y));
            }
        }
        List<FenceEdge> perimeter = new ArrayList<>();
        for (GridPos tile : interior) {
            for (EdgeDirection dir : EdgeDirection.values()) {
                if (!interior.contains(tile.offset(dir.dx(), dir.dy()))) {
                    perimeter.add(FenceEdge.of(tile, dir));
                }
            }
        }
        FenceEdge gate = gateTile == null ? null : FenceEdge.of(gateTile, EdgeDirection.SOUTH);
        return sim.createZone(name, interior, perimeter, gate);
    }
}
