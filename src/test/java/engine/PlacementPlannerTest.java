package engine;

import common.config.PlacementConfig;
import common.consts.PlanErrorEnum;
import common.util.GeometryUtil;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 装载规划测试
 */
@DisplayName("装载规划测试")
class PlacementPlannerTest {

    private PlacementPlanner planner;

    @BeforeEach
    void setUp() {
        PlacementConfig config = new PlacementConfig();
        SpotFinder spotFinder = new SpotFinder(config);
        planner = new PlacementPlanner(spotFinder, new RearrangementPlanner(spotFinder, config), config);
    }

    static Item item(String id, double w, double d, double h, int priority, String zone) {
        Item item = new Item();
        item.setItemId(id);
        item.setName("name-" + id);
        item.setWidth(w);
        item.setDepth(d);
        item.setHeight(h);
        item.setMass(1.0);
        item.setPriority(priority);
        item.setPreferredZone(zone);
        return item;
    }

    @Test
    @DisplayName("单件货物放在原点")
    void testSingleItemAtOrigin() {
        Layout snapshot = new Layout(List.of(new Container("C1", "Lab", 20.0, 20.0, 20.0)));
        PlacementPlan plan = planner.plan(List.of(item("A", 10, 10, 10, 50, "Lab")), snapshot);

        assertTrue(plan.isComplete());
        assertEquals(1, plan.getPlacements().size());
        PlacementChange change = plan.getPlacements().get(0);
        assertEquals("A", change.getItemId());
        assertEquals("C1", change.getContainerId());
        assertEquals(Box.of(0, 0, 0, 10, 10, 10), change.getBox());
        assertTrue(plan.getRearrangements().isEmpty());
    }

    @Test
    @DisplayName("放不下的货物进入失败列表")
    void testOversizedItemFails() {
        Layout snapshot = new Layout(List.of(new Container("C1", "Lab", 10.0, 10.0, 10.0)));
        PlacementPlan plan = planner.plan(List.of(item("C", 15, 15, 15, 50, "Lab")), snapshot);

        assertFalse(plan.isComplete());
        assertTrue(plan.getPlacements().isEmpty());
        assertEquals(List.of("C"), plan.failedItemIds());
        assertEquals(PlanErrorEnum.NO_SPOT_FOUND, plan.getFailures().get(0).getError());
    }

    @Test
    @DisplayName("高优先级货物腾挪低优先级货物")
    void testEvictionForHigherPriority() {
        Layout snapshot = new Layout(List.of(
                new Container("P", "Lab", 10.0, 10.0, 10.0),
                new Container("O", "Storage", 10.0, 10.0, 10.0)));
        snapshot.add("P", new PlacedBox(item("A", 10, 10, 10, 10, "Lab"), Box.of(0, 0, 0, 10, 10, 10)));

        PlacementPlan plan = planner.plan(List.of(item("B", 10, 10, 10, 90, "Lab")), snapshot);

        assertTrue(plan.isComplete());
        assertEquals(1, plan.getRearrangements().size());
        RearrangementStep move = plan.getRearrangements().get(0);
        assertEquals(1, move.getStep());
        assertEquals("A", move.getItemId());
        assertEquals("P", move.getFromContainer());
        assertEquals("O", move.getToContainer());
        assertEquals(Box.of(0, 0, 0, 10, 10, 10), move.getFromBox());

        Layout after = plan.getLayout();
        assertEquals("P", after.containerOf("B").orElseThrow());
        assertEquals("O", after.containerOf("A").orElseThrow());
        assertEquals(2, plan.getPlacements().size());

        // 快照不受影响
        assertEquals("P", snapshot.containerOf("A").orElseThrow());
        assertFalse(snapshot.contains("B"));
    }

    @Test
    @DisplayName("同优先级货物不会被腾挪, 改放其他区域")
    void testNoEvictionOfEqualPriority() {
        Layout snapshot = new Layout(List.of(
                new Container("P", "Lab", 10.0, 10.0, 10.0),
                new Container("O", "Storage", 10.0, 10.0, 10.0)));
        snapshot.add("P", new PlacedBox(item("A", 10, 10, 10, 70, "Lab"), Box.of(0, 0, 0, 10, 10, 10)));

        PlacementPlan plan = planner.plan(List.of(item("B", 10, 10, 10, 70, "Lab")), snapshot);

        assertTrue(plan.isComplete());
        assertTrue(plan.getRearrangements().isEmpty());
        assertEquals("O", plan.getLayout().containerOf("B").orElseThrow());
        assertEquals("P", plan.getLayout().containerOf("A").orElseThrow());
    }

    @Test
    @DisplayName("按优先级从高到低放置")
    void testPriorityOrder() {
        Layout snapshot = new Layout(List.of(new Container("C1", "Lab", 10.0, 10.0, 10.0)));
        PlacementPlan plan = planner.plan(List.of(
                item("LOW", 10, 10, 10, 5, "Lab"),
                item("HIGH", 10, 10, 10, 95, "Lab")), snapshot);

        assertEquals(List.of("LOW"), plan.failedItemIds());
        assertEquals("HIGH", plan.getPlacements().get(0).getItemId());
    }

    @Test
    @DisplayName("优先放入偏好区域的储物箱")
    void testPreferredZone() {
        Layout snapshot = new Layout(List.of(
                new Container("A1", "Airlock", 20.0, 20.0, 20.0),
                new Container("M1", "Medical", 20.0, 20.0, 20.0)));
        PlacementPlan plan = planner.plan(List.of(
                item("MED", 5, 5, 5, 60, "Medical"),
                item("ANY", 5, 5, 5, 60, null)), snapshot);

        assertTrue(plan.isComplete());
        assertEquals("M1", plan.getLayout().containerOf("MED").orElseThrow());
        // 没有偏好区域的货物按储物箱顺序放置
        assertEquals("A1", plan.getLayout().containerOf("ANY").orElseThrow());
    }

    @Test
    @DisplayName("非法输入被拒绝, 不影响其他货物")
    void testInvalidInputRejected() {
        Layout snapshot = new Layout(List.of(new Container("C1", "Lab", 20.0, 20.0, 20.0)));
        Item zeroWidth = item("BAD", 0, 5, 5, 50, "Lab");
        Item badPriority = item("BAD2", 5, 5, 5, 150, "Lab");

        PlacementPlan plan = planner.plan(List.of(zeroWidth, item("OK", 5, 5, 5, 50, "Lab"), badPriority,
                item("OK", 5, 5, 5, 50, "Lab")), snapshot);

        assertEquals(1, plan.getPlacements().size());
        assertEquals("OK", plan.getPlacements().get(0).getItemId());
        assertEquals(3, plan.getRejected().size());
        plan.getRejected().forEach(issue -> assertEquals(PlanErrorEnum.INPUT_INVALID, issue.getError()));
        assertTrue(plan.failedItemIds().containsAll(List.of("BAD", "BAD2", "OK")));
    }

    @Test
    @DisplayName("已放置的货物再次提交不产生变更")
    void testAlreadyPlacedIsIdempotent() {
        Layout snapshot = new Layout(List.of(new Container("C1", "Lab", 20.0, 20.0, 20.0)));
        Item a = item("A", 10, 10, 10, 50, "Lab");
        PlacementPlan first = planner.plan(List.of(a), snapshot);

        PlacementPlan second = planner.plan(List.of(a), first.getLayout());
        assertTrue(second.isComplete());
        assertFalse(second.hasChanges());
        assertEquals(first.getLayout().find("A").orElseThrow().getBox(),
                second.getLayout().find("A").orElseThrow().getBox());
    }

    @Test
    @DisplayName("批量放置后布局始终满足边界、互不重叠与支撑约束")
    void testBatchInvariants() {
        List<Container> containers = List.of(
                new Container("L1", "Lab", 30.0, 30.0, 30.0),
                new Container("L2", "Lab", 20.0, 25.0, 15.0),
                new Container("S1", "Storage", 40.0, 20.0, 20.0));
        Layout snapshot = new Layout(containers);

        List<Item> items = new ArrayList<>();
        String[] zones = {"Lab", "Storage", null};
        for (int i = 0; i < 18; i++) {
            double w = 3 + (i * 7) % 11;
            double d = 2 + (i * 5) % 9;
            double h = 4 + (i * 3) % 8;
            items.add(item(String.format("I%02d", i), w, d, h, (i * 37) % 101, zones[i % 3]));
        }

        PlacementPlan plan = planner.plan(items, snapshot);
        Layout layout = plan.getLayout();

        assertEquals(items.size(), layout.placedCount() + plan.getFailures().size());
        for (Container container : containers) {
            List<Box> boxes = layout.boxes(container.getContainerId());
            for (int i = 0; i < boxes.size(); i++) {
                Box box = boxes.get(i);
                assertTrue(GeometryUtil.withinBounds(box, container.dimensions()), "越界: " + box);
                assertTrue(GeometryUtil.isSupported(box, boxes, GeometryUtil.DEFAULT_TOLERANCE), "悬空: " + box);
                for (int j = i + 1; j < boxes.size(); j++) {
                    assertFalse(GeometryUtil.overlaps(box, boxes.get(j)), "重叠: " + box + " / " + boxes.get(j));
                }
            }
        }
        // 每件放置的货物都能在变更中找到
        assertEquals(layout.placedCount(), plan.getPlacements().size());
    }

    @Test
    @DisplayName("同一批次中刚放入的货物不会被腾挪")
    void testSameRequestPlacementsNotEvicted() {
        Layout snapshot = new Layout(List.of(
                new Container("P", "Lab", 10.0, 10.0, 10.0),
                new Container("Q", "Storage", 10.0, 10.0, 10.0)));
        snapshot.add("P", new PlacedBox(item("E", 10, 10, 5, 10, "Lab"), Box.of(0, 0, 0, 10, 10, 5)));

        PlacementPlan plan = planner.plan(List.of(
                item("H", 10, 10, 10, 90, "Lab"),
                item("L", 10, 10, 5, 20, "Lab")), snapshot);

        assertTrue(plan.isComplete());
        assertTrue(plan.getRearrangements().isEmpty());
        assertEquals("P", plan.getLayout().containerOf("L").orElseThrow());
        assertEquals("P", plan.getLayout().containerOf("E").orElseThrow());
        assertEquals("Q", plan.getLayout().containerOf("H").orElseThrow());
        // E 没有移动, 不出现在变更中
        assertEquals(2, plan.getPlacements().size());
    }

    @Test
    @DisplayName("腾挪后直接重试的低优先级货物仍从深处放置")
    void testDirectRetryKeepsDepthPreference() {
        Layout snapshot = new Layout(List.of(
                new Container("P", "Lab", 10.0, 30.0, 10.0),
                new Container("Q", "Storage", 10.0, 10.0, 10.0)));
        snapshot.add("P", new PlacedBox(item("A", 10, 10, 10, 5, "Lab"), Box.of(0, 0, 0, 10, 10, 10)));
        snapshot.add("P", new PlacedBox(item("B", 10, 10, 10, 5, "Lab"), Box.of(0, 10, 0, 10, 20, 10)));
        snapshot.add("P", new PlacedBox(item("C", 10, 10, 10, 5, "Lab"), Box.of(0, 20, 0, 10, 30, 10)));

        // H 移走 A 后只占用靠舱口的一半, M 放入剩下的空隙
        PlacementPlan plan = planner.plan(List.of(
                item("H", 10, 5, 10, 90, "Lab"),
                item("M", 10, 2.5, 10, 30, "Lab")), snapshot);

        assertTrue(plan.isComplete());
        assertEquals(1, plan.getRearrangements().size());
        assertEquals("A", plan.getRearrangements().get(0).getItemId());
        Box h = plan.getLayout().find("H").orElseThrow().getBox();
        assertEquals(0.0, h.getStartD(), 1e-9);
        Box m = plan.getLayout().find("M").orElseThrow().getBox();
        assertEquals("P", plan.getLayout().containerOf("M").orElseThrow());
        assertEquals(7.5, m.getStartD(), 1e-9);
        assertEquals(10.0, m.getEndD(), 1e-9);
    }
}
