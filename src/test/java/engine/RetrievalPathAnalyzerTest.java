package engine;

import common.config.PlacementConfig;
import common.consts.ItemStatusEnum;
import common.consts.StepActionEnum;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static engine.PlacementPlannerTest.item;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("取货路径分析测试")
class RetrievalPathAnalyzerTest {

    private RetrievalPathAnalyzer analyzer;
    private Layout layout;

    @BeforeEach
    void setUp() {
        analyzer = new RetrievalPathAnalyzer(new PlacementConfig());
        layout = new Layout(List.of(new Container("C1", "Lab", 20.0, 20.0, 20.0)));
    }

    @Test
    @DisplayName("挡在前面的货物先移开再取出目标")
    void testSingleBlocker() {
        layout.add("C1", new PlacedBox(item("T", 5, 5, 5, 50, "Lab"), Box.of(0, 5, 0, 5, 10, 5)));
        layout.add("C1", new PlacedBox(item("X", 5, 5, 5, 50, "Lab"), Box.of(0, 0, 0, 5, 5, 5)));

        RetrievalPlan plan = analyzer.analyze("T", layout).orElseThrow();

        assertEquals(1, plan.blockerCount());
        assertEquals(2, plan.getSteps().size());
        RetrievalStep first = plan.getSteps().get(0);
        assertEquals(1, first.getStep());
        assertEquals(StepActionEnum.SET_ASIDE, first.getAction());
        assertEquals("X", first.getItemId());
        RetrievalStep last = plan.getSteps().get(1);
        assertEquals(2, last.getStep());
        assertEquals(StepActionEnum.RETRIEVE, last.getAction());
        assertEquals("T", last.getItemId());
    }

    @Test
    @DisplayName("前方无货物时直接取出")
    void testNoBlocker() {
        layout.add("C1", new PlacedBox(item("T", 5, 5, 5, 50, "Lab"), Box.of(0, 5, 0, 5, 10, 5)));
        layout.add("C1", new PlacedBox(item("SIDE", 5, 5, 5, 50, "Lab"), Box.of(5, 0, 0, 10, 5, 5)));
        layout.add("C1", new PlacedBox(item("BACK", 5, 5, 5, 50, "Lab"), Box.of(0, 10, 0, 5, 15, 5)));

        RetrievalPlan plan = analyzer.analyze("T", layout).orElseThrow();

        assertEquals(0, plan.blockerCount());
        assertEquals(1, plan.getSteps().size());
        assertEquals(StepActionEnum.RETRIEVE, plan.getSteps().get(0).getAction());
    }

    @Test
    @DisplayName("多件挡路货物按离舱口由近到远排列")
    void testBlockerOrder() {
        layout.add("C1", new PlacedBox(item("T", 5, 5, 5, 50, "Lab"), Box.of(0, 10, 0, 5, 15, 5)));
        layout.add("C1", new PlacedBox(item("MID", 5, 5, 5, 50, "Lab"), Box.of(0, 5, 0, 5, 10, 5)));
        layout.add("C1", new PlacedBox(item("FRONT", 5, 5, 5, 50, "Lab"), Box.of(2, 0, 0, 7, 5, 5)));

        RetrievalPlan plan = analyzer.analyze("T", layout).orElseThrow();

        assertEquals(List.of("FRONT", "MID", "T"),
                plan.getSteps().stream().map(RetrievalStep::getItemId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("非可用状态的货物不参与阻挡计算")
    void testInactiveIgnored() {
        Item waste = item("W", 5, 5, 5, 50, "Lab");
        waste.setStatus(ItemStatusEnum.WASTE_EXPIRED);
        PlacedBox target = new PlacedBox(item("T", 5, 5, 5, 50, "Lab"), Box.of(0, 5, 0, 5, 10, 5));

        RetrievalPlan plan = analyzer.analyze(target, "C1",
                List.of(target, new PlacedBox(waste, Box.of(0, 0, 0, 5, 5, 5))));

        assertEquals(0, plan.blockerCount());
    }

    @Test
    @DisplayName("货物不在布局中时返回空")
    void testUnknownItem() {
        assertTrue(analyzer.analyze("NOPE", layout).isEmpty());
    }
}
