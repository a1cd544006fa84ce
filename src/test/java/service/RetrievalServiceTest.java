package service;

import common.config.PlacementConfig;
import common.consts.ItemStatusEnum;
import common.consts.LogActionTypeEnum;
import common.consts.StepActionEnum;
import common.exception.BusinessException;
import engine.RetrievalPathAnalyzer;
import model.bo.CargoContext;
import model.dto.request.PlaceReq;
import model.dto.request.RetrieveReq;
import model.dto.response.SearchResp;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import model.entity.Placement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.log.ActionLogService;
import service.store.impl.InMemoryCargoStore;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("取货服务测试")
class RetrievalServiceTest {

    private CargoContext context;
    private ActionLogService actionLog;
    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        context = CargoContext.getInstance();
        context.clearAll();
        PlacementConfig config = new PlacementConfig();
        actionLog = new ActionLogService(100);
        retrievalService = new RetrievalService(new RetrievalPathAnalyzer(config),
                new InMemoryCargoStore(config), actionLog, config);

        context.getContainerMap().put("C1", new Container("C1", "Lab", 20.0, 20.0, 20.0));
        context.getContainerMap().put("C2", new Container("C2", "Storage", 20.0, 20.0, 20.0));
        // C1: 舱口一侧的 X 挡住深处的 T
        put("T", "Wrench", "C1", Box.of(0, 5, 0, 5, 10, 5));
        put("X", "Tape", "C1", Box.of(0, 0, 0, 5, 5, 5));
        // C2: 另一把扳手前面没有遮挡
        put("T2", "Wrench", "C2", Box.of(0, 0, 0, 5, 5, 5));
    }

    private Item put(String id, String name, String containerId, Box box) {
        Item item = new Item();
        item.setItemId(id);
        item.setName(name);
        item.setWidth(box.sizeW());
        item.setDepth(box.sizeD());
        item.setHeight(box.sizeH());
        item.setMass(1.0);
        item.setPriority(50);
        context.getItemMap().put(id, item);
        context.getPlacementMap().put(id, new Placement(id, containerId, box));
        return item;
    }

    private static RetrieveReq retrieveReq(String itemId) {
        RetrieveReq req = new RetrieveReq();
        req.setItemId(itemId);
        req.setUserId("astronaut-1");
        req.setTimestamp(LocalDateTime.of(2030, 1, 1, 8, 0));
        return req;
    }

    @Test
    @DisplayName("按ID查找: 返回位置和取货步骤")
    void testSearchById() {
        SearchResp resp = retrievalService.search("T", null);

        assertTrue(resp.isFound());
        assertEquals("C1", resp.getItem().getContainerId());
        assertEquals("Lab", resp.getItem().getZone());
        assertEquals(2, resp.getRetrievalSteps().size());
        assertEquals(StepActionEnum.SET_ASIDE, resp.getRetrievalSteps().get(0).getAction());
        assertEquals("X", resp.getRetrievalSteps().get(0).getItemId());
        assertEquals(StepActionEnum.RETRIEVE, resp.getRetrievalSteps().get(1).getAction());
    }

    @Test
    @DisplayName("按名称查找: 同名货物选取挡路最少的一件")
    void testSearchByNamePicksEasiest() {
        SearchResp resp = retrievalService.search(null, "Wrench");

        assertTrue(resp.isFound());
        assertEquals("T2", resp.getItem().getItemId());
        assertEquals(1, resp.getRetrievalSteps().size());
    }

    @Test
    @DisplayName("查找条件为空时报业务异常, 找不到时返回未找到")
    void testSearchEdgeCases() {
        assertThrows(BusinessException.class, () -> retrievalService.search(null, " "));
        assertFalse(retrievalService.search("NOPE", null).isFound());
    }

    @Test
    @DisplayName("取用达到次数上限后转为废弃")
    void testRetrieveUntilDepleted() {
        context.getItemMap().get("X").setUsageLimit(2);

        Item first = retrievalService.retrieve(retrieveReq("X"));
        assertEquals(1, first.getCurrentUses());
        assertEquals(ItemStatusEnum.ACTIVE, first.getStatus());

        Item second = retrievalService.retrieve(retrieveReq("X"));
        assertEquals(ItemStatusEnum.WASTE_DEPLETED, second.getStatus());
        assertEquals(Integer.valueOf(0), second.remainingUses());

        assertThrows(BusinessException.class, () -> retrievalService.retrieve(retrieveReq("X")));
        assertEquals(2, actionLog.query("X", null, LogActionTypeEnum.RETRIEVAL, null, null).size());
        assertEquals(1, actionLog.query("X", null, LogActionTypeEnum.WASTE_DEPLETED, null, null).size());

        // 废弃物不再挡路
        assertEquals(1, retrievalService.search("T", null).getRetrievalSteps().size());
    }

    @Test
    @DisplayName("取用不存在的货物报业务异常")
    void testRetrieveUnknown() {
        assertThrows(BusinessException.class, () -> retrievalService.retrieve(retrieveReq("NOPE")));
    }

    @Test
    @DisplayName("放回: 校验重叠、支撑后更新位置")
    void testPlace() {
        PlaceReq req = new PlaceReq();
        req.setItemId("X");
        req.setUserId("astronaut-1");
        req.setContainerId("C2");

        req.setPosition(Box.of(0, 0, 0, 5, 5, 5).toPosition());
        assertThrows(BusinessException.class, () -> retrievalService.place(req), "与 T2 重叠");

        req.setPosition(Box.of(10, 0, 10, 15, 5, 15).toPosition());
        assertThrows(BusinessException.class, () -> retrievalService.place(req), "悬空");

        req.setPosition(Box.of(18, 0, 0, 23, 5, 5).toPosition());
        assertThrows(BusinessException.class, () -> retrievalService.place(req), "越界");

        req.setPosition(Box.of(0, 0, 5, 5, 5, 10).toPosition());
        Placement placement = retrievalService.place(req);
        assertEquals("C2", placement.getContainerId());
        assertEquals("C2", context.getPlacementMap().get("X").getContainerId());
        assertEquals(1, actionLog.query("X", null, LogActionTypeEnum.UPDATE_LOCATION, null, null).size());

        // X 移走后 T 可以直接取出
        assertEquals(1, retrievalService.search("T", null).getRetrievalSteps().size());
    }
}
