package service;

import common.consts.ErrorCodes;
import common.consts.LogActionTypeEnum;
import common.consts.PlanErrorEnum;
import common.exception.BusinessException;
import common.exception.PersistenceException;
import engine.ItemIssue;
import engine.Layout;
import engine.PlacementChange;
import engine.PlacementPlan;
import engine.PlacementPlanner;
import engine.PlanValidator;
import engine.RearrangementStep;
import lombok.extern.slf4j.Slf4j;
import model.bo.CargoContext;
import model.dto.request.PlacementReq;
import model.dto.response.ItemIssueDto;
import model.dto.response.PlacementDto;
import model.dto.response.PlacementResp;
import model.dto.response.RearrangementStepDto;
import model.entity.Container;
import model.entity.Item;
import org.springframework.stereotype.Service;
import service.log.ActionLogService;
import service.store.CargoStore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 装载服务
 * 负责连接 Controller、规划引擎与存储: 读取快照 -> 规划 -> 整体提交 -> 记录操作日志
 */
@Service
@Slf4j
public class PlacementService {

    private final CargoContext context = CargoContext.getInstance();
    private final PlacementPlanner planner;
    private final CargoStore store;
    private final ActionLogService actionLog;

    public PlacementService(PlacementPlanner planner, CargoStore store, ActionLogService actionLog) {
        this.planner = planner;
        this.store = store;
        this.actionLog = actionLog;
    }

    public PlacementResp placeItems(PlacementReq req) {
        List<Item> items = req.getItems() == null ? List.of()
                : req.getItems().stream().filter(Objects::nonNull).collect(Collectors.toList());

        // 规划与提交期间持有全局锁
        synchronized (context) {
            syncStoredStatus(items);
            List<Container> containers = resolveContainers(req.getContainers());
            Layout snapshot = store.loadLayout(containers);
            PlacementPlan plan = planner.plan(items, snapshot);

            try {
                store.applyPlan(containers, items, plan);
            } catch (PersistenceException e) {
                log.error("装载结果提交失败, 本次规划作废: {} {}", e.getMessage(), e.getViolations());
                return persistenceFailure(items, e);
            }

            recordActions(plan, req.getUserId());
            return toResp(plan);
        }
    }

    /**
     * 所有当前放置, 按储物箱、货物排序
     */
    public List<PlacementDto> listPlacements() {
        return context.getPlacementMap().values().stream()
                .map(PlacementDto::from)
                .sorted(Comparator.comparing(PlacementDto::getContainerId).thenComparing(PlacementDto::getItemId))
                .collect(Collectors.toList());
    }

    /**
     * 已存储的货物以存储中的状态为准, 废弃或已处置的货物在规划时按非法输入拒绝
     */
    private void syncStoredStatus(List<Item> items) {
        for (Item item : items) {
            Item stored = item.getItemId() == null ? null : context.getItemMap().get(item.getItemId());
            if (stored != null && !stored.isActive()) {
                log.warn("货物 {} 已是 {} 状态, 不能重新装载", item.getItemId(), stored.getStatus().getDesc());
                item.setStatus(stored.getStatus());
            }
        }
    }

    /**
     * 请求未带储物箱时使用存储中的全部储物箱
     */
    private List<Container> resolveContainers(List<Container> requested) {
        if (requested == null || requested.isEmpty()) {
            return store.listContainers();
        }
        Set<String> seen = new HashSet<>();
        for (Container container : requested) {
            Optional<String> invalid = PlanValidator.validateContainer(container);
            if (invalid.isPresent()) {
                throw new BusinessException("储物箱 " + container.getContainerId() + " 非法: " + invalid.get());
            }
            if (!seen.add(container.getContainerId())) {
                throw new BusinessException(ErrorCodes.DUPLICATE_CONTAINER + ": " + container.getContainerId());
            }
        }
        return requested;
    }

    private void recordActions(PlacementPlan plan, String userId) {
        LocalDateTime now = LocalDateTime.now();
        Set<String> moved = plan.getRearrangements().stream()
                .map(RearrangementStep::getItemId)
                .collect(Collectors.toSet());

        for (RearrangementStep move : plan.getRearrangements()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step", move.getStep());
            details.put("fromContainer", move.getFromContainer());
            details.put("fromPosition", move.getFromBox().toPosition());
            details.put("toContainer", move.getToContainer());
            details.put("toPosition", move.getToBox().toPosition());
            actionLog.record(LogActionTypeEnum.REARRANGEMENT, move.getItemId(), userId, now, details);
        }
        for (PlacementChange change : plan.getPlacements()) {
            if (moved.contains(change.getItemId())) continue;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("containerId", change.getContainerId());
            details.put("position", change.getBox().toPosition());
            actionLog.record(LogActionTypeEnum.PLACEMENT, change.getItemId(), userId, now, details);
        }
        for (ItemIssue issue : plan.getFailures()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", issue.getReason());
            actionLog.record(LogActionTypeEnum.PLACEMENT_FAILED, issue.getItemId(), userId, now, details);
        }
    }

    private PlacementResp toResp(PlacementPlan plan) {
        PlacementResp resp = new PlacementResp();
        resp.setSuccess(plan.isComplete());
        resp.setPlacements(plan.getPlacements().stream()
                .map(c -> new PlacementDto(c.getItemId(), c.getContainerId(), c.getBox().toPosition()))
                .collect(Collectors.toList()));
        resp.setRearrangements(plan.getRearrangements().stream()
                .map(RearrangementStepDto::from)
                .collect(Collectors.toList()));
        resp.setFailedItemIds(plan.failedItemIds());
        List<ItemIssueDto> issues = new ArrayList<>();
        for (ItemIssue issue : plan.getRejected()) {
            issues.add(new ItemIssueDto(issue.getItemId(), issue.getError().getCode(), issue.getReason()));
        }
        resp.setRejectedItems(issues);
        if (!plan.isComplete()) {
            resp.setError("部分货物未能放置: " + String.join(", ", plan.failedItemIds()));
        }
        return resp;
    }

    /**
     * 提交失败: 不返回任何放置, 全部货物记为失败
     */
    private PlacementResp persistenceFailure(List<Item> items, PersistenceException e) {
        PlacementResp resp = new PlacementResp();
        resp.setSuccess(false);
        List<String> ids = new ArrayList<>();
        List<ItemIssueDto> issues = new ArrayList<>();
        for (Item item : items) {
            ids.add(item.getItemId());
            issues.add(new ItemIssueDto(item.getItemId(), PlanErrorEnum.PERSISTENCE_FAILURE.getCode(), e.getMessage()));
        }
        resp.setFailedItemIds(ids);
        resp.setRejectedItems(issues);
        resp.setError(PlanErrorEnum.PERSISTENCE_FAILURE.getDesc() + ": " + e.getMessage());
        resp.setErrorCode(PlanErrorEnum.PERSISTENCE_FAILURE.getCode());
        return resp;
    }
}
