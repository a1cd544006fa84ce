package service;

import common.config.PlacementConfig;
import common.consts.ErrorCodes;
import common.consts.ItemStatusEnum;
import common.consts.LogActionTypeEnum;
import common.exception.BusinessException;
import common.util.GeometryUtil;
import engine.Layout;
import engine.RetrievalPathAnalyzer;
import engine.RetrievalPlan;
import engine.PlanValidator;
import lombok.extern.slf4j.Slf4j;
import model.bo.CargoContext;
import model.dto.request.PlaceReq;
import model.dto.request.RetrieveReq;
import model.dto.response.ItemLocationDto;
import model.dto.response.SearchResp;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import model.entity.Placement;
import org.springframework.stereotype.Service;
import service.log.ActionLogService;
import service.store.CargoStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 取货服务: 货物定位 + 取货步骤、取用登记、放回
 */
@Service
@Slf4j
public class RetrievalService {

    private final CargoContext context = CargoContext.getInstance();
    private final RetrievalPathAnalyzer analyzer;
    private final CargoStore store;
    private final ActionLogService actionLog;
    private final PlacementConfig config;

    public RetrievalService(RetrievalPathAnalyzer analyzer, CargoStore store,
                            ActionLogService actionLog, PlacementConfig config) {
        this.analyzer = analyzer;
        this.store = store;
        this.actionLog = actionLog;
        this.config = config;
    }

    /**
     * 按ID或名称定位可用货物; 同名货物有多件时选挡路货物最少的一件
     */
    public SearchResp search(String itemId, String itemName) {
        boolean byId = itemId != null && !itemId.isBlank();
        boolean byName = itemName != null && !itemName.isBlank();
        if (!byId && !byName) {
            throw new BusinessException(ErrorCodes.MISSING_QUERY);
        }

        synchronized (context) {
            List<Item> candidates = new ArrayList<>();
            for (Item item : context.getItemMap().values()) {
                if (!item.isActive() || !context.getPlacementMap().containsKey(item.getItemId())) continue;
                if (byId ? item.getItemId().equals(itemId) : itemName.equals(item.getName())) {
                    candidates.add(item);
                }
            }
            candidates.sort(Comparator.comparing(Item::getItemId));

            RetrievalPlan best = null;
            for (Item candidate : candidates) {
                Optional<RetrievalPlan> plan = planFor(candidate.getItemId());
                if (plan.isPresent() && (best == null || plan.get().blockerCount() < best.blockerCount())) {
                    best = plan.get();
                }
            }

            SearchResp resp = new SearchResp();
            if (best == null) {
                resp.setFound(false);
                return resp;
            }
            Container container = context.getContainerMap().get(best.getContainerId());
            ItemLocationDto location = new ItemLocationDto();
            location.setItemId(best.getTarget().getItemId());
            location.setName(best.getTarget().getItem().getName());
            location.setContainerId(best.getContainerId());
            location.setZone(container.getZone());
            location.setPosition(best.getTarget().getBox().toPosition());

            resp.setFound(true);
            resp.setItem(location);
            resp.setRetrievalSteps(best.getSteps());
            return resp;
        }
    }

    /**
     * 取用登记: 使用次数 +1, 达到上限时转为废弃 (耗尽)
     */
    public Item retrieve(RetrieveReq req) {
        synchronized (context) {
            Item item = requireItem(req.getItemId());
            if (!item.isActive()) {
                throw new BusinessException(ErrorCodes.ITEM_NOT_ACTIVE + ": " + item.getStatus().getDesc());
            }

            if (item.getUsageLimit() != null) {
                if (item.getCurrentUses() >= item.getUsageLimit()) {
                    throw new BusinessException(ErrorCodes.USAGE_LIMIT_EXCEEDED);
                }
                item.setCurrentUses(item.getCurrentUses() + 1);
                if (item.getCurrentUses() >= item.getUsageLimit()) {
                    item.setStatus(ItemStatusEnum.WASTE_DEPLETED);
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("reason", "取用后使用次数达到上限");
                    details.put("usageLimit", item.getUsageLimit());
                    actionLog.record(LogActionTypeEnum.WASTE_DEPLETED, item.getItemId(), req.getUserId(),
                            req.getTimestamp(), details);
                    log.info("货物 {} 使用次数耗尽, 转为废弃", item.getItemId());
                }
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("remainingUses", item.remainingUses());
            details.put("status", item.getStatus());
            Placement placement = context.getPlacementMap().get(item.getItemId());
            if (placement != null) {
                details.put("containerId", placement.getContainerId());
                details.put("position", placement.getBox().toPosition());
            }
            actionLog.record(LogActionTypeEnum.RETRIEVAL, item.getItemId(), req.getUserId(), req.getTimestamp(), details);
            return item;
        }
    }

    /**
     * 放回或移动单件货物到指定位置, 校验边界、重叠与支撑
     */
    public Placement place(PlaceReq req) {
        synchronized (context) {
            Item item = requireItem(req.getItemId());
            if (!item.isActive()) {
                throw new BusinessException(ErrorCodes.ITEM_NOT_ACTIVE + ": " + item.getStatus().getDesc());
            }
            Container container = context.getContainerMap().get(req.getContainerId());
            if (container == null) {
                throw new BusinessException(ErrorCodes.CONTAINER_NOT_FOUND + ": " + req.getContainerId());
            }
            if (req.getPosition() == null || req.getPosition().getStartCoordinates() == null
                    || req.getPosition().getEndCoordinates() == null) {
                throw new BusinessException(ErrorCodes.INVALID_BOX);
            }
            Box box = req.getPosition().toBox();
            PlanValidator.validateBox(box).ifPresent(reason -> {
                throw new BusinessException(reason);
            });

            double tol = config.getTolerance();
            if (!GeometryUtil.withinBounds(box, container.dimensions(), tol)) {
                throw new BusinessException(ErrorCodes.OUT_OF_BOUNDS);
            }
            List<Box> others = new ArrayList<>();
            for (Placement other : context.getPlacementMap().values()) {
                if (other.getItemId().equals(item.getItemId())
                        || !other.getContainerId().equals(container.getContainerId())) continue;
                Item otherItem = context.getItemMap().get(other.getItemId());
                if (otherItem == null || !otherItem.isActive()) continue;
                if (GeometryUtil.overlaps(box, other.getBox(), tol)) {
                    throw new BusinessException(ErrorCodes.POSITION_OVERLAP + ": " + other.getItemId());
                }
                others.add(other.getBox());
            }
            if (!GeometryUtil.isSupported(box, others, tol)) {
                throw new BusinessException(ErrorCodes.POSITION_UNSUPPORTED);
            }

            Placement previous = context.getPlacementMap().get(item.getItemId());
            Placement updated = new Placement(item.getItemId(), container.getContainerId(), box);
            context.getPlacementMap().put(item.getItemId(), updated);

            Map<String, Object> details = new LinkedHashMap<>();
            if (previous != null) {
                details.put("fromContainer", previous.getContainerId());
                details.put("fromPosition", previous.getBox().toPosition());
            }
            details.put("toContainer", container.getContainerId());
            details.put("toPosition", box.toPosition());
            actionLog.record(LogActionTypeEnum.UPDATE_LOCATION, item.getItemId(), req.getUserId(),
                    req.getTimestamp(), details);
            log.info("货物 {} 放置到 {} {}", item.getItemId(), container.getContainerId(), box);
            return updated;
        }
    }

    /**
     * 计算指定货物的取货步骤; 货物未放置时为空
     */
    public Optional<RetrievalPlan> planFor(String itemId) {
        synchronized (context) {
            Placement placement = context.getPlacementMap().get(itemId);
            if (placement == null) {
                return Optional.empty();
            }
            Container container = context.getContainerMap().get(placement.getContainerId());
            if (container == null) {
                return Optional.empty();
            }
            Layout layout = store.loadLayout(List.of(container));
            return analyzer.analyze(itemId, layout);
        }
    }

    private Item requireItem(String itemId) {
        if (itemId == null || itemId.isBlank()) {
            throw new BusinessException(ErrorCodes.MISSING_ITEM_ID);
        }
        Item item = context.getItemMap().get(itemId);
        if (item == null) {
            throw new BusinessException(ErrorCodes.ITEM_NOT_FOUND + ": " + itemId);
        }
        return item;
    }
}
