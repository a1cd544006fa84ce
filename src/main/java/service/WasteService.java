package service;

import common.consts.ErrorCodes;
import common.consts.ItemStatusEnum;
import common.consts.LogActionTypeEnum;
import common.exception.BusinessException;
import common.util.GeometryUtil;
import engine.PlacedBox;
import engine.RetrievalPathAnalyzer;
import engine.RetrievalPlan;
import engine.RetrievalStep;
import lombok.extern.slf4j.Slf4j;
import model.bo.CargoContext;
import model.dto.request.UndockingCompleteReq;
import model.dto.request.WasteReturnPlanReq;
import model.dto.response.ReturnPlanResp;
import model.dto.response.WasteItemDto;
import model.entity.Item;
import model.entity.Placement;
import org.springframework.stereotype.Service;
import service.log.ActionLogService;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 废弃物服务: 识别 -> 回收计划 -> 离港完成
 */
@Service
@Slf4j
public class WasteService {

    public static final String REASON_EXPIRED = "Expired";
    public static final String REASON_OUT_OF_USES = "Out of Uses";

    private final CargoContext context = CargoContext.getInstance();
    private final RetrievalPathAnalyzer analyzer;
    private final ActionLogService actionLog;

    public WasteService(RetrievalPathAnalyzer analyzer, ActionLogService actionLog) {
        this.analyzer = analyzer;
        this.actionLog = actionLog;
    }

    /**
     * 按给定日期判定过期, 返回所有仍在舱内的废弃物
     *
     * @param asOf 判定日期, 为空时取当天
     */
    public List<WasteItemDto> identify(LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();
        synchronized (context) {
            for (Item item : sortedItems()) {
                if (item.isActive() && item.getExpiryDate() != null && !item.getExpiryDate().isAfter(date)) {
                    item.setStatus(ItemStatusEnum.WASTE_EXPIRED);
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("expiryDate", item.getExpiryDate());
                    details.put("asOf", date);
                    actionLog.record(LogActionTypeEnum.WASTE_EXPIRED, item.getItemId(), null,
                            date.atStartOfDay(), details);
                    log.info("货物 {} 已过期 ({}), 转为废弃", item.getItemId(), item.getExpiryDate());
                }
            }

            List<WasteItemDto> result = new ArrayList<>();
            for (Item item : sortedItems()) {
                Placement placement = context.getPlacementMap().get(item.getItemId());
                if (!item.getStatus().isWaste() || placement == null) continue;
                WasteItemDto dto = new WasteItemDto();
                dto.setItemId(item.getItemId());
                dto.setName(item.getName());
                dto.setReason(reasonOf(item));
                dto.setContainerId(placement.getContainerId());
                dto.setPosition(placement.getBox().toPosition());
                result.add(dto);
            }
            return result;
        }
    }

    /**
     * 在载重上限内挑选废弃物装入离港舱 (优先级高的先装), 生成搬运步骤、取货步骤和回收清单
     */
    public ReturnPlanResp returnPlan(WasteReturnPlanReq req) {
        if (req.getUndockingContainerId() == null || req.getUndockingContainerId().isBlank()) {
            throw new BusinessException(ErrorCodes.CONTAINER_NOT_FOUND);
        }
        if (req.getMaxWeight() == null || !(req.getMaxWeight() > 0)) {
            throw new BusinessException(ErrorCodes.INVALID_MAX_WEIGHT);
        }

        synchronized (context) {
            String undockingId = req.getUndockingContainerId();
            if (!context.getContainerMap().containsKey(undockingId)) {
                throw new BusinessException(ErrorCodes.CONTAINER_NOT_FOUND + ": " + undockingId);
            }

            List<Item> candidates = sortedItems().stream()
                    .filter(item -> item.getStatus().isWaste())
                    .filter(item -> context.getPlacementMap().containsKey(item.getItemId()))
                    .sorted(Comparator.comparingInt((Item item) -> item.getPriority() == null ? 0 : item.getPriority())
                            .reversed()
                            .thenComparing(Item::getItemId))
                    .collect(Collectors.toList());

            ReturnPlanResp resp = new ReturnPlanResp();
            ReturnPlanResp.Manifest manifest = new ReturnPlanResp.Manifest();
            manifest.setUndockingContainerId(undockingId);
            manifest.setUndockingDate(req.getUndockingDate());

            double totalWeight = 0;
            double totalVolume = 0;
            for (Item item : candidates) {
                double mass = item.getMass() == null ? 0 : item.getMass();
                if (totalWeight + mass > req.getMaxWeight()) {
                    log.debug("废弃物 {} 超出载重上限, 不纳入本次回收", item.getItemId());
                    continue;
                }
                Placement placement = context.getPlacementMap().get(item.getItemId());
                totalWeight += mass;
                totalVolume += GeometryUtil.volume(placement.getBox());

                RetrievalPlan plan = analyzer.analyze(new PlacedBox(item, placement.getBox()),
                        placement.getContainerId(), coLocated(placement.getContainerId()));
                for (RetrievalStep step : plan.getSteps()) {
                    resp.getRetrievalSteps().add(new RetrievalStep(resp.getRetrievalSteps().size() + 1,
                            step.getAction(), step.getItemId(), step.getItemName()));
                }
                resp.getReturnPlan().add(new ReturnPlanResp.ReturnStep(resp.getReturnPlan().size() + 1,
                        item.getItemId(), item.getName(), placement.getContainerId(), undockingId));
                manifest.getReturnItems().add(new ReturnPlanResp.ManifestItem(item.getItemId(), item.getName(),
                        reasonOf(item)));

                context.getDisposalPlanMap().put(item.getItemId(), undockingId);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("fromContainer", placement.getContainerId());
                details.put("undockingContainerId", undockingId);
                details.put("undockingDate", req.getUndockingDate());
                actionLog.record(LogActionTypeEnum.DISPOSAL_PLAN, item.getItemId(), req.getUserId(), null, details);
            }

            manifest.setTotalWeight(totalWeight);
            manifest.setTotalVolume(totalVolume);
            resp.setReturnManifest(manifest);
            log.info("回收计划: 离港舱 {}, 废弃物 {} 件, 总重 {}", undockingId,
                    manifest.getReturnItems().size(), totalWeight);
            return resp;
        }
    }

    /**
     * 离港完成: 计划内的废弃物转为已处置并移除放置
     *
     * @return 处置的货物数量
     */
    public int completeUndocking(UndockingCompleteReq req) {
        String undockingId = req.getUndockingContainerId();
        if (undockingId == null || undockingId.isBlank()) {
            throw new BusinessException(ErrorCodes.CONTAINER_NOT_FOUND);
        }

        synchronized (context) {
            List<String> planned = context.getDisposalPlanMap().entrySet().stream()
                    .filter(e -> undockingId.equals(e.getValue()))
                    .map(Map.Entry::getKey)
                    .sorted()
                    .collect(Collectors.toList());

            int removed = 0;
            for (String itemId : planned) {
                context.getDisposalPlanMap().remove(itemId);
                Item item = context.getItemMap().get(itemId);
                if (item == null || !item.getStatus().canTransitTo(ItemStatusEnum.DISPOSED)) {
                    log.warn("货物 {} 状态不允许处置, 跳过", itemId);
                    continue;
                }
                item.setStatus(ItemStatusEnum.DISPOSED);
                Placement placement = context.getPlacementMap().remove(itemId);

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("undockingContainerId", undockingId);
                if (placement != null) {
                    details.put("fromContainer", placement.getContainerId());
                }
                actionLog.record(LogActionTypeEnum.DISPOSAL_COMPLETE, itemId, req.getUserId(),
                        req.getTimestamp(), details);
                removed++;
            }
            log.info("离港舱 {} 离港完成, 处置废弃物 {} 件", undockingId, removed);
            return removed;
        }
    }

    private List<PlacedBox> coLocated(String containerId) {
        List<PlacedBox> result = new ArrayList<>();
        for (Placement placement : context.getPlacementMap().values()) {
            if (!containerId.equals(placement.getContainerId())) continue;
            Item item = context.getItemMap().get(placement.getItemId());
            if (item != null) {
                result.add(new PlacedBox(item, placement.getBox()));
            }
        }
        return result;
    }

    private List<Item> sortedItems() {
        List<Item> items = new ArrayList<>(context.getItemMap().values());
        items.sort(Comparator.comparing(Item::getItemId));
        return items;
    }

    private static String reasonOf(Item item) {
        return item.getStatus() == ItemStatusEnum.WASTE_EXPIRED ? REASON_EXPIRED : REASON_OUT_OF_USES;
    }
}
