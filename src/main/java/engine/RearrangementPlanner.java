package engine;

import common.config.PlacementConfig;
import common.consts.StepActionEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 腾挪规划: 高优先级货物在偏好区域放不下时, 移走区域内优先级更低的货物为其让位
 *
 * 每个腾挪方案都在布局副本上试算, 只有高优先级货物放得下
 * 且所有被移走的货物都在其他储物箱找到新位置时才采纳; 否则丢弃副本, 原布局不变。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RearrangementPlanner {

    private final SpotFinder spotFinder;
    private final PlacementConfig config;

    /**
     * @param item                 待放置的高优先级货物
     * @param preferredContainers  偏好区域内的储物箱 (按请求顺序)
     * @param layout               当前布局, 不会被修改
     * @param movable              允许移走的货物 (规划前已在存储中的货物), 本次请求新放入的货物不参与腾挪
     * @return 采纳的方案; 无可行方案时为空
     */
    public Optional<Rearrangement> rearrange(Item item, List<Container> preferredContainers, Layout layout,
                                             Set<String> movable) {
        List<Eviction> strategies = buildStrategies(item, preferredContainers, layout, movable);
        if (strategies.isEmpty()) {
            log.info("货物 {} 的偏好区域内没有优先级更低的货物可腾挪", item.getItemId());
            return Optional.empty();
        }

        for (Eviction eviction : strategies) {
            Optional<Rearrangement> attempt = tryEviction(item, eviction, layout);
            if (attempt.isPresent()) {
                log.info("腾挪成功: 货物 {} 放入 {}, 移走 {}", item.getItemId(),
                        eviction.containerId, eviction.evictees);
                return attempt;
            }
        }
        log.info("货物 {} 的 {} 个腾挪方案均不可行", item.getItemId(), strategies.size());
        return Optional.empty();
    }

    /**
     * 先逐个尝试单件移走 (优先级最低的在前), 再按储物箱整批移走其中所有低优先级货物
     */
    private List<Eviction> buildStrategies(Item item, List<Container> preferredContainers, Layout layout,
                                           Set<String> movable) {
        int priority = item.getPriority();
        List<Eviction> singles = new ArrayList<>();
        List<Eviction> batches = new ArrayList<>();

        for (Container container : preferredContainers) {
            List<PlacedBox> lower = new ArrayList<>();
            for (PlacedBox occupant : layout.occupants(container.getContainerId())) {
                if (occupant.getPriority() < priority && movable.contains(occupant.getItemId())) {
                    lower.add(occupant);
                }
            }
            lower.sort(Comparator.comparingInt(PlacedBox::getPriority));
            for (PlacedBox occupant : lower) {
                singles.add(new Eviction(container.getContainerId(), List.of(occupant)));
            }
            if (lower.size() > 1) {
                batches.add(new Eviction(container.getContainerId(), lower));
            }
        }
        // 稳定排序: 同优先级保持储物箱顺序
        singles.sort(Comparator.comparingInt(e -> e.evictees.get(0).getPriority()));

        List<Eviction> strategies = new ArrayList<>(singles);
        strategies.addAll(batches);
        return strategies;
    }

    private Optional<Rearrangement> tryEviction(Item item, Eviction eviction, Layout layout) {
        Layout working = layout.copy();
        String sourceId = eviction.containerId;
        Container source = working.getContainer(sourceId);

        for (PlacedBox evictee : eviction.evictees) {
            working.remove(evictee.getItemId());
        }

        Optional<Spot> spot = spotFinder.find(item, source, working.boxes(sourceId), true);
        if (spot.isEmpty()) {
            return Optional.empty();
        }
        Box target = spot.get().getBox();
        working.add(sourceId, new PlacedBox(item, target));

        // 移走的货物可能正托着别的货物
        if (!working.isStable(sourceId, config.getTolerance())) {
            log.debug("移走 {} 后储物箱 {} 中有货物失去支撑, 放弃该方案", eviction.evictees, sourceId);
            return Optional.empty();
        }

        List<RearrangementStep> moves = new ArrayList<>();
        for (PlacedBox evictee : eviction.evictees) {
            Optional<RearrangementStep> move = rehome(evictee, sourceId, working);
            if (move.isEmpty()) {
                log.debug("货物 {} 在其他储物箱中找不到位置, 放弃该方案", evictee.getItemId());
                return Optional.empty();
            }
            moves.add(move.get());
        }
        return Optional.of(new Rearrangement(working, sourceId, target, moves));
    }

    /**
     * 按储物箱顺序为被移走的货物寻找新位置 (低优先级策略, 从深处开始), 找到即写入副本
     */
    private Optional<RearrangementStep> rehome(PlacedBox evictee, String sourceId, Layout working) {
        for (Container candidate : working.containers()) {
            String candidateId = candidate.getContainerId();
            if (candidateId.equals(sourceId)) {
                continue;
            }
            Optional<Spot> spot = spotFinder.find(evictee.getItem(), candidate, working.boxes(candidateId), false);
            if (spot.isPresent()) {
                Box newBox = spot.get().getBox();
                working.add(candidateId, new PlacedBox(evictee.getItem(), newBox));
                return Optional.of(new RearrangementStep(0, StepActionEnum.MOVE, evictee.getItemId(),
                        sourceId, evictee.getBox(), candidateId, newBox));
            }
        }
        return Optional.empty();
    }

    /**
     * 一个腾挪方案: 从同一储物箱移走的一组货物
     */
    @AllArgsConstructor
    private static final class Eviction {
        private final String containerId;
        private final List<PlacedBox> evictees;
    }

    /**
     * 采纳的腾挪结果
     */
    @Getter
    @AllArgsConstructor
    public static class Rearrangement {
        private final Layout layout;
        private final String containerId;
        private final Box box;
        // 步骤序号由调用方统一编排
        private final List<RearrangementStep> moves;
    }
}
