package engine;

import common.config.PlacementConfig;
import common.consts.ErrorCodes;
import common.consts.PlanErrorEnum;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.entity.Container;
import model.entity.Item;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 装载规划
 *
 * A. 按优先级从高到低, 在偏好区域的储物箱内放置;
 * B. 偏好区域放不下的货物, 先重试偏好区域, 再尝试腾挪低优先级货物;
 * C. 仍未放置的货物在所有储物箱中按顺序尝试, 最终失败的货物单独列出。
 *
 * 只在布局副本上计算, 不写存储; 输出为差量 (新建/移动的放置 + 腾挪步骤 + 失败列表)。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlacementPlanner {

    private final SpotFinder spotFinder;
    private final RearrangementPlanner rearrangementPlanner;
    private final PlacementConfig config;

    public PlacementPlan plan(List<Item> items, Layout snapshot) {
        PlanState state = new PlanState();
        List<Item> pending = admit(items, snapshot, state);

        // 同优先级保持请求顺序
        pending.sort(Comparator.comparingInt(Item::getPriority).reversed());
        log.info("开始装载规划: 待放置 {} 件, 拒绝 {} 件, 储物箱 {} 个",
                pending.size(), state.rejected.size(), snapshot.containers().size());

        Layout layout = placeInPreferredZones(pending, snapshot.copy(), state);
        layout = rearrangeForDeferred(layout, snapshot.itemIds(), state);
        layout = placeAnywhere(layout, state);

        List<PlacementChange> changes = diff(snapshot, layout, state.touched);
        log.info("装载规划完成: 变更 {} 条, 腾挪 {} 步, 失败 {} 件",
                changes.size(), state.moves.size(), state.failures.size());
        return new PlacementPlan(changes, state.moves, state.failures, state.rejected, layout);
    }

    /**
     * 校验输入; 已在布局中的货物保持原位, 不产生变更
     */
    private List<Item> admit(List<Item> items, Layout snapshot, PlanState state) {
        List<Item> pending = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Item item : items) {
            Optional<String> invalid = PlanValidator.validateItem(item);
            if (invalid.isPresent()) {
                log.warn("货物 {} 输入非法: {}", item.getItemId(), invalid.get());
                state.rejected.add(new ItemIssue(item.getItemId(), PlanErrorEnum.INPUT_INVALID, invalid.get()));
                continue;
            }
            if (!seen.add(item.getItemId())) {
                state.rejected.add(new ItemIssue(item.getItemId(), PlanErrorEnum.INPUT_INVALID,
                        ErrorCodes.DUPLICATE_ITEM));
                continue;
            }
            if (snapshot.contains(item.getItemId())) {
                log.debug("货物 {} 已有放置, 跳过", item.getItemId());
                continue;
            }
            pending.add(item);
        }
        return pending;
    }

    private Layout placeInPreferredZones(List<Item> pending, Layout layout, PlanState state) {
        for (Item item : pending) {
            boolean placed = false;
            for (Container container : layout.containersInZone(item.getPreferredZone())) {
                if (tryPlace(item, container, isHighPriority(item), layout, state)) {
                    log.info("货物 {} 放入偏好储物箱 {}", item.getItemId(), container.getContainerId());
                    placed = true;
                    break;
                }
            }
            if (!placed) {
                state.deferred.add(item);
            }
        }
        return layout;
    }

    /**
     * @param movable 规划前已有放置的货物; 本次请求新放入的货物不会被腾挪
     */
    private Layout rearrangeForDeferred(Layout layout, Set<String> movable, PlanState state) {
        Layout current = layout;
        for (Item item : state.deferred) {
            List<Container> preferred = current.containersInZone(item.getPreferredZone());
            if (preferred.isEmpty()) {
                state.anywhere.add(item);
                continue;
            }

            // 前面的腾挪可能已经让出了空间
            boolean placed = false;
            for (Container container : preferred) {
                if (tryPlace(item, container, isHighPriority(item), current, state)) {
                    log.info("货物 {} 重试后放入偏好储物箱 {}", item.getItemId(), container.getContainerId());
                    placed = true;
                    break;
                }
            }
            if (placed) continue;

            Optional<RearrangementPlanner.Rearrangement> result =
                    rearrangementPlanner.rearrange(item, preferred, current, movable);
            if (result.isPresent()) {
                RearrangementPlanner.Rearrangement rearrangement = result.get();
                current = rearrangement.getLayout();
                state.touched.add(item.getItemId());
                for (RearrangementStep move : rearrangement.getMoves()) {
                    move.setStep(state.moves.size() + 1);
                    state.moves.add(move);
                    state.touched.add(move.getItemId());
                }
            } else {
                state.infeasible.add(item.getItemId());
                state.anywhere.add(item);
            }
        }
        return current;
    }

    private Layout placeAnywhere(Layout layout, PlanState state) {
        for (Item item : state.anywhere) {
            boolean placed = false;
            for (Container container : layout.containers()) {
                if (tryPlace(item, container, isHighPriority(item), layout, state)) {
                    log.info("货物 {} 放入非偏好储物箱 {}", item.getItemId(), container.getContainerId());
                    placed = true;
                    break;
                }
            }
            if (!placed) {
                log.warn("货物 {} 在所有储物箱中均无可用位置", item.getItemId());
                String reason = PlanErrorEnum.NO_SPOT_FOUND.getDesc();
                if (state.infeasible.contains(item.getItemId())) {
                    reason += "; 偏好区域" + PlanErrorEnum.REARRANGEMENT_INFEASIBLE.getDesc();
                }
                state.failures.add(new ItemIssue(item.getItemId(), PlanErrorEnum.NO_SPOT_FOUND, reason));
            }
        }
        return layout;
    }

    private boolean tryPlace(Item item, Container container, boolean preferShallow, Layout layout, PlanState state) {
        String containerId = container.getContainerId();
        Optional<Spot> spot = spotFinder.find(item, container, layout.boxes(containerId), preferShallow);
        if (spot.isEmpty()) {
            return false;
        }
        layout.add(containerId, new PlacedBox(item, spot.get().getBox()));
        log.debug("货物 {} 放入 {} {}, 朝向 {}", item.getItemId(), containerId, spot.get().getBox(),
                Arrays.toString(spot.get().getOrientation()));
        state.touched.add(item.getItemId());
        return true;
    }

    private boolean isHighPriority(Item item) {
        return item.getPriority() >= config.getHighPriorityThreshold();
    }

    /**
     * 对比规划前后的布局, 输出位置有变化的货物 (按首次变动的顺序)
     */
    private List<PlacementChange> diff(Layout before, Layout after, Set<String> touched) {
        List<PlacementChange> changes = new ArrayList<>();
        for (String itemId : touched) {
            Optional<PlacedBox> now = after.find(itemId);
            if (now.isEmpty()) continue;
            String containerId = after.containerOf(itemId).orElseThrow();
            Optional<PlacedBox> was = before.find(itemId);
            boolean unchanged = was.isPresent()
                    && containerId.equals(before.containerOf(itemId).orElse(null))
                    && was.get().getBox().equals(now.get().getBox());
            if (!unchanged) {
                changes.add(new PlacementChange(itemId, containerId, now.get().getBox()));
            }
        }
        return changes;
    }

    /**
     * 单次规划内的中间状态, 不跨请求共享
     */
    private static final class PlanState {
        private final List<Item> deferred = new ArrayList<>();
        private final List<Item> anywhere = new ArrayList<>();
        private final List<RearrangementStep> moves = new ArrayList<>();
        private final List<ItemIssue> failures = new ArrayList<>();
        private final List<ItemIssue> rejected = new ArrayList<>();
        private final Set<String> touched = new LinkedHashSet<>();
        // 偏好区域腾挪失败的货物
        private final Set<String> infeasible = new HashSet<>();
    }
}
