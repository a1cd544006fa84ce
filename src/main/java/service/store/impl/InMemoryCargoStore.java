package service.store.impl;

import common.config.PlacementConfig;
import common.exception.PersistenceException;
import common.util.GeometryUtil;
import engine.ItemIssue;
import engine.Layout;
import engine.PlacedBox;
import engine.PlacementChange;
import engine.PlacementPlan;
import engine.PlanValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.bo.CargoContext;
import model.entity.Container;
import model.entity.Item;
import model.entity.Placement;
import org.springframework.stereotype.Service;
import service.store.CargoStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 基于 CargoContext 的内存存储
 * 调用方需持有 CargoContext 锁, 保证读取快照到提交之间没有其他写入
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryCargoStore implements CargoStore {

    private final CargoContext context = CargoContext.getInstance();
    private final PlacementConfig config;

    @Override
    public Layout loadLayout(List<Container> containers) {
        Layout layout = new Layout(containers);
        List<Placement> placements = new ArrayList<>(context.getPlacementMap().values());
        placements.sort(Comparator.comparing(Placement::getItemId));

        for (Placement placement : placements) {
            if (!layout.hasContainer(placement.getContainerId())) continue;
            Item item = context.getItemMap().get(placement.getItemId());
            if (item == null || !item.isActive()) continue;
            if (PlanValidator.validateBox(placement.getBox()).isPresent()) {
                log.warn("放置记录坐标非法, 跳过: {} {}", placement.getItemId(), placement.getBox());
                continue;
            }
            layout.add(placement.getContainerId(), new PlacedBox(item, placement.getBox()));
        }
        return layout;
    }

    @Override
    public void applyPlan(List<Container> containers, List<Item> submittedItems, PlacementPlan plan) {
        Set<String> rejectedIds = plan.getRejected().stream()
                .map(ItemIssue::getItemId)
                .collect(Collectors.toSet());

        //  在副本上合并, 全部校验通过后再写回
        Map<String, Container> containersAfter = new HashMap<>(context.getContainerMap());
        containers.forEach(c -> containersAfter.put(c.getContainerId(), c));

        Map<String, Item> newItems = new HashMap<>();
        for (Item item : submittedItems) {
            if (item.getItemId() == null || rejectedIds.contains(item.getItemId())) continue;
            if (!context.getItemMap().containsKey(item.getItemId())) {
                newItems.put(item.getItemId(), item);
            }
        }

        Map<String, Placement> placementsAfter = new HashMap<>(context.getPlacementMap());
        List<String> violations = new ArrayList<>();
        Set<String> touchedContainers = new HashSet<>();
        for (PlacementChange change : plan.getPlacements()) {
            if (!containersAfter.containsKey(change.getContainerId())) {
                violations.add("未知储物箱: " + change.getContainerId());
                continue;
            }
            if (!context.getItemMap().containsKey(change.getItemId()) && !newItems.containsKey(change.getItemId())) {
                violations.add("未知货物: " + change.getItemId());
                continue;
            }
            Item stored = context.getItemMap().get(change.getItemId());
            if (stored != null && !stored.isActive()) {
                violations.add("货物不是可用状态: " + change.getItemId());
                continue;
            }
            placementsAfter.put(change.getItemId(),
                    new Placement(change.getItemId(), change.getContainerId(), change.getBox()));
            touchedContainers.add(change.getContainerId());
        }

        for (String containerId : touchedContainers) {
            violations.addAll(checkContainer(containersAfter.get(containerId), placementsAfter, newItems));
        }

        if (!violations.isEmpty()) {
            throw new PersistenceException("规划结果与存储状态不一致", violations);
        }

        context.getContainerMap().putAll(containersAfter);
        context.getItemMap().putAll(newItems);
        context.getPlacementMap().putAll(placementsAfter);
        log.info("提交完成: 储物箱 {} 个, 新货物 {} 件, 放置变更 {} 条",
                containers.size(), newItems.size(), plan.getPlacements().size());
    }

    @Override
    public List<Container> listContainers() {
        List<Container> result = new ArrayList<>(context.getContainerMap().values());
        result.sort(Comparator.comparing(Container::getContainerId));
        return result;
    }

    /**
     * 提交后同一储物箱内的放置必须两两不重叠且在边界内
     */
    private List<String> checkContainer(Container container, Map<String, Placement> placements,
                                        Map<String, Item> newItems) {
        double tol = config.getTolerance();
        List<Placement> inside = new ArrayList<>();
        for (Placement placement : placements.values()) {
            if (!container.getContainerId().equals(placement.getContainerId())) continue;
            Item item = newItems.getOrDefault(placement.getItemId(), context.getItemMap().get(placement.getItemId()));
            if (item != null && item.isActive()) {
                inside.add(placement);
            }
        }

        List<String> violations = new ArrayList<>();
        for (int i = 0; i < inside.size(); i++) {
            Placement a = inside.get(i);
            if (!GeometryUtil.withinBounds(a.getBox(), container.dimensions(), tol)) {
                violations.add("越界: " + a.getItemId() + " @ " + container.getContainerId());
            }
            for (int j = i + 1; j < inside.size(); j++) {
                Placement b = inside.get(j);
                if (GeometryUtil.overlaps(a.getBox(), b.getBox(), tol)) {
                    violations.add("重叠: " + a.getItemId() + " / " + b.getItemId() + " @ " + container.getContainerId());
                }
            }
        }
        return violations;
    }
}
