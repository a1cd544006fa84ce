package engine;

import common.util.GeometryUtil;
import model.entity.Box;
import model.entity.Container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 布局快照: 储物箱 -> 有序的占位列表
 * 储物箱按加入顺序存放在数组中, 通过 id -> 下标 的映射查找。
 * 每次规划持有自己的副本, 各阶段在副本上修改后返回, 不与其他请求共享。
 */
public class Layout {

    private final List<ContainerSlot> arena = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();
    // 货物 -> 所在储物箱 (一件货物最多一个放置)
    private final Map<String, String> containerByItem = new HashMap<>();

    public Layout(List<Container> containers) {
        for (Container container : containers) {
            if (indexById.containsKey(container.getContainerId())) {
                throw new IllegalArgumentException("储物箱重复: " + container.getContainerId());
            }
            indexById.put(container.getContainerId(), arena.size());
            arena.add(new ContainerSlot(container));
        }
    }

    private Layout() {}

    /**
     * 深拷贝占位列表 (占位本身不可变, 可以共享)
     */
    public Layout copy() {
        Layout copy = new Layout();
        for (ContainerSlot slot : arena) {
            ContainerSlot slotCopy = new ContainerSlot(slot.container);
            slotCopy.occupants.addAll(slot.occupants);
            copy.indexById.put(slot.container.getContainerId(), copy.arena.size());
            copy.arena.add(slotCopy);
        }
        copy.containerByItem.putAll(containerByItem);
        return copy;
    }

    public boolean hasContainer(String containerId) {
        return indexById.containsKey(containerId);
    }

    public Container getContainer(String containerId) {
        return slot(containerId).container;
    }

    /**
     * 所有储物箱, 保持请求中的顺序
     */
    public List<Container> containers() {
        List<Container> result = new ArrayList<>(arena.size());
        for (ContainerSlot slot : arena) {
            result.add(slot.container);
        }
        return result;
    }

    /**
     * 指定区域的储物箱, 保持请求中的顺序
     */
    public List<Container> containersInZone(String zone) {
        List<Container> result = new ArrayList<>();
        if (zone == null || zone.isBlank()) return result;
        for (ContainerSlot slot : arena) {
            if (zone.equals(slot.container.getZone())) {
                result.add(slot.container);
            }
        }
        return result;
    }

    public List<PlacedBox> occupants(String containerId) {
        return Collections.unmodifiableList(slot(containerId).occupants);
    }

    public List<Box> boxes(String containerId) {
        List<PlacedBox> occupants = slot(containerId).occupants;
        List<Box> result = new ArrayList<>(occupants.size());
        for (PlacedBox occupant : occupants) {
            result.add(occupant.getBox());
        }
        return result;
    }

    public boolean contains(String itemId) {
        return containerByItem.containsKey(itemId);
    }

    public Optional<String> containerOf(String itemId) {
        return Optional.ofNullable(containerByItem.get(itemId));
    }

    public Optional<PlacedBox> find(String itemId) {
        String containerId = containerByItem.get(itemId);
        if (containerId == null) return Optional.empty();
        for (PlacedBox occupant : slot(containerId).occupants) {
            if (occupant.getItemId().equals(itemId)) {
                return Optional.of(occupant);
            }
        }
        return Optional.empty();
    }

    public void add(String containerId, PlacedBox placed) {
        String existing = containerByItem.get(placed.getItemId());
        if (existing != null) {
            throw new IllegalStateException("货物 " + placed.getItemId() + " 已放置在 " + existing);
        }
        slot(containerId).occupants.add(placed);
        containerByItem.put(placed.getItemId(), containerId);
    }

    public PlacedBox remove(String itemId) {
        String containerId = containerByItem.remove(itemId);
        if (containerId == null) {
            throw new IllegalStateException("货物 " + itemId + " 不在布局中");
        }
        List<PlacedBox> occupants = slot(containerId).occupants;
        for (int i = 0; i < occupants.size(); i++) {
            if (occupants.get(i).getItemId().equals(itemId)) {
                return occupants.remove(i);
            }
        }
        throw new IllegalStateException("布局索引不一致: " + itemId);
    }

    /**
     * 指定储物箱内是否每个非落地的占位都有支撑
     */
    public boolean isStable(String containerId, double tol) {
        List<Box> boxes = boxes(containerId);
        for (Box box : boxes) {
            if (!GeometryUtil.isSupported(box, boxes, tol)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 布局中所有已放置货物的ID
     */
    public Set<String> itemIds() {
        return new HashSet<>(containerByItem.keySet());
    }

    public int placedCount() {
        return containerByItem.size();
    }

    private ContainerSlot slot(String containerId) {
        Integer index = indexById.get(containerId);
        if (index == null) {
            throw new IllegalArgumentException("布局中不存在储物箱: " + containerId);
        }
        return arena.get(index);
    }

    private static final class ContainerSlot {
        private final Container container;
        private final List<PlacedBox> occupants = new ArrayList<>();

        private ContainerSlot(Container container) {
            this.container = container;
        }
    }
}
