package engine;

import lombok.AllArgsConstructor;
import lombok.Getter;
import model.entity.Box;
import model.entity.Item;

/**
 * 布局中的一个占位: 货物 + 包围盒
 */
@Getter
@AllArgsConstructor
public class PlacedBox {
    private final Item item;
    private final Box box;

    public String getItemId() {
        return item.getItemId();
    }

    public int getPriority() {
        return item.getPriority() == null ? 0 : item.getPriority();
    }

    @Override
    public String toString() {
        return item.getItemId() + box;
    }
}
