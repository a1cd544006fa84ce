package engine;

import common.consts.ErrorCodes;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;

import java.util.Optional;

/**
 * 规划前的输入校验, 返回第一条不通过的原因
 */
public final class PlanValidator {

    private PlanValidator() {}

    public static Optional<String> validateItem(Item item) {
        if (item.getItemId() == null || item.getItemId().isBlank()) {
            return Optional.of(ErrorCodes.MISSING_ITEM_ID);
        }
        if (!positive(item.getWidth()) || !positive(item.getDepth()) || !positive(item.getHeight())) {
            return Optional.of(ErrorCodes.INVALID_DIMENSION);
        }
        if (!positive(item.getMass())) {
            return Optional.of(ErrorCodes.INVALID_MASS);
        }
        if (item.getPriority() == null || item.getPriority() < 0 || item.getPriority() > 100) {
            return Optional.of(ErrorCodes.INVALID_PRIORITY);
        }
        if (item.getUsageLimit() != null && item.getUsageLimit() < 0) {
            return Optional.of(ErrorCodes.INVALID_USAGE_LIMIT);
        }
        if (!item.isActive()) {
            return Optional.of(ErrorCodes.ITEM_NOT_ACTIVE);
        }
        return Optional.empty();
    }

    public static Optional<String> validateContainer(Container container) {
        if (container.getContainerId() == null || container.getContainerId().isBlank()) {
            return Optional.of("储物箱ID不能为空");
        }
        if (!positive(container.getWidth()) || !positive(container.getDepth()) || !positive(container.getHeight())) {
            return Optional.of(ErrorCodes.INVALID_DIMENSION);
        }
        return Optional.empty();
    }

    public static Optional<String> validateBox(Box box) {
        return box != null && box.isWellFormed() ? Optional.empty() : Optional.of(ErrorCodes.INVALID_BOX);
    }

    private static boolean positive(Double value) {
        return value != null && value > 0 && !value.isInfinite();
    }
}
