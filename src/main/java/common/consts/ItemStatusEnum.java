package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 货物状态
 * ACTIVE -> WASTE_EXPIRED / WASTE_DEPLETED -> DISPOSED
 */
@Getter
@AllArgsConstructor
public enum ItemStatusEnum {
    ACTIVE("01", "可用"),
    WASTE_EXPIRED("02", "废弃 (已过期)"),
    WASTE_DEPLETED("03", "废弃 (使用次数耗尽)"),
    DISPOSED("04", "已处置 (随离港舱移出)");

    private final String code;
    private final String desc;

    /**
     * 是否处于废弃状态 (等待随离港舱处置)
     */
    public boolean isWaste() {
        return this == WASTE_EXPIRED || this == WASTE_DEPLETED;
    }

    /**
     * 状态流转校验
     */
    public boolean canTransitTo(ItemStatusEnum target) {
        switch (this) {
            case ACTIVE:
                return target == WASTE_EXPIRED || target == WASTE_DEPLETED;
            case WASTE_EXPIRED:
            case WASTE_DEPLETED:
                return target == DISPOSED;
            default:
                return false;
        }
    }
}
