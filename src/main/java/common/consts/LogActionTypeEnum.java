package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 操作日志类型
 */
@Getter
@AllArgsConstructor
public enum LogActionTypeEnum {
    PLACEMENT("placement", "放置"),
    PLACEMENT_FAILED("placementFailed", "放置失败"),
    REARRANGEMENT("rearrangement", "腾挪"),
    RETRIEVAL("retrieval", "取用"),
    UPDATE_LOCATION("updateLocation", "位置更新"),
    WASTE_EXPIRED("wasteExpired", "过期转废弃"),
    WASTE_DEPLETED("wasteDepleted", "耗尽转废弃"),
    DISPOSAL_PLAN("disposalPlan", "纳入回收计划"),
    DISPOSAL_COMPLETE("disposalComplete", "已随离港舱处置");

    private final String code;
    private final String desc;

    public static LogActionTypeEnum getByCode(String code) {
        for (LogActionTypeEnum value : values()) {
            if (value.getCode().equals(code) || value.name().equals(code)) {
                return value;
            }
        }
        return null;
    }
}
