package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 规划结果错误分类
 * 除 PERSISTENCE_FAILURE 外均为正常的规划结果, 不以异常形式抛出
 */
@Getter
@AllArgsConstructor
public enum PlanErrorEnum {
    INPUT_INVALID("E01", "输入参数非法"),
    NO_SPOT_FOUND("E02", "所有朝向与位置均无可用空间"),
    REARRANGEMENT_INFEASIBLE("E03", "无可行的腾挪方案"),
    PERSISTENCE_FAILURE("E04", "规划结果提交失败");

    private final String code;
    private final String desc;
}
