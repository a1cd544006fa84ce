package common.consts;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 腾挪/取货步骤动作
 */
@Getter
@AllArgsConstructor
public enum StepActionEnum {
    MOVE("move", "移动到其他储物箱"),
    SET_ASIDE("setAside", "暂时移出, 让出取货通道"),
    RETRIEVE("retrieve", "取出目标货物");

    @JsonValue
    private final String code;
    private final String desc;
}
