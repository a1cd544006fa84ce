package model.dto.snapshot;

import common.consts.LogActionTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 操作日志条目
 */
@Data
public class ActionLogEntryDto {
    private LocalDateTime timestamp;
    private String userId;
    private LogActionTypeEnum actionType;
    private String itemId;

    /**
     * 与动作相关的明细 (储物箱、位置、原因等)
     */
    private Map<String, Object> details;
}
