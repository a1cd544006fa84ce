package model.dto.request;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 离港完成请求: 计划内的废弃物随离港舱一起移出
 */
@Data
public class UndockingCompleteReq {
    private String undockingContainerId;
    private String userId;
    private LocalDateTime timestamp;
}
