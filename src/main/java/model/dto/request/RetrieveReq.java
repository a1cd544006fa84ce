package model.dto.request;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 取用登记请求
 */
@Data
public class RetrieveReq {
    private String itemId;
    private String userId;
    private LocalDateTime timestamp; // 为空时取当前时间
}
