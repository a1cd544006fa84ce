package model.dto.request;

import lombok.Data;
import model.entity.Position;

import java.time.LocalDateTime;

/**
 * 放回/移动单件货物到指定位置
 */
@Data
public class PlaceReq {
    private String itemId;
    private String userId;
    private LocalDateTime timestamp;
    private String containerId;
    private Position position;
}
