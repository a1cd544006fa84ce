package model.dto.response;

import lombok.Data;
import model.entity.Position;

/**
 * 废弃物信息
 */
@Data
public class WasteItemDto {
    private String itemId;
    private String name;
    private String reason;       // Expired / Out of Uses
    private String containerId;
    private Position position;
}
