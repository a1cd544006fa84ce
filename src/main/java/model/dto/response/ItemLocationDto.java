package model.dto.response;

import lombok.Data;
import model.entity.Position;

/**
 * 货物位置信息 (查询结果)
 */
@Data
public class ItemLocationDto {
    private String itemId;
    private String name;
    private String containerId;
    private String zone;
    private Position position;
}
