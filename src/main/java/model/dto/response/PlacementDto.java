package model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.entity.Placement;
import model.entity.Position;

/**
 * 放置信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlacementDto {
    private String itemId;
    private String containerId;
    private Position position;

    public static PlacementDto from(Placement placement) {
        return new PlacementDto(placement.getItemId(), placement.getContainerId(), placement.getBox().toPosition());
    }
}
