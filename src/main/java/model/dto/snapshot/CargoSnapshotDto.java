package model.dto.snapshot;

import lombok.Data;
import model.dto.response.PlacementDto;
import model.entity.Container;
import model.entity.Item;

import java.util.List;

/**
 * 存储数据快照
 */
@Data
public class CargoSnapshotDto {
    private List<Container> containers;
    private List<Item> items;
    private List<PlacementDto> placements;
}
