package model.dto.request;

import lombok.Data;
import model.dto.response.PlacementDto;
import model.entity.Container;
import model.entity.Item;

import java.util.List;

/**
 * 场景装载请求 (整体替换内存中的数据)
 */
@Data
public class ScenarioLoadReq {
    private List<Item> items;
    private List<Container> containers;
    private List<PlacementDto> placements;
}
