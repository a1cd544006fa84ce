package model.dto.request;

import lombok.Data;
import model.entity.Container;
import model.entity.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * 装载请求
 * containers 为空时使用存储中的全部储物箱
 */
@Data
public class PlacementReq {
    private List<Item> items = new ArrayList<>();
    private List<Container> containers = new ArrayList<>();
    private String userId;
}
