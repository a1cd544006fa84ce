package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 放置记录: 一件货物 -> 一个储物箱内的一个包围盒
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Placement {
    private String itemId;
    private String containerId;
    private Box box;
}
