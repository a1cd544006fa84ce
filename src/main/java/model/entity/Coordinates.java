package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 三维坐标 (宽, 深, 高)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Coordinates {
    private double width;
    private double depth;
    private double height;
}
