package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对外的位置表示 (起点坐标 + 终点坐标)
 * 内部计算统一使用不可变的 {@link Box}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private Coordinates startCoordinates;
    private Coordinates endCoordinates;

    public Box toBox() {
        return Box.of(startCoordinates.getWidth(), startCoordinates.getDepth(), startCoordinates.getHeight(),
                endCoordinates.getWidth(), endCoordinates.getDepth(), endCoordinates.getHeight());
    }
}
