package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 储物箱实体
 * 本地坐标系: 宽(width) x 深(depth) x 高(height), depth = 0 为开口面
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Container {
    private String containerId;   // 储物箱编号
    private String zone;          // 所属区域 (如 Crew Quarters, Airlock)

    private Double width;         // 内部宽度 (cm)
    private Double depth;         // 内部深度 (cm)
    private Double height;        // 内部高度 (cm)

    /**
     * 以坐标形式返回内部尺寸, 供边界判定使用
     */
    public Coordinates dimensions() {
        return new Coordinates(width, depth, height);
    }
}
