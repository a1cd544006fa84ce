package engine;

import lombok.AllArgsConstructor;
import lombok.Getter;
import model.entity.Box;

/**
 * 找到的可用位置及所用朝向 (宽, 深, 高)
 */
@Getter
@AllArgsConstructor
public class Spot {
    private final Box box;
    private final double[] orientation;
}
