package engine;

import common.consts.StepActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.entity.Box;

/**
 * 腾挪步骤: 把一件低优先级货物从原储物箱移到新储物箱
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RearrangementStep {
    private int step;
    private StepActionEnum action;
    private String itemId;
    private String fromContainer;
    private Box fromBox;
    private String toContainer;
    private Box toBox;
}
