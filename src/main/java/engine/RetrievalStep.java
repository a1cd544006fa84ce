package engine;

import common.consts.StepActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 取货步骤
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalStep {
    private int step;
    private StepActionEnum action;
    private String itemId;
    private String itemName;
}
