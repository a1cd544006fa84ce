package engine;

import common.consts.PlanErrorEnum;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 未能放置或被拒绝的货物及原因
 */
@Getter
@ToString
@AllArgsConstructor
public class ItemIssue {
    private final String itemId;
    private final PlanErrorEnum error;
    private final String reason;
}
