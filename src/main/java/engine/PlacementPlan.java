package engine;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次装载规划的完整输出 (差量), 由调用方整体提交
 */
@Getter
@AllArgsConstructor
public class PlacementPlan {
    // 新建与移动的放置 (最终位置)
    private final List<PlacementChange> placements;
    // 有序的腾挪步骤
    private final List<RearrangementStep> rearrangements;
    // 无法放置的货物
    private final List<ItemIssue> failures;
    // 输入非法被拒绝的货物
    private final List<ItemIssue> rejected;
    // 规划后的完整布局
    private final Layout layout;

    public List<String> failedItemIds() {
        List<String> ids = new ArrayList<>(failures.size() + rejected.size());
        rejected.forEach(issue -> ids.add(issue.getItemId()));
        failures.forEach(issue -> ids.add(issue.getItemId()));
        return ids;
    }

    /**
     * 所有提交的货物都已放置
     */
    public boolean isComplete() {
        return failures.isEmpty() && rejected.isEmpty();
    }

    public boolean hasChanges() {
        return !placements.isEmpty();
    }
}
