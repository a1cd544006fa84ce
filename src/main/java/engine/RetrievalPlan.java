package engine;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 取货路径分析结果
 */
@Getter
@AllArgsConstructor
public class RetrievalPlan {
    private final PlacedBox target;
    private final String containerId;
    // 按离舱口由近到远排列
    private final List<PlacedBox> blockers;
    private final List<RetrievalStep> steps;

    public int blockerCount() {
        return blockers.size();
    }
}
