package engine;

import common.config.PlacementConfig;
import common.consts.StepActionEnum;
import common.util.GeometryUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 取货路径分析: 目标货物沿深度方向直线拉出, 找出挡在它与舱口之间的货物
 */
@Component
@RequiredArgsConstructor
public class RetrievalPathAnalyzer {

    private final PlacementConfig config;

    /**
     * 在布局中分析指定货物; 货物不在布局中时返回空
     */
    public Optional<RetrievalPlan> analyze(String itemId, Layout layout) {
        Optional<PlacedBox> target = layout.find(itemId);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        String containerId = layout.containerOf(itemId).orElseThrow();
        return Optional.of(analyze(target.get(), containerId, layout.occupants(containerId)));
    }

    /**
     * @param coLocated 同一储物箱内的其他占位, 非可用状态的货物不参与阻挡计算
     */
    public RetrievalPlan analyze(PlacedBox target, String containerId, Collection<PlacedBox> coLocated) {
        List<PlacedBox> blockers = findBlockers(target, coLocated);

        List<RetrievalStep> steps = new ArrayList<>(blockers.size() + 1);
        for (PlacedBox blocker : blockers) {
            steps.add(new RetrievalStep(steps.size() + 1, StepActionEnum.SET_ASIDE,
                    blocker.getItemId(), blocker.getItem().getName()));
        }
        steps.add(new RetrievalStep(steps.size() + 1, StepActionEnum.RETRIEVE,
                target.getItemId(), target.getItem().getName()));
        return new RetrievalPlan(target, containerId, blockers, steps);
    }

    public List<PlacedBox> findBlockers(PlacedBox target, Collection<PlacedBox> coLocated) {
        double tol = config.getTolerance();
        List<PlacedBox> blockers = new ArrayList<>();
        for (PlacedBox other : coLocated) {
            if (other.getItemId().equals(target.getItemId()) || !other.getItem().isActive()) {
                continue;
            }
            if (GeometryUtil.blocksExit(other.getBox(), target.getBox(), tol)) {
                blockers.add(other);
            }
        }
        // 靠近舱口的先搬
        blockers.sort(Comparator.comparingDouble((PlacedBox b) -> b.getBox().getStartD())
                .thenComparing(PlacedBox::getItemId));
        return blockers;
    }
}
