package engine;

import common.config.PlacementConfig;
import common.util.GeometryUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.entity.Box;
import model.entity.Container;
import model.entity.Item;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;

/**
 * 单个储物箱内的空位搜索 (首次适配)
 *
 * 搜索顺序: 朝向 -> 底面高度 -> 深度 -> 宽度。
 * 底面高度只取箱底和已有占位的顶面 (稳定性约束);
 * 深度/宽度在粗网格上枚举, 另外补充贴靠远端箱壁和贴靠已有占位边缘的起点。
 * 返回的包围盒保证在边界内、不与已有占位重叠、且有支撑; 不保证空间利用率最优。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpotFinder {

    private final PlacementConfig config;

    public Optional<Spot> find(Item item, Container container, Collection<Box> occupied, boolean preferShallow) {
        return find(item.getWidth(), item.getDepth(), item.getHeight(), container, occupied, preferShallow);
    }

    /**
     * @param preferShallow true 时深度从舱口 (depth = 0) 向内搜索, false 时从最深处向外
     */
    public Optional<Spot> find(double width, double depth, double height, Container container,
                               Collection<Box> occupied, boolean preferShallow) {
        double tol = config.getTolerance();
        double cw = container.getWidth();
        double cd = container.getDepth();
        double ch = container.getHeight();

        for (double[] orientation : GeometryUtil.orientations(width, depth, height)) {
            double w = orientation[0];
            double d = orientation[1];
            double h = orientation[2];
            if (w > cw + tol || d > cd + tol || h > ch + tol) {
                continue;
            }

            List<Double> depthOrigins = axisOrigins(cd, d, occupied, Box::getEndD);
            if (!preferShallow) {
                Collections.reverse(depthOrigins);
            }
            List<Double> widthOrigins = axisOrigins(cw, w, occupied, Box::getEndW);

            for (double baseH : baseHeights(occupied)) {
                if (baseH + h > ch + tol) {
                    continue;
                }
                for (double startD : depthOrigins) {
                    for (double startW : widthOrigins) {
                        Box candidate = Box.fromOrigin(startW, startD, baseH, w, d, h);
                        if (accept(candidate, container, occupied, tol)) {
                            log.debug("储物箱 {} 找到位置 {}", container.getContainerId(), candidate);
                            return Optional.of(new Spot(candidate, orientation));
                        }
                    }
                }
            }
        }
        return Optional.empty();
    }

    private boolean accept(Box candidate, Container container, Collection<Box> occupied, double tol) {
        if (!GeometryUtil.withinBounds(candidate, container.dimensions(), tol)) {
            return false;
        }
        for (Box other : occupied) {
            if (GeometryUtil.overlaps(candidate, other, tol)) {
                return false;
            }
        }
        return GeometryUtil.isSupported(candidate, occupied, tol);
    }

    /**
     * 候选底面高度: 箱底 + 每个已有占位的顶面, 按精度取整后升序去重
     * 同一档只保留首个顶面的原值, 保证支撑判定仍能精确贴合
     */
    private List<Double> baseHeights(Collection<Box> occupied) {
        TreeMap<Double, Double> heights = new TreeMap<>();
        heights.put(0.0, 0.0);
        for (Box box : occupied) {
            heights.putIfAbsent(GeometryUtil.round(box.getEndH(), config.getPrecision()), box.getEndH());
        }
        return new ArrayList<>(heights.values());
    }

    /**
     * 某一轴上的候选起点 (升序): 网格点 + 贴靠远端箱壁 + 贴靠已有占位的终点边
     */
    private List<Double> axisOrigins(double containerSize, double extent, Collection<Box> occupied,
                                     ToDoubleFunction<Box> endEdge) {
        double tol = config.getTolerance();
        double limit = containerSize - extent + tol;
        double step = Math.max(containerSize / config.getGridDivisions(), config.getMinGridStep());

        TreeSet<Double> origins = new TreeSet<>();
        for (int i = 0; i * step <= limit; i++) {
            origins.add(GeometryUtil.round(i * step, config.getPrecision()));
        }
        origins.add(Math.max(containerSize - extent, 0.0));
        for (Box box : occupied) {
            double edge = endEdge.applyAsDouble(box);
            if (edge <= limit) {
                origins.add(edge);
            }
        }
        // 取整后可能略超出上限, 交给边界判定过滤
        return new ArrayList<>(origins);
    }
}
