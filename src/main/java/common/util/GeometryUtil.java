package common.util;

import model.entity.Box;
import model.entity.Coordinates;

import java.util.ArrayList;
import java.util.List;

/**
 * 几何内核: 轴对齐包围盒的纯函数判定
 * 所有比较都带绝对容差, 用于吸收浮点误差
 */
public final class GeometryUtil {

    public static final double DEFAULT_TOLERANCE = 1e-6;

    private GeometryUtil() {}

    /**
     * 两个包围盒是否在三个轴上都严格相交 (仅边界接触不算重叠)
     */
    public static boolean overlaps(Box a, Box b) {
        return overlaps(a, b, DEFAULT_TOLERANCE);
    }

    public static boolean overlaps(Box a, Box b, double tol) {
        return intervalsOverlap(a.getStartW(), a.getEndW(), b.getStartW(), b.getEndW(), tol)
                && intervalsOverlap(a.getStartD(), a.getEndD(), b.getStartD(), b.getEndD(), tol)
                && intervalsOverlap(a.getStartH(), a.getEndH(), b.getStartH(), b.getEndH(), tol);
    }

    /**
     * 包围盒是否完全位于储物箱内部
     */
    public static boolean withinBounds(Box box, Coordinates containerDims) {
        return withinBounds(box, containerDims, DEFAULT_TOLERANCE);
    }

    public static boolean withinBounds(Box box, Coordinates dims, double tol) {
        return box.getStartW() >= -tol && box.getStartD() >= -tol && box.getStartH() >= -tol
                && box.getEndW() <= dims.getWidth() + tol
                && box.getEndD() <= dims.getDepth() + tol
                && box.getEndH() <= dims.getHeight() + tol;
    }

    /**
     * blocker 是否挡住 target 沿深度方向 (朝 depth = 0) 的取出通道
     * 条件: 宽-高投影相交, 且 blocker 的深度终点不超过 target 的深度起点
     */
    public static boolean blocksExit(Box blocker, Box target) {
        return blocksExit(blocker, target, DEFAULT_TOLERANCE);
    }

    public static boolean blocksExit(Box blocker, Box target, double tol) {
        return footprintOverlaps(blocker, target, tol)
                && blocker.getEndD() <= target.getStartD() + tol;
    }

    /**
     * 宽-高平面投影 (正对舱口看到的截面) 是否相交
     */
    public static boolean footprintOverlaps(Box a, Box b, double tol) {
        return intervalsOverlap(a.getStartW(), a.getEndW(), b.getStartW(), b.getEndW(), tol)
                && intervalsOverlap(a.getStartH(), a.getEndH(), b.getStartH(), b.getEndH(), tol);
    }

    /**
     * 宽-深平面投影 (俯视的底面) 是否相交, 用于支撑判定
     */
    public static boolean baseOverlaps(Box a, Box b, double tol) {
        return intervalsOverlap(a.getStartW(), a.getEndW(), b.getStartW(), b.getEndW(), tol)
                && intervalsOverlap(a.getStartD(), a.getEndD(), b.getStartD(), b.getEndD(), tol);
    }

    /**
     * 稳定性: 落在箱底, 或底面与某个顶面恰好等高的包围盒在俯视投影上相交
     */
    public static boolean isSupported(Box box, Iterable<Box> others, double tol) {
        if (Math.abs(box.getStartH()) < tol) {
            return true;
        }
        for (Box other : others) {
            if (other == box) continue;
            if (Math.abs(other.getEndH() - box.getStartH()) < tol && baseOverlaps(box, other, tol)) {
                return true;
            }
        }
        return false;
    }

    public static double volume(Box box) {
        return box.sizeW() * box.sizeD() * box.sizeH();
    }

    /**
     * 货物的 6 种轴向排列 (宽, 深, 高), 尺寸相同导致的重复朝向只保留一个
     */
    public static List<double[]> orientations(double w, double d, double h) {
        double[][] all = {
                {w, d, h}, {w, h, d},
                {d, w, h}, {d, h, w},
                {h, w, d}, {h, d, w}
        };
        List<double[]> result = new ArrayList<>(6);
        for (double[] candidate : all) {
            boolean duplicate = false;
            for (double[] existing : result) {
                if (existing[0] == candidate[0] && existing[1] == candidate[1] && existing[2] == candidate[2]) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * 按指定小数位取整
     */
    public static double round(double value, int precision) {
        double scale = Math.pow(10, precision);
        return Math.round(value * scale) / scale;
    }

    private static boolean intervalsOverlap(double start1, double end1, double start2, double end2, double tol) {
        return !(end1 <= start2 + tol || end2 <= start1 + tol);
    }
}
