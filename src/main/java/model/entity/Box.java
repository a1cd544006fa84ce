package model.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 轴对齐的三维包围盒 (不可变)
 * 坐标均位于所属储物箱的本地坐标系内
 */
@Getter
@EqualsAndHashCode
public final class Box {
    private final double startW;
    private final double startD;
    private final double startH;
    private final double endW;
    private final double endD;
    private final double endH;

    private Box(double startW, double startD, double startH, double endW, double endD, double endH) {
        this.startW = startW;
        this.startD = startD;
        this.startH = startH;
        this.endW = endW;
        this.endD = endD;
        this.endH = endH;
    }

    public static Box of(double startW, double startD, double startH, double endW, double endD, double endH) {
        return new Box(startW, startD, startH, endW, endD, endH);
    }

    /**
     * 由起点与三个方向的尺寸构造
     */
    public static Box fromOrigin(double w, double d, double h, double sizeW, double sizeD, double sizeH) {
        return new Box(w, d, h, w + sizeW, d + sizeD, h + sizeH);
    }

    public double sizeW() {
        return endW - startW;
    }

    public double sizeD() {
        return endD - startD;
    }

    public double sizeH() {
        return endH - startH;
    }

    /**
     * 起点不小于0 且终点在每个轴上都大于起点
     */
    public boolean isWellFormed() {
        return startW >= 0 && startD >= 0 && startH >= 0
                && endW > startW && endD > startD && endH > startH;
    }

    public Position toPosition() {
        return new Position(new Coordinates(startW, startD, startH), new Coordinates(endW, endD, endH));
    }

    @Override
    public String toString() {
        return String.format("(%.3f,%.3f,%.3f)-(%.3f,%.3f,%.3f)", startW, startD, startH, endW, endD, endH);
    }
}
