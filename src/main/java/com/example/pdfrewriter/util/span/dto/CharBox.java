package com.example.pdfrewriter.util.span.dto;

/**
 * 单个字符及其包围盒（PDF 用户空间，y 轴向上）
 */
public final class CharBox {

    private final String text;
    private final double x0;
    private final double y0;
    private final double x1;
    private final double y1;

    public CharBox(String text, double x0, double y0, double x1, double y1) {
        this.text = text != null ? text : "";
        this.x0 = Math.min(x0, x1);
        this.y0 = Math.min(y0, y1);
        this.x1 = Math.max(x0, x1);
        this.y1 = Math.max(y0, y1);
    }

    /**
     * 同一包围盒换一个字符（连字展开时每个展开字符共用原字形的盒子）
     */
    public CharBox withText(String value) {
        return new CharBox(value, x0, y0, x1, y1);
    }

    public String getText() {
        return text;
    }

    public double getX0() {
        return x0;
    }

    public double getY0() {
        return y0;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double getWidth() {
        return x1 - x0;
    }

    public double getHeight() {
        return y1 - y0;
    }

    /**
     * 四个角点在单位方向向量上的投影 [min, max]
     */
    public double[] project(double dirX, double dirY) {
        double p1 = x0 * dirX + y0 * dirY;
        double p2 = x1 * dirX + y0 * dirY;
        double p3 = x0 * dirX + y1 * dirY;
        double p4 = x1 * dirX + y1 * dirY;
        return new double[]{
                Math.min(Math.min(p1, p2), Math.min(p3, p4)),
                Math.max(Math.max(p1, p2), Math.max(p3, p4))
        };
    }

    @Override
    public String toString() {
        return String.format("CharBox{'%s', [%.2f, %.2f, %.2f, %.2f]}", text, x0, y0, x1, y1);
    }
}
