package com.example.pdfrewriter.util.align;

import org.apache.pdfbox.util.Vector;

/**
 * 一个操作符的前进量及其几何依据
 *
 * advance 为用户空间长度；startProjection/endProjection 是首尾字形在方向向量上的投影，
 * 供漂移检查使用。
 */
public final class AdvanceMetrics {

    private final double advance;
    private final double startProjection;
    private final double endProjection;
    private final double directionX;
    private final double directionY;
    private final boolean fromSpans;

    public AdvanceMetrics(double advance, double startProjection, double endProjection,
                          double directionX, double directionY, boolean fromSpans) {
        this.advance = advance;
        this.startProjection = startProjection;
        this.endProjection = endProjection;
        this.directionX = directionX;
        this.directionY = directionY;
        this.fromSpans = fromSpans;
    }

    public double getAdvance() {
        return advance;
    }

    public double getStartProjection() {
        return startProjection;
    }

    public double getEndProjection() {
        return endProjection;
    }

    public double getDirectionX() {
        return directionX;
    }

    public double getDirectionY() {
        return directionY;
    }

    public Vector getDirection() {
        return new Vector((float) directionX, (float) directionY);
    }

    /**
     * true：由 span 几何测得；false：由朴素估算推出
     */
    public boolean isFromSpans() {
        return fromSpans;
    }

    @Override
    public String toString() {
        return String.format("AdvanceMetrics{advance=%.3f, proj=[%.3f, %.3f], dir=(%.3f, %.3f), spans=%s}",
                advance, startProjection, endProjection, directionX, directionY, fromSpans);
    }
}
