package com.example.pdfrewriter.util.span.dto;

/**
 * 一次字形绘制的几何采样（脱离 PDFBox 类型，便于单测直接构造）
 */
public final class GlyphSample {

    private final String unicode;
    private final String font;
    private final double fontSize;
    private final double originX;
    private final double originY;
    private final double directionX;
    private final double directionY;
    private final double width;
    private final double height;

    public GlyphSample(String unicode, String font, double fontSize, double originX, double originY,
                       double directionX, double directionY, double width, double height) {
        this.unicode = unicode;
        this.font = font;
        this.fontSize = fontSize;
        this.originX = originX;
        this.originY = originY;
        double length = Math.hypot(directionX, directionY);
        this.directionX = length > 1e-6 ? directionX / length : 1.0;
        this.directionY = length > 1e-6 ? directionY / length : 0.0;
        this.width = width;
        this.height = height;
    }

    /**
     * 水平书写的字形
     */
    public static GlyphSample horizontal(String unicode, String font, double fontSize,
                                         double originX, double baseline, double width) {
        return new GlyphSample(unicode, font, fontSize, originX, baseline, 1, 0, width, fontSize);
    }

    /**
     * 字形四边形（原点、沿方向的宽、垂直方向的高）的轴对齐包围盒
     */
    public CharBox toCharBox() {
        double ux = directionX * width;
        double uy = directionY * width;
        double vx = -directionY * height;
        double vy = directionX * height;
        double[] xs = {originX, originX + ux, originX + vx, originX + ux + vx};
        double[] ys = {originY, originY + uy, originY + vy, originY + uy + vy};
        double minX = xs[0];
        double maxX = xs[0];
        double minY = ys[0];
        double maxY = ys[0];
        for (int i = 1; i < 4; i++) {
            minX = Math.min(minX, xs[i]);
            maxX = Math.max(maxX, xs[i]);
            minY = Math.min(minY, ys[i]);
            maxY = Math.max(maxY, ys[i]);
        }
        return new CharBox(unicode, minX, minY, maxX, maxY);
    }

    /**
     * 原点在方向上的投影（行内位置）
     */
    public double alongProjection() {
        return originX * directionX + originY * directionY;
    }

    /**
     * 原点在法向上的投影（基线位置）
     */
    public double baselineProjection() {
        return -directionY * originX + directionX * originY;
    }

    public String getUnicode() {
        return unicode;
    }

    public String getFont() {
        return font;
    }

    public double getFontSize() {
        return fontSize;
    }

    public double getOriginX() {
        return originX;
    }

    public double getOriginY() {
        return originY;
    }

    public double getDirectionX() {
        return directionX;
    }

    public double getDirectionY() {
        return directionY;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }
}
