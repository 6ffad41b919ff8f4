package com.example.pdfrewriter.util.stream;

/**
 * 图形/文本状态快照（不可变）
 *
 * q 时把当前快照压栈，Q 时出栈丢弃；每次状态变化都产生新对象，
 * 已记录进 OperatorRecord 的快照不会被后续指令修改。
 */
public final class TextGraphicsState {

    public static final double DEFAULT_FONT_SIZE = 12.0;
    public static final double DEFAULT_HORIZONTAL_SCALING = 100.0;

    private final AffineMatrix ctm;
    private final AffineMatrix textMatrix;
    private final AffineMatrix textLineMatrix;
    private final String fontResource;
    private final double fontSize;
    private final double charSpacing;
    private final double wordSpacing;
    private final double horizontalScaling;
    private final double leading;
    private final double textRise;

    public TextGraphicsState(AffineMatrix ctm, AffineMatrix textMatrix, AffineMatrix textLineMatrix,
                             String fontResource, double fontSize, double charSpacing, double wordSpacing,
                             double horizontalScaling, double leading, double textRise) {
        this.ctm = ctm;
        this.textMatrix = textMatrix;
        this.textLineMatrix = textLineMatrix;
        this.fontResource = fontResource;
        this.fontSize = fontSize;
        this.charSpacing = charSpacing;
        this.wordSpacing = wordSpacing;
        this.horizontalScaling = horizontalScaling;
        this.leading = leading;
        this.textRise = textRise;
    }

    public static TextGraphicsState initial() {
        return new TextGraphicsState(AffineMatrix.identity(), AffineMatrix.identity(), AffineMatrix.identity(),
                null, DEFAULT_FONT_SIZE, 0, 0, DEFAULT_HORIZONTAL_SCALING, 0, 0);
    }

    /**
     * BT：文本矩阵/行矩阵归位，间距参数恢复默认（字体、字号、行距保持）
     */
    public TextGraphicsState beginText() {
        return new TextGraphicsState(ctm, AffineMatrix.identity(), AffineMatrix.identity(),
                fontResource, fontSize, 0, 0, DEFAULT_HORIZONTAL_SCALING, leading, 0);
    }

    public TextGraphicsState withCtm(AffineMatrix value) {
        return new TextGraphicsState(value, textMatrix, textLineMatrix, fontResource, fontSize,
                charSpacing, wordSpacing, horizontalScaling, leading, textRise);
    }

    /**
     * 同时设置文本矩阵和行矩阵（Tm / Td / T* 之后二者相等）
     */
    public TextGraphicsState withTextMatrices(AffineMatrix value) {
        return new TextGraphicsState(ctm, value, value, fontResource, fontSize,
                charSpacing, wordSpacing, horizontalScaling, leading, textRise);
    }

    /**
     * 只移动文本矩阵（文本显示后的前进），行矩阵不变
     */
    public TextGraphicsState withTextMatrix(AffineMatrix value) {
        return new TextGraphicsState(ctm, value, textLineMatrix, fontResource, fontSize,
                charSpacing, wordSpacing, horizontalScaling, leading, textRise);
    }

    public TextGraphicsState withFont(String resource, double size) {
        return new TextGraphicsState(ctm, textMatrix, textLineMatrix, resource, size,
                charSpacing, wordSpacing, horizontalScaling, leading, textRise);
    }

    public TextGraphicsState withCharSpacing(double value) {
        return new TextGraphicsState(ctm, textMatrix, textLineMatrix, fontResource, fontSize,
                value, wordSpacing, horizontalScaling, leading, textRise);
    }

    public TextGraphicsState withWordSpacing(double value) {
        return new TextGraphicsState(ctm, textMatrix, textLineMatrix, fontResource, fontSize,
                charSpacing, value, horizontalScaling, leading, textRise);
    }

    public TextGraphicsState withHorizontalScaling(double value) {
        return new TextGraphicsState(ctm, textMatrix, textLineMatrix, fontResource, fontSize,
                charSpacing, wordSpacing, value, leading, textRise);
    }

    public TextGraphicsState withLeading(double value) {
        return new TextGraphicsState(ctm, textMatrix, textLineMatrix, fontResource, fontSize,
                charSpacing, wordSpacing, horizontalScaling, value, textRise);
    }

    public TextGraphicsState withTextRise(double value) {
        return new TextGraphicsState(ctm, textMatrix, textLineMatrix, fontResource, fontSize,
                charSpacing, wordSpacing, horizontalScaling, leading, value);
    }

    /**
     * 水平缩放系数（Tz/100），Tz 为 0 时按 1 处理
     */
    public double horizontalScale() {
        return horizontalScaling != 0 ? horizontalScaling / 100.0 : 1.0;
    }

    public AffineMatrix getCtm() {
        return ctm;
    }

    public AffineMatrix getTextMatrix() {
        return textMatrix;
    }

    public AffineMatrix getTextLineMatrix() {
        return textLineMatrix;
    }

    public String getFontResource() {
        return fontResource;
    }

    public double getFontSize() {
        return fontSize;
    }

    public double getCharSpacing() {
        return charSpacing;
    }

    public double getWordSpacing() {
        return wordSpacing;
    }

    public double getHorizontalScaling() {
        return horizontalScaling;
    }

    public double getLeading() {
        return leading;
    }

    public double getTextRise() {
        return textRise;
    }
}
