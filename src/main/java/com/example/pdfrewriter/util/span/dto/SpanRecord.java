package com.example.pdfrewriter.util.span.dto;

import com.example.pdfrewriter.util.span.SpanTextNormalizer;
import com.example.pdfrewriter.util.stream.AffineMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个视觉文本 run（同字体、同字号、同基线、同方向的连续字形）
 *
 * <h3>两套字符视图</h3>
 * <ul>
 *   <li>characters：原始字形序列，text 是它们的拼接</li>
 *   <li>normalizedChars：连字展开、零宽字符过滤后的视图，normalizedText 是它们的拼接；
 *       展开出的每个字符沿用原字形的包围盒</li>
 * </ul>
 * graphemeSlices 无缝无重叠地划分 normalizedText；
 * normalizedToRaw[i] 是第 i 个归一化字符在 text 中的原始区间。
 */
public final class SpanRecord {

    private final int pageIndex;
    private final int blockIndex;
    private final int lineIndex;
    private final int spanIndex;
    private final String text;
    private final String font;
    private final double fontSize;
    private final double[] bbox;
    private final double originX;
    private final double originY;
    private final double directionX;
    private final double directionY;
    private final AffineMatrix matrix;
    private final List<CharBox> characters;
    private final String normalizedText;
    private final List<CharBox> normalizedChars;
    private final List<GraphemeSlice> graphemeSlices;
    private final List<int[]> normalizedToRaw;

    private SpanRecord(int pageIndex, int blockIndex, int lineIndex, int spanIndex, String text, String font,
                       double fontSize, double[] bbox, double originX, double originY,
                       double directionX, double directionY, List<CharBox> characters, String normalizedText,
                       List<CharBox> normalizedChars, List<GraphemeSlice> graphemeSlices,
                       List<int[]> normalizedToRaw) {
        this.pageIndex = pageIndex;
        this.blockIndex = blockIndex;
        this.lineIndex = lineIndex;
        this.spanIndex = spanIndex;
        this.text = text;
        this.font = font;
        this.fontSize = fontSize;
        this.bbox = bbox;
        this.originX = originX;
        this.originY = originY;
        this.directionX = directionX;
        this.directionY = directionY;
        this.matrix = inferMatrix(fontSize, originX, originY, directionX, directionY);
        this.characters = Collections.unmodifiableList(characters);
        this.normalizedText = normalizedText;
        this.normalizedChars = Collections.unmodifiableList(normalizedChars);
        this.graphemeSlices = Collections.unmodifiableList(graphemeSlices);
        this.normalizedToRaw = Collections.unmodifiableList(normalizedToRaw);
    }

    /**
     * 由字形序列构建 span，同时生成归一化视图
     *
     * @param characters 原始字形（每项文本可以是多字符，如 "ﬁ" 或代理对）
     * @param direction  书写方向，可以未归一化；零向量按 (1, 0) 处理
     */
    public static SpanRecord fromCharacters(int pageIndex, int blockIndex, int lineIndex, int spanIndex,
                                            String font, double fontSize, double originX, double originY,
                                            double[] direction, List<CharBox> characters) {
        double dx = direction != null && direction.length >= 2 ? direction[0] : 1.0;
        double dy = direction != null && direction.length >= 2 ? direction[1] : 0.0;
        double length = Math.hypot(dx, dy);
        if (length <= 1e-6) {
            dx = 1.0;
            dy = 0.0;
        } else {
            dx /= length;
            dy /= length;
        }

        StringBuilder raw = new StringBuilder();
        StringBuilder normalized = new StringBuilder();
        List<CharBox> normalizedChars = new ArrayList<>();
        List<GraphemeSlice> slices = new ArrayList<>();
        List<int[]> toRaw = new ArrayList<>();
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;

        for (CharBox glyph : characters) {
            int rawStart = raw.length();
            raw.append(glyph.getText());
            int rawEnd = raw.length();

            minX = Math.min(minX, glyph.getX0());
            minY = Math.min(minY, glyph.getY0());
            maxX = Math.max(maxX, glyph.getX1());
            maxY = Math.max(maxY, glyph.getY1());

            int clusterStart = normalized.length();
            String glyphText = glyph.getText();
            for (int i = 0; i < glyphText.length(); i++) {
                String expanded = SpanTextNormalizer.expandChar(glyphText.charAt(i));
                for (int k = 0; k < expanded.length(); k++) {
                    String ch = String.valueOf(expanded.charAt(k));
                    normalized.append(ch);
                    normalizedChars.add(glyph.withText(ch));
                    toRaw.add(new int[]{rawStart, rawEnd});
                }
            }
            int clusterEnd = normalized.length();
            if (clusterEnd == clusterStart) {
                continue;
            }

            // 组合附加符号并入前一个簇
            if (!slices.isEmpty() && isCombiningMark(glyphText)) {
                GraphemeSlice previous = slices.remove(slices.size() - 1);
                slices.add(new GraphemeSlice(normalized.substring(previous.getStart(), clusterEnd),
                        previous.getStart(), clusterEnd));
            } else {
                slices.add(new GraphemeSlice(normalized.substring(clusterStart, clusterEnd), clusterStart, clusterEnd));
            }
        }

        double[] bbox = characters.isEmpty()
                ? new double[]{originX, originY, originX, originY}
                : new double[]{minX, minY, maxX, maxY};

        return new SpanRecord(pageIndex, blockIndex, lineIndex, spanIndex, raw.toString(), font, fontSize, bbox,
                originX, originY, dx, dy, new ArrayList<>(characters), normalized.toString(), normalizedChars,
                slices, toRaw);
    }

    private static boolean isCombiningMark(String glyphText) {
        if (glyphText.isEmpty()) {
            return false;
        }
        int type = Character.getType(glyphText.codePointAt(0));
        return type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || type == Character.COMBINING_SPACING_MARK;
    }

    /**
     * 由字号、基线原点和方向推出 span 的文本矩阵
     */
    private static AffineMatrix inferMatrix(double fontSize, double originX, double originY, double dx, double dy) {
        if (fontSize == 0) {
            return AffineMatrix.identity();
        }
        return new AffineMatrix(dx * fontSize, dy * fontSize, -dy * fontSize, dx * fontSize, originX, originY);
    }

    /**
     * 归一化区间 [start, end) 对应的原始文本区间
     */
    public int[] rawRange(int start, int end) {
        if (normalizedToRaw.isEmpty() || end <= start) {
            int anchor = start < normalizedToRaw.size() ? normalizedToRaw.get(Math.max(start, 0))[0] : text.length();
            return new int[]{anchor, anchor};
        }
        int from = normalizedToRaw.get(Math.max(start, 0))[0];
        int to = normalizedToRaw.get(Math.min(end, normalizedToRaw.size()) - 1)[1];
        return new int[]{from, Math.max(from, to)};
    }

    /**
     * 归一化区间内字符包围盒宽度之和
     */
    public double widthOf(int start, int end) {
        double width = 0;
        int upper = Math.min(end, normalizedChars.size());
        for (int i = Math.max(start, 0); i < upper; i++) {
            width += normalizedChars.get(i).getWidth();
        }
        return width;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getBlockIndex() {
        return blockIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }

    public int getSpanIndex() {
        return spanIndex;
    }

    public String getText() {
        return text;
    }

    public String getFont() {
        return font;
    }

    public double getFontSize() {
        return fontSize;
    }

    public double[] getBbox() {
        return bbox.clone();
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

    public AffineMatrix getMatrix() {
        return matrix;
    }

    public List<CharBox> getCharacters() {
        return characters;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public List<CharBox> getNormalizedChars() {
        return normalizedChars;
    }

    public List<GraphemeSlice> getGraphemeSlices() {
        return graphemeSlices;
    }

    public List<int[]> getNormalizedToRaw() {
        return normalizedToRaw;
    }

    @Override
    public String toString() {
        return "SpanRecord{page=" + pageIndex + ", block=" + blockIndex + ", line=" + lineIndex
                + ", span=" + spanIndex + ", text='" + text + "', font=" + font + ", size=" + fontSize + '}';
    }
}
