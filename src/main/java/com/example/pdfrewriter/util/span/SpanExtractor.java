package com.example.pdfrewriter.util.span;

import com.example.pdfrewriter.util.span.dto.CharBox;
import com.example.pdfrewriter.util.span.dto.GlyphSample;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 视觉 span 提取器
 *
 * ========== 技术路线 ==========
 * 继承 PDFTextStripper，但不使用它的排序/分词输出：
 * 重写 processTextPosition，按内容流绘制顺序原样收集每个字形的 TextPosition，
 * 再按几何关系自行分组：
 *
 * 1. 行（line）：基线（法向投影）变化超过半个字号，或行内位置大幅回退
 * 2. 块（block）：换行且基线跳变超过两倍字号，或书写方向改变
 * 3. span：同一行内字体或字号变化
 *
 * 保持绘制顺序是关键：后续对齐按内容流顺序单调搜索，
 * 如果像 setSortByPosition(true) 那样重排，多栏页面会整体错位。
 *
 * 坐标全部是 PDF 用户空间（y 轴向上），与内容流矩阵推算的位置可以直接比较。
 */
@Slf4j
public class SpanExtractor extends PDFTextStripper {

    /** 基线变化阈值（字号倍数），超过视为换行 */
    private static final double LINE_BREAK_FACTOR = 0.5;

    /** 基线跳变阈值（字号倍数），超过视为新块 */
    private static final double BLOCK_BREAK_FACTOR = 2.0;

    /** 行内回退阈值（字号倍数），超过视为换行 */
    private static final double BACKTRACK_FACTOR = 1.0;

    private final List<GlyphSample> samples = new ArrayList<>();

    public SpanExtractor() throws IOException {
        super();
        setSortByPosition(false);
    }

    /**
     * 提取一页的 span
     *
     * @param document  已打开的文档
     * @param pageIndex 页索引（从 0 开始）
     * @return 按 block/line/span 顺序的 span 列表；无可提取文本时为空列表
     */
    public List<SpanRecord> extract(PDDocument document, int pageIndex) throws IOException {
        samples.clear();
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        getText(document);

        List<SpanRecord> spans = buildSpans(pageIndex, new ArrayList<>(samples));
        log.debug("第 {} 页提取到 {} 个字形, {} 个 span", pageIndex + 1, samples.size(), spans.size());
        return spans;
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        samples.clear();
        super.startPage(page);
    }

    /**
     * 不调用父类实现：不需要它的去重和文章分组，只要原始绘制序列
     */
    @Override
    protected void processTextPosition(TextPosition text) {
        String unicode = text.getUnicode();
        if (unicode == null || unicode.isEmpty()) {
            return;
        }
        Matrix matrix = text.getTextMatrix();
        String fontName = text.getFont() != null && text.getFont().getName() != null ? text.getFont().getName() : "";
        samples.add(new GlyphSample(
                unicode,
                fontName,
                text.getFontSizeInPt(),
                matrix.getTranslateX(),
                matrix.getTranslateY(),
                matrix.getScaleX(),
                matrix.getShearY(),
                text.getWidthDirAdj(),
                text.getHeightDir()));
    }

    /**
     * 由字形采样分组构建 span（纯函数）
     */
    public static List<SpanRecord> buildSpans(int pageIndex, List<GlyphSample> glyphs) {
        List<SpanRecord> spans = new ArrayList<>();
        if (glyphs == null || glyphs.isEmpty()) {
            return spans;
        }

        int blockIndex = 0;
        int lineIndex = 0;
        int spanIndex = 0;
        List<GlyphSample> current = new ArrayList<>();
        GlyphSample previous = null;

        for (GlyphSample glyph : glyphs) {
            if (previous != null) {
                double size = Math.max(Math.max(previous.getFontSize(), glyph.getFontSize()), 1.0);
                boolean directionChanged = Math.abs(previous.getDirectionX() - glyph.getDirectionX()) > 1e-3
                        || Math.abs(previous.getDirectionY() - glyph.getDirectionY()) > 1e-3;
                double baselineShift = Math.abs(glyph.baselineProjection() - previous.baselineProjection());
                double backtrack = previous.alongProjection() + previous.getWidth() - glyph.alongProjection();
                boolean lineBreak = directionChanged
                        || baselineShift > LINE_BREAK_FACTOR * size
                        || backtrack > BACKTRACK_FACTOR * size;
                boolean styleChanged = !previous.getFont().equals(glyph.getFont())
                        || Math.abs(previous.getFontSize() - glyph.getFontSize()) > 0.01;

                if (lineBreak || styleChanged) {
                    addSpan(spans, pageIndex, blockIndex, lineIndex, spanIndex, current);
                    current = new ArrayList<>();
                    if (lineBreak) {
                        spanIndex = 0;
                        if (directionChanged || baselineShift > BLOCK_BREAK_FACTOR * size) {
                            blockIndex++;
                            lineIndex = 0;
                        } else {
                            lineIndex++;
                        }
                    } else {
                        spanIndex++;
                    }
                }
            }
            current.add(glyph);
            previous = glyph;
        }
        addSpan(spans, pageIndex, blockIndex, lineIndex, spanIndex, current);
        return spans;
    }

    private static void addSpan(List<SpanRecord> spans, int pageIndex, int blockIndex, int lineIndex, int spanIndex,
                                List<GlyphSample> glyphs) {
        if (glyphs.isEmpty()) {
            return;
        }
        List<CharBox> characters = new ArrayList<>(glyphs.size());
        for (GlyphSample glyph : glyphs) {
            characters.add(glyph.toCharBox());
        }
        GlyphSample first = glyphs.get(0);
        SpanRecord span = SpanRecord.fromCharacters(pageIndex, blockIndex, lineIndex, spanIndex,
                first.getFont(), first.getFontSize(), first.getOriginX(), first.getOriginY(),
                new double[]{first.getDirectionX(), first.getDirectionY()}, characters);
        if (!span.getText().isEmpty()) {
            spans.add(span);
        }
    }
}
