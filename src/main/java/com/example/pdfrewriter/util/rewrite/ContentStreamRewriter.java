package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.exception.PdfRewriteException;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.plan.dto.ReplacementSegment;
import com.example.pdfrewriter.util.stream.ContentOperation;
import com.example.pdfrewriter.util.stream.PageFonts;
import com.example.pdfrewriter.util.stream.PdfOperators;
import com.example.pdfrewriter.util.stream.TextFragmentDecoder;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import com.example.pdfrewriter.util.stream.dto.ShowTextItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按替换计划改写内容流
 *
 * <h3>改写方式</h3>
 * <ul>
 *   <li>只改 MATCH 段所在字符串项的字节：原字节[0, 段起) + 编码(替换文本) + 原字节[段止, end)</li>
 *   <li>新旧宽度差用 TJ 字距补偿，保证后面的文字位置不动：
 *       K = ((新宽 − 旧宽) × 字号 + Tc × 字符数差 + Tw × 空格数差) × 1000 / 字号</li>
 *   <li>Tj 需要补偿时改成 TJ [新字符串 K]；' 和 " 无法插入字距，只改字符串</li>
 *   <li>TJ 中需要隔离的字符串项直接换成等宽的负字距数字</li>
 *   <li>替换文本过宽需要压缩时，操作符前插 Tz（原缩放 × scale），后插 Tz 还原；
 *       压缩后少走的前进量在串尾再补一个字距，后面的文字位置仍然不动</li>
 * </ul>
 *
 * 替换文本无法用当前字体编码时抛 {@link PdfRewriteException}，整个操作符不改。
 */
@Slf4j
public class ContentStreamRewriter {

    private static final double KERNING_EPSILON = 1e-3;
    private static final double FALLBACK_GLYPH_WIDTH = 0.5;
    private static final double SCALE_THRESHOLD = 0.995;

    private final PageFonts fonts;
    private final TextFragmentDecoder decoder;

    public ContentStreamRewriter(PageFonts fonts, TextFragmentDecoder decoder) {
        this.fonts = fonts;
        this.decoder = decoder != null ? decoder : TextFragmentDecoder.LATIN1;
    }

    /**
     * 应用替换计划（不压缩）
     *
     * @param operations 原指令序列（不修改）
     * @param records    最终遍记录，index 与指令下标一致
     * @param plan       替换计划
     * @return 新指令序列
     */
    public List<ContentOperation> apply(List<ContentOperation> operations, List<OperatorRecord> records,
                                        ReplacementPlan plan) {
        return apply(operations, records, plan.getMatchSegments(), Collections.<Integer, Double>emptyMap());
    }

    /**
     * 应用 MATCH 段，并按操作符压缩
     *
     * @param matchSegments 要写回的 MATCH 段（可以是计划的子集）
     * @param scales        操作符 index → 水平压缩比例（0, 1]，没有的或接近 1 的不压缩
     * @return 新指令序列；压缩的操作符前后各多一条 Tz
     */
    public List<ContentOperation> apply(List<ContentOperation> operations, List<OperatorRecord> records,
                                        List<ReplacementSegment> matchSegments, Map<Integer, Double> scales) {
        Map<Integer, OperatorRecord> recordByIndex = new HashMap<>();
        for (OperatorRecord record : records) {
            recordByIndex.put(record.getIndex(), record);
        }
        Map<Integer, List<ReplacementSegment>> byOperator = new TreeMap<>();
        for (ReplacementSegment segment : matchSegments) {
            List<ReplacementSegment> list = byOperator.get(segment.getOperatorIndex());
            if (list == null) {
                list = new ArrayList<>();
                byOperator.put(segment.getOperatorIndex(), list);
            }
            list.add(segment);
        }

        Map<Integer, ContentOperation> rewritten = new HashMap<>();
        for (Map.Entry<Integer, List<ReplacementSegment>> entry : byOperator.entrySet()) {
            int index = entry.getKey();
            OperatorRecord record = recordByIndex.get(index);
            if (record == null || index < 0 || index >= operations.size()) {
                throw new PdfRewriteException("替换计划引用了不存在的操作符: " + index);
            }
            rewritten.put(index, rewriteOperation(operations.get(index), record, entry.getValue(),
                    scaleOf(scales, index)));
        }

        List<ContentOperation> result = new ArrayList<>(operations.size() + 2 * rewritten.size());
        int scaled = 0;
        for (int i = 0; i < operations.size(); i++) {
            ContentOperation replacement = rewritten.get(i);
            if (replacement == null) {
                result.add(operations.get(i));
                continue;
            }
            double scale = scaleOf(scales, i);
            if (scale < SCALE_THRESHOLD) {
                double baseScaling = recordByIndex.get(i).getHorizontalScaling();
                result.add(horizontalScaling(baseScaling * scale));
                result.add(replacement);
                result.add(horizontalScaling(baseScaling));
                scaled++;
            } else {
                result.add(replacement);
            }
        }
        log.debug("内容流改写: {} 个操作符, 压缩 {} 个", byOperator.size(), scaled);
        return result;
    }

    private static double scaleOf(Map<Integer, Double> scales, int index) {
        Double scale = scales != null ? scales.get(index) : null;
        if (scale == null || scale <= 0 || scale >= SCALE_THRESHOLD) {
            return 1.0;
        }
        return scale;
    }

    private static ContentOperation horizontalScaling(double percent) {
        return new ContentOperation(Collections.<COSBase>singletonList(new COSFloat((float) percent)),
                Operator.getOperator(PdfOperators.SET_HORIZONTAL_SCALING));
    }

    private ContentOperation rewriteOperation(ContentOperation operation, OperatorRecord record,
                                              List<ReplacementSegment> segments, double scale) {
        String op = operation.getOperatorName();
        List<COSBase> operands = operation.getOperands();
        if (operands.isEmpty()) {
            throw new PdfRewriteException("文本显示操作符缺少操作数: index=" + record.getIndex());
        }

        if (PdfOperators.SHOW_TEXT_ADJUSTED.equals(op)) {
            COSArray array = (COSArray) operands.get(0);
            COSArray rewritten = rewriteArray(array, record, segments);
            double compression = compressionKerning(record, arrayWidth(record, array), scale);
            if (Math.abs(compression) > KERNING_EPSILON) {
                rewritten.add(new COSFloat((float) compression));
            }
            return new ContentOperation(Collections.<COSBase>singletonList(rewritten), operation.getOperator());
        }

        int position = PdfOperators.SHOW_TEXT.equals(op) ? 0 : operands.size() - 1;
        COSString original = (COSString) operands.get(position);
        ShowTextItem item = record.getStringItems().isEmpty() ? null : record.getStringItems().get(0);
        int itemStart = item != null ? item.getTextStart() : 0;
        EditedString edited = editString(original, record, segments, itemStart);
        double kerning = edited.kerning
                + compressionKerning(record, textSpaceWidth(record, original.getBytes()), scale);

        if (PdfOperators.SHOW_TEXT.equals(op) && Math.abs(kerning) > KERNING_EPSILON) {
            COSArray array = new COSArray();
            array.add(edited.string);
            array.add(new COSFloat((float) kerning));
            return new ContentOperation(Collections.<COSBase>singletonList(array),
                    Operator.getOperator(PdfOperators.SHOW_TEXT_ADJUSTED));
        }
        List<COSBase> newOperands = new ArrayList<>(operands);
        newOperands.set(position, edited.string);
        return new ContentOperation(newOperands, operation.getOperator());
    }

    private COSArray rewriteArray(COSArray array, OperatorRecord record, List<ReplacementSegment> segments) {
        Map<Integer, ShowTextItem> itemsBySlot = new HashMap<>();
        for (ShowTextItem item : record.getStringItems()) {
            itemsBySlot.put(item.getSlot(), item);
        }
        Map<Integer, List<ReplacementSegment>> bySlot = new HashMap<>();
        for (ReplacementSegment segment : segments) {
            if (segment.getItemSlot() < 0) {
                throw new PdfRewriteException("MATCH 段跨越了 TJ 数组元素: " + segment);
            }
            List<ReplacementSegment> list = bySlot.get(segment.getItemSlot());
            if (list == null) {
                list = new ArrayList<>();
                bySlot.put(segment.getItemSlot(), list);
            }
            list.add(segment);
        }

        COSArray result = new COSArray();
        for (int slot = 0; slot < array.size(); slot++) {
            COSBase entry = array.getObject(slot);
            List<ReplacementSegment> slotSegments = bySlot.get(slot);
            if (slotSegments == null || !(entry instanceof COSString)) {
                result.add(array.get(slot));
                continue;
            }
            COSString original = (COSString) entry;
            if (isIsolated(slotSegments)) {
                double width = textSpaceWidth(record, original.getBytes());
                result.add(new COSFloat((float) (-width * 1000.0 / record.getFontSize())));
                log.debug("隔离 TJ 元素: op={}, slot={}, width={}", record.getIndex(), slot, width);
                continue;
            }
            ShowTextItem item = itemsBySlot.get(slot);
            EditedString edited = editString(original, record, slotSegments, item != null ? item.getTextStart() : 0);
            result.add(edited.string);
            if (Math.abs(edited.kerning) > KERNING_EPSILON) {
                result.add(new COSFloat((float) edited.kerning));
            }
        }
        return result;
    }

    private static boolean isIsolated(List<ReplacementSegment> segments) {
        for (ReplacementSegment segment : segments) {
            if (segment.isRequiresIsolation()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 逐段替换字符串项的字节，从后往前改，前面段的字节偏移不受影响
     */
    private EditedString editString(COSString original, OperatorRecord record, List<ReplacementSegment> segments,
                                    int itemStart) {
        String fontResource = record.getFontResource();
        byte[] bytes = original.getBytes();
        int[] offsets = decoder.byteOffsets(fontResource, original);
        int textLength = offsets.length - 1;

        List<ReplacementSegment> ordered = new ArrayList<>(segments);
        Collections.sort(ordered, new Comparator<ReplacementSegment>() {
            @Override
            public int compare(ReplacementSegment a, ReplacementSegment b) {
                return Integer.compare(b.getLocalStart(), a.getLocalStart());
            }
        });

        byte[] current = bytes;
        for (ReplacementSegment segment : ordered) {
            int from = clamp(segment.getLocalStart() - itemStart, textLength);
            int to = clamp(segment.getLocalEnd() - itemStart, textLength);
            int byteStart = offsets[from];
            int byteEnd = to < textLength ? offsets[to] : bytes.length;
            byte[] encoded = encode(fontResource, segment.getPlannedText());

            // byteEnd 之前的字节还没被改过
            int tailLength = current.length - byteEnd;
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(current, 0, byteStart);
            out.write(encoded, 0, encoded.length);
            out.write(current, current.length - tailLength, tailLength);
            current = out.toByteArray();
        }

        COSString string = new COSString(current);
        string.setForceHexForm(original.getForceHexForm());

        double kerning = kerningFor(record, bytes, current);
        return new EditedString(string, kerning);
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    private byte[] encode(String fontResource, String text) {
        if (text == null || text.isEmpty()) {
            return new byte[0];
        }
        PDFont font = fonts != null ? fonts.byResourceName(fontResource) : null;
        if (font == null) {
            CharsetEncoder encoder = StandardCharsets.ISO_8859_1.newEncoder();
            if (!encoder.canEncode(text)) {
                throw new PdfRewriteException("替换文本无法按 ISO-8859-1 编码: '" + text + "'");
            }
            return text.getBytes(StandardCharsets.ISO_8859_1);
        }
        try {
            return font.encode(text);
        } catch (IOException | IllegalArgumentException e) {
            throw new PdfRewriteException("替换文本无法用字体 " + font.getName() + " 编码: '" + text + "'", e);
        }
    }

    /**
     * 新旧字节串宽度差对应的 TJ 字距（千分之一文本空间单位，正数左移）
     */
    private double kerningFor(OperatorRecord record, byte[] originalBytes, byte[] newBytes) {
        double fontSize = record.getFontSize();
        if (fontSize == 0) {
            return 0.0;
        }
        GlyphRun before = measure(record.getFontResource(), originalBytes);
        GlyphRun after = measure(record.getFontResource(), newBytes);
        double delta = (after.emWidth - before.emWidth) * fontSize
                + record.getCharSpacing() * (after.codes - before.codes)
                + record.getWordSpacing() * (after.spaces - before.spaces);
        return delta * 1000.0 / fontSize;
    }

    /**
     * Tz 压缩到 scale 后补回的字距：压缩后前进量 = scale × (原宽 − K × 字号 / 1000)，令其等于原宽
     *
     * @param originalWidth 操作符原来在文本空间的宽度（未乘水平缩放）
     */
    private static double compressionKerning(OperatorRecord record, double originalWidth, double scale) {
        double fontSize = record.getFontSize();
        if (scale >= 1.0 || fontSize == 0) {
            return 0.0;
        }
        return -(1.0 / scale - 1.0) * originalWidth * 1000.0 / fontSize;
    }

    /**
     * TJ 数组原来的文本空间宽度：字符串宽度减去字距
     */
    private double arrayWidth(OperatorRecord record, COSArray array) {
        double width = 0;
        for (int i = 0; i < array.size(); i++) {
            COSBase entry = array.getObject(i);
            if (entry instanceof COSString) {
                width += textSpaceWidth(record, ((COSString) entry).getBytes());
            } else if (entry instanceof COSNumber) {
                width -= ((COSNumber) entry).floatValue() / 1000.0 * record.getFontSize();
            }
        }
        return width;
    }

    /**
     * 字节串在文本空间的宽度（未乘水平缩放）
     */
    private double textSpaceWidth(OperatorRecord record, byte[] bytes) {
        GlyphRun run = measure(record.getFontResource(), bytes);
        return run.emWidth * record.getFontSize()
                + record.getCharSpacing() * run.codes
                + record.getWordSpacing() * run.spaces;
    }

    private GlyphRun measure(String fontResource, byte[] bytes) {
        GlyphRun run = new GlyphRun();
        PDFont font = fonts != null ? fonts.byResourceName(fontResource) : null;
        if (font == null) {
            for (byte b : bytes) {
                run.add(FALLBACK_GLYPH_WIDTH, (b & 0xFF) == 32);
            }
            return run;
        }
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            while (in.available() > 0) {
                int available = in.available();
                int code = font.readCode(in);
                boolean singleByteSpace = available - in.available() == 1 && code == 32;
                run.add(font.getWidth(code) / 1000.0, singleByteSpace);
            }
        } catch (IOException e) {
            throw new PdfRewriteException("读取字形宽度失败: font=" + fontResource, e);
        }
        return run;
    }

    /**
     * 把指令序列写回页面内容流（Flate 压缩）
     */
    public static void writeToPage(PDDocument document, PDPage page, List<ContentOperation> operations)
            throws IOException {
        PDStream stream = new PDStream(document);
        try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
            ContentStreamWriter writer = new ContentStreamWriter(out);
            for (ContentOperation operation : operations) {
                writer.writeTokens(operation.toTokens());
            }
        }
        page.setContents(stream);
    }

    private static final class GlyphRun {
        private double emWidth;
        private int codes;
        private int spaces;

        private void add(double width, boolean space) {
            emWidth += width;
            codes++;
            if (space) {
                spaces++;
            }
        }
    }

    private static final class EditedString {
        private final COSString string;
        private final double kerning;

        private EditedString(COSString string, double kerning) {
            this.string = string;
            this.kerning = kerning;
        }
    }
}
