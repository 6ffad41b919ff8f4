package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.util.rewrite.dto.SpanKey;
import com.example.pdfrewriter.util.rewrite.dto.SpanMappingRef;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.SpanSliceReplacement;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import com.example.pdfrewriter.util.span.SpanTextNormalizer;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 单个物理 span 的替换累加器
 *
 * <h3>添加规则</h3>
 * <ul>
 *   <li>新替换完全覆盖已有替换：删除已有的</li>
 *   <li>新替换被已有替换完全覆盖：忽略新的</li>
 *   <li>部分重叠：保留先来的，忽略新的（避免同一片段被改两次）</li>
 * </ul>
 *
 * <h3>生成最终改写</h3>
 * <ol>
 *   <li>每处替换的归一化区间映射回原始文本区间，校验当前文本与期望原文一致
 *       （NFKD 分解、去空白后比较）；任何一处不一致都记录 ValidationFailure，
 *       整个 span 不产出改写，不做重新定位</li>
 *   <li>按起点从后往前依次替换，合并成最终文本</li>
 *   <li>替换文本比原文宽时计算水平缩放 = 原宽 / 新宽，下限 minScale；
 *       触底时标记 overlayFallback</li>
 * </ol>
 *
 * 非线程安全：一页改写期间由调用方独占。
 */
@Slf4j
public class SpanRewriteAccumulator {

    public static final double DEFAULT_MIN_SCALE = 0.5;

    private final SpanRecord span;
    private final double minScale;
    private final List<SpanSliceReplacement> replacements = new ArrayList<>();
    private final List<ValidationFailure> validationFailures = new ArrayList<>();

    public SpanRewriteAccumulator(SpanRecord span) {
        this(span, DEFAULT_MIN_SCALE);
    }

    public SpanRewriteAccumulator(SpanRecord span, double minScale) {
        this.span = span;
        this.minScale = minScale;
    }

    public void addReplacement(int start, int end, String replacement, SpanMappingRef mappingRef) {
        addReplacement(start, end, replacement, mappingRef, false);
    }

    public void addReplacement(int start, int end, String replacement, SpanMappingRef mappingRef,
                               boolean overlayFallback) {
        if (end <= start) {
            return;
        }
        List<SpanSliceReplacement> covered = new ArrayList<>();
        for (SpanSliceReplacement existing : replacements) {
            if (start <= existing.getStart() && end >= existing.getEnd()) {
                covered.add(existing);
                continue;
            }
            if (existing.covers(start, end) || existing.overlaps(start, end)) {
                log.debug("忽略重叠替换: span={}, [{}, {}) 与已有 {} 冲突", SpanKey.of(span), start, end, existing);
                return;
            }
        }
        replacements.removeAll(covered);
        replacements.add(new SpanSliceReplacement(start, end, replacement, mappingRef, overlayFallback));
    }

    /**
     * 生成最终改写
     *
     * @param pageIndex  页索引
     * @param measurer   宽度测量
     * @param charWidths 单字符宽度覆盖表，可以为 null
     * @return 改写；没有待替换项、或任一处校验失败时返回 null
     */
    public SpanRewriteEntry buildEntry(int pageIndex, WidthMeasurer measurer, Map<String, Double> charWidths) {
        validationFailures.clear();
        if (replacements.isEmpty()) {
            return null;
        }
        String baseText = span.getText();
        if (baseText == null || baseText.isEmpty()) {
            return null;
        }

        List<SpanSliceReplacement> ordered = new ArrayList<>(replacements);
        Collections.sort(ordered, new Comparator<SpanSliceReplacement>() {
            @Override
            public int compare(SpanSliceReplacement a, SpanSliceReplacement b) {
                return Integer.compare(b.getStart(), a.getStart());
            }
        });

        SpanKey key = new SpanKey(pageIndex, span.getBlockIndex(), span.getLineIndex(), span.getSpanIndex());
        List<int[]> rawRanges = new ArrayList<>(ordered.size());
        for (SpanSliceReplacement item : ordered) {
            int[] raw = span.rawRange(item.getStart(), item.getEnd());
            String observed = baseText.substring(raw[0], raw[1]);
            String expected = item.getMappingRef() != null ? item.getMappingRef().getOriginal() : "";
            if (!expected.isEmpty() && !SpanTextNormalizer.equivalent(expected, observed)) {
                validationFailures.add(new ValidationFailure(key, expected, observed, raw[0], raw[1],
                        item.getReplacement(),
                        item.getMappingRef().getRequestId(),
                        item.getMappingRef().getOperatorIndex()));
            }
            rawRanges.add(raw);
        }
        if (!validationFailures.isEmpty()) {
            for (ValidationFailure failure : validationFailures) {
                log.warn("span 文本校验失败，放弃该 span 的改写: {}", failure);
            }
            return null;
        }

        StringBuilder text = new StringBuilder(baseText);
        boolean overlay = false;
        for (int i = 0; i < ordered.size(); i++) {
            int[] raw = rawRanges.get(i);
            text.replace(raw[0], raw[1], ordered.get(i).getReplacement());
            overlay |= ordered.get(i).isOverlayFallback();
        }
        String replacementText = text.toString();

        double[] bbox = span.getBbox();
        double originalWidth = bbox[2] - bbox[0];
        double replacementWidth = measurer != null ? measurer.measure(replacementText, span, charWidths) : 0.0;

        double scale = 1.0;
        boolean requiresScaling = false;
        if (replacementWidth > 0 && originalWidth > 0 && replacementWidth > originalWidth) {
            scale = originalWidth / replacementWidth;
            requiresScaling = true;
            if (scale < minScale) {
                log.info("替换文本过宽，缩放 {} 低于下限 {}，改用覆盖层: span={}", scale, minScale, key);
                scale = minScale;
                overlay = true;
            }
        }

        List<SpanSliceReplacement> inOrder = new ArrayList<>(ordered);
        Collections.reverse(inOrder);
        List<SpanMappingRef> mappings = new ArrayList<>();
        Integer operatorIndex = null;
        for (SpanSliceReplacement item : inOrder) {
            if (item.getMappingRef() != null) {
                mappings.add(item.getMappingRef());
                if (operatorIndex == null) {
                    operatorIndex = item.getMappingRef().getOperatorIndex();
                }
            }
        }

        return SpanRewriteEntry.builder()
                .spanKey(key)
                .operatorIndex(operatorIndex)
                .originalText(baseText)
                .replacementText(replacementText)
                .font(span.getFont())
                .fontSize(span.getFontSize())
                .bbox(bbox)
                .matrix(span.getMatrix())
                .originalWidth(originalWidth)
                .replacementWidth(replacementWidth)
                .scaleFactor(scale)
                .requiresScaling(requiresScaling)
                .overlayFallback(overlay)
                .mappings(Collections.unmodifiableList(mappings))
                .sliceReplacements(Collections.unmodifiableList(inOrder))
                .build();
    }

    public SpanRecord getSpan() {
        return span;
    }

    public List<SpanSliceReplacement> getReplacements() {
        return Collections.unmodifiableList(replacements);
    }

    public List<ValidationFailure> getValidationFailures() {
        return Collections.unmodifiableList(validationFailures);
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }
}
