package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.plan.ReplacementAllocator;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.plan.dto.ReplacementSegment;
import com.example.pdfrewriter.util.rewrite.dto.SpanKey;
import com.example.pdfrewriter.util.rewrite.dto.SpanMappingRef;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 把替换计划的 MATCH 段分发到各个视觉 span 的累加器
 *
 * 一个段对应多个切片时（同一 span 内多段切片或跨 span），
 * 段分到的替换文本再按切片长度比例二次分配。
 * 没有切片的段不参与 span 级改写，只由内容流写回处理。
 */
@Slf4j
public class SpanRewriteCollector {

    private final double minScale;
    private final Map<SpanKey, SpanRewriteAccumulator> accumulators = new TreeMap<>();

    public SpanRewriteCollector() {
        this(SpanRewriteAccumulator.DEFAULT_MIN_SCALE);
    }

    public SpanRewriteCollector(double minScale) {
        this.minScale = minScale;
    }

    /**
     * 收集一个替换计划
     *
     * @param requestId 请求标识，写入映射引用便于回溯
     * @param plan      替换计划
     */
    public void collect(String requestId, ReplacementPlan plan) {
        for (ReplacementSegment segment : plan.getMatchSegments()) {
            List<SpanSlice> slices = segment.getSpanSlices();
            if (slices.isEmpty()) {
                continue;
            }
            if (SpanSlice.totalLength(slices) != segment.length()) {
                log.warn("MATCH 段文本与切片长度不一致，跳过 span 级改写: {}", segment);
                continue;
            }
            int[] lengths = new int[slices.size()];
            for (int i = 0; i < slices.size(); i++) {
                lengths[i] = slices.get(i).length();
            }
            List<String> pieces = ReplacementAllocator.allocate(segment.getPlannedText(), lengths);

            // 段文本与切片字符一一对应，期望原文按切片长度顺序截取
            String segmentText = segment.getText();
            int cursor = 0;
            for (int i = 0; i < slices.size(); i++) {
                SpanSlice slice = slices.get(i);
                int to = cursor + slice.length();
                String expected = segmentText.substring(cursor, to);
                cursor = to;

                SpanMappingRef ref = new SpanMappingRef(requestId, expected, pieces.get(i), segment.getOperatorIndex());
                accumulatorFor(slice).addReplacement(slice.getStart(), slice.getEnd(), pieces.get(i), ref);
            }
        }
    }

    private SpanRewriteAccumulator accumulatorFor(SpanSlice slice) {
        SpanKey key = SpanKey.of(slice.getSpan());
        SpanRewriteAccumulator accumulator = accumulators.get(key);
        if (accumulator == null) {
            accumulator = new SpanRewriteAccumulator(slice.getSpan(), minScale);
            accumulators.put(key, accumulator);
        }
        return accumulator;
    }

    /**
     * 生成所有 span 的最终改写；校验失败的 span 跳过，失败记录写入 failures
     */
    public List<SpanRewriteEntry> buildEntries(int pageIndex, WidthMeasurer measurer, Map<String, Double> charWidths,
                                               List<ValidationFailure> failures) {
        List<SpanRewriteEntry> entries = new ArrayList<>();
        for (SpanRewriteAccumulator accumulator : accumulators.values()) {
            SpanRewriteEntry entry = accumulator.buildEntry(pageIndex, measurer, charWidths);
            if (entry != null) {
                entries.add(entry);
            } else if (failures != null) {
                failures.addAll(accumulator.getValidationFailures());
            }
        }
        log.debug("span 改写: {} 个 span, 成功 {} 个", accumulators.size(), entries.size());
        return entries;
    }

    /**
     * 上一次 {@link #buildEntries} 中校验失败的 span
     */
    public Set<SpanKey> failedSpans() {
        Set<SpanKey> failed = new TreeSet<>();
        for (Map.Entry<SpanKey, SpanRewriteAccumulator> entry : accumulators.entrySet()) {
            if (!entry.getValue().getValidationFailures().isEmpty()) {
                failed.add(entry.getKey());
            }
        }
        return failed;
    }

    public Map<SpanKey, SpanRewriteAccumulator> getAccumulators() {
        return Collections.unmodifiableMap(accumulators);
    }
}
