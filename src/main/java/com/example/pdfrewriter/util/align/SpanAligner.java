package com.example.pdfrewriter.util.align;

import com.example.pdfrewriter.util.match.MatchResult;
import com.example.pdfrewriter.util.match.OrderedTextMatcher;
import com.example.pdfrewriter.util.match.PrefixShrinkingMatchStrategy;
import com.example.pdfrewriter.util.span.SpanTextNormalizer;
import com.example.pdfrewriter.util.span.dto.GraphemeSlice;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 操作符 ↔ 视觉 span 对齐器
 *
 * ========== 算法 ==========
 * 1. 所有 span 的归一化文本拼成页级文本（空白折叠，跨 span 也折叠），
 *    同时记录每个页级下标 → (span, span 内下标)
 * 2. 按内容流顺序遍历有文本载荷的操作符，归一化其解码文本
 * 3. 从上一次命中的结尾开始向后查找：先精确匹配，失败再前缀收缩（最短 minPrefixLength）
 * 4. 命中区间按 span 切成 SpanSlice，并扩展到字形簇边界
 *
 * 查找只向后、不回退：重复文本按文档顺序认领，不做相似度比较。
 * 找不到的操作符不出现在结果里（后续用朴素估算）。
 *
 * 无状态，同一输入多次运行结果相同。
 */
@Slf4j
public class SpanAligner {

    private final OrderedTextMatcher matcher;

    public SpanAligner() {
        this(PrefixShrinkingMatchStrategy.DEFAULT_MIN_LENGTH);
    }

    public SpanAligner(int minPrefixLength) {
        this.matcher = OrderedTextMatcher.forAlignment(minPrefixLength);
    }

    /**
     * @return 操作符 index → 覆盖它的 span 切片（按文档顺序），只包含对齐成功的操作符
     */
    public Map<Integer, List<SpanSlice>> align(List<OperatorRecord> records, List<SpanRecord> spans) {
        Map<Integer, List<SpanSlice>> alignment = new LinkedHashMap<>();
        if (records == null || records.isEmpty() || spans == null || spans.isEmpty()) {
            return alignment;
        }

        PageText pageText = PageText.of(spans);
        int searchPos = 0;
        int unaligned = 0;

        for (OperatorRecord record : records) {
            if (!record.hasTextPayload()) {
                continue;
            }
            String text = SpanTextNormalizer.normalize(record.getDecodedText());
            if (text.isEmpty()) {
                continue;
            }

            MatchResult match = matcher.locate(pageText.text, text, searchPos);
            if (!match.isFound()) {
                unaligned++;
                log.debug("操作符未对齐: index={}, text='{}', searchPos={}", record.getIndex(), text, searchPos);
                continue;
            }

            List<SpanSlice> slices = pageText.slice(match.getStart(), match.getEnd());
            if (!slices.isEmpty()) {
                alignment.put(record.getIndex(), Collections.unmodifiableList(slices));
                searchPos = match.getEnd();
            }
        }

        log.debug("span 对齐完成: 对齐 {} 个操作符, 未对齐 {} 个", alignment.size(), unaligned);
        return alignment;
    }

    /**
     * 把区间扩展到字形簇边界
     *
     * start 移到第一个结束于 start 之后的簇的起点；end 移到包含 end 的簇的终点
     */
    static int[] adjustToGraphemes(SpanRecord span, int start, int end) {
        if (end <= start) {
            return new int[]{start, end};
        }
        List<GraphemeSlice> clusters = span.getGraphemeSlices();
        int adjustedStart = start;
        int adjustedEnd = end;
        for (GraphemeSlice cluster : clusters) {
            if (cluster.getEnd() > start) {
                adjustedStart = cluster.getStart();
                break;
            }
        }
        for (GraphemeSlice cluster : clusters) {
            if (cluster.getStart() < end && end <= cluster.getEnd()) {
                adjustedEnd = cluster.getEnd();
                break;
            }
        }
        return new int[]{adjustedStart, adjustedEnd};
    }

    /**
     * 页级拼接文本及下标映射
     */
    private static final class PageText {
        private final String text;
        private final int[] spanOf;
        private final int[] localOf;
        private final List<SpanRecord> spans;

        private PageText(String text, int[] spanOf, int[] localOf, List<SpanRecord> spans) {
            this.text = text;
            this.spanOf = spanOf;
            this.localOf = localOf;
            this.spans = spans;
        }

        static PageText of(List<SpanRecord> spans) {
            int capacity = 0;
            for (SpanRecord span : spans) {
                capacity += span.getNormalizedText().length();
            }
            StringBuilder sb = new StringBuilder(capacity);
            int[] spanOf = new int[capacity];
            int[] localOf = new int[capacity];
            boolean previousSpace = false;
            for (int s = 0; s < spans.size(); s++) {
                String normalized = spans.get(s).getNormalizedText();
                for (int i = 0; i < normalized.length(); i++) {
                    char ch = normalized.charAt(i);
                    if (SpanTextNormalizer.isSpace(ch)) {
                        if (previousSpace) {
                            continue;
                        }
                        ch = ' ';
                        previousSpace = true;
                    } else {
                        previousSpace = false;
                    }
                    spanOf[sb.length()] = s;
                    localOf[sb.length()] = i;
                    sb.append(ch);
                }
            }
            return new PageText(sb.toString(), spanOf, localOf, spans);
        }

        List<SpanSlice> slice(int start, int end) {
            List<SpanSlice> slices = new ArrayList<>();
            int position = start;
            while (position < end) {
                int spanIndex = spanOf[position];
                int localStart = localOf[position];
                int localEnd = localStart + 1;
                while (position < end && spanOf[position] == spanIndex) {
                    localEnd = localOf[position] + 1;
                    position++;
                }
                SpanRecord span = spans.get(spanIndex);
                int[] adjusted = adjustToGraphemes(span, localStart, localEnd);
                slices.add(new SpanSlice(span, adjusted[0], adjusted[1]));
            }
            return slices;
        }
    }
}
