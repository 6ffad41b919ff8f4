package com.example.pdfrewriter.util.plan;

import com.example.pdfrewriter.exception.MatchNotFoundException;
import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.match.MatchResult;
import com.example.pdfrewriter.util.match.OrderedTextMatcher;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.plan.dto.ReplacementSegment;
import com.example.pdfrewriter.util.plan.dto.SegmentRole;
import com.example.pdfrewriter.util.span.dto.CharBox;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.AffineMatrix;
import com.example.pdfrewriter.util.stream.PdfOperators;
import com.example.pdfrewriter.util.stream.dto.LiteralKind;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import com.example.pdfrewriter.util.stream.dto.ShowTextItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 替换计划生成器
 *
 * ========== 算法 ==========
 * 1. 拼接所有有文本的操作符的解码文本，记录每个操作符的区间
 * 2. 定位目标文本：精确匹配 → 忽略空白匹配（不做模糊/相似度匹配），找不到抛 {@link MatchNotFoundException}
 * 3. 对每个与命中区间重叠的操作符，切出 PREFIX / MATCH / SUFFIX 段
 * 4. MATCH 区间再按字符串项边界（TJ 数组元素）和视觉 span 边界切分，
 *    保证一个段只落在一个字面量里，不会把数组里的两个字符串合并或改坏
 * 5. 替换文本按各 MATCH 段原文长度比例全局分配（见 {@link ReplacementAllocator}）
 * 6. TJ 数组中整个字符串项被匹配且分到空文本的段标记 requiresIsolation，
 *    由写回阶段直接删掉该数组元素，而不是留一个空字符串
 *
 * 未对齐的操作符照样出段（spanSlices 为空），几何信息退回到操作符自身的矩阵和前进量；
 * 切片与解码文本长度对不上的操作符同样按未对齐处理。
 */
@Slf4j
public class MatchPlanner {

    private static final double EPSILON = 1e-6;

    private final OrderedTextMatcher matcher;
    private final boolean isolateEmptyMiddleSegments;

    public MatchPlanner() {
        this(false);
    }

    public MatchPlanner(boolean isolateEmptyMiddleSegments) {
        this.matcher = OrderedTextMatcher.forTargetLookup();
        this.isolateEmptyMiddleSegments = isolateEmptyMiddleSegments;
    }

    /**
     * @param pageIndex       页索引
     * @param targetText      要替换的原文
     * @param replacementText 替换文本（可以为空串）
     * @param records         最终遍的操作符记录
     * @param alignment       操作符 index → span 切片
     * @throws MatchNotFoundException 目标文本找不到
     */
    public ReplacementPlan plan(int pageIndex, String targetText, String replacementText,
                                List<OperatorRecord> records, Map<Integer, List<SpanSlice>> alignment) {
        String replacement = replacementText != null ? replacementText : "";

        StringBuilder combined = new StringBuilder();
        List<int[]> ranges = new ArrayList<>();
        List<OperatorRecord> textRecords = new ArrayList<>();
        for (OperatorRecord record : records) {
            String text = record.getDecodedText();
            if (text.isEmpty()) {
                continue;
            }
            ranges.add(new int[]{combined.length(), combined.length() + text.length()});
            textRecords.add(record);
            combined.append(text);
        }

        String fullText = combined.toString();
        if (targetText == null || targetText.isEmpty() || fullText.isEmpty()) {
            throw new MatchNotFoundException(pageIndex, targetText);
        }
        MatchResult match = matcher.locate(fullText, targetText, 0);
        if (!match.isFound()) {
            throw new MatchNotFoundException(pageIndex, targetText);
        }
        int matchStart = match.getStart();
        int matchEnd = match.getEnd();

        List<ReplacementSegment> segments = new ArrayList<>();
        for (int i = 0; i < textRecords.size(); i++) {
            int start = ranges.get(i)[0];
            int end = ranges.get(i)[1];
            int overlapStart = Math.max(matchStart, start);
            int overlapEnd = Math.min(matchEnd, end);
            if (overlapStart >= overlapEnd) {
                continue;
            }
            OperatorRecord record = textRecords.get(i);
            List<SpanSlice> slices = alignedSlices(record, alignment);
            segments.addAll(planOperator(record, slices, overlapStart - start, overlapEnd - start));
        }

        segments = allocate(segments, replacement);

        ReplacementPlan plan = new ReplacementPlan(pageIndex, fullText.substring(matchStart, matchEnd), replacement, segments);
        log.debug("替换计划: {} ({} 策略), MATCH 段 {} 个, 共 {} 段",
                plan, match.getStrategy(), plan.getMatchSegments().size(), segments.size());
        return plan;
    }

    /**
     * 操作符的对齐切片；切片总长与解码文本长度不一致时（连字、连续空白、前缀收缩命中）
     * 字符无法一一对应，按未对齐处理
     */
    static List<SpanSlice> alignedSlices(OperatorRecord record, Map<Integer, List<SpanSlice>> alignment) {
        List<SpanSlice> slices = alignment != null ? alignment.get(record.getIndex()) : null;
        if (slices == null || slices.isEmpty()) {
            return Collections.emptyList();
        }
        int total = SpanSlice.totalLength(slices);
        int decoded = record.getDecodedText().length();
        if (total != decoded) {
            log.debug("操作符文本与切片长度不一致，按未对齐处理: op={}, decoded={}, slices={}",
                    record.getIndex(), decoded, total);
            return Collections.emptyList();
        }
        return slices;
    }

    /**
     * 单个操作符：PREFIX + 若干 MATCH + SUFFIX
     */
    private List<ReplacementSegment> planOperator(OperatorRecord record, List<SpanSlice> slices,
                                                  int localStart, int localEnd) {
        List<ReplacementSegment> segments = new ArrayList<>();
        String recordText = record.getDecodedText();

        if (localStart > 0) {
            segments.add(buildSegment(record, slices, SegmentRole.PREFIX, 0, localStart));
        }

        TreeSet<Integer> cuts = new TreeSet<>();
        for (ShowTextItem item : record.getStringItems()) {
            cuts.add(item.getTextStart());
            cuts.add(item.getTextEnd());
        }
        cuts.addAll(spanGroupBoundaries(slices));

        int cursor = localStart;
        for (Integer cut : cuts.subSet(localStart, false, localEnd, false)) {
            segments.add(buildSegment(record, slices, SegmentRole.MATCH, cursor, cut));
            cursor = cut;
        }
        segments.add(buildSegment(record, slices, SegmentRole.MATCH, cursor, localEnd));

        if (localEnd < recordText.length()) {
            segments.add(buildSegment(record, slices, SegmentRole.SUFFIX, localEnd, recordText.length()));
        }
        return segments;
    }

    /**
     * 操作符局部坐标下，切片从一个 span 换到另一个 span 的位置
     */
    private static List<Integer> spanGroupBoundaries(List<SpanSlice> slices) {
        List<Integer> boundaries = new ArrayList<>();
        int consumed = 0;
        SpanSlice previous = null;
        for (SpanSlice slice : slices) {
            if (slice.isEmpty()) {
                continue;
            }
            if (previous != null && !slice.sameSpan(previous)) {
                boundaries.add(consumed);
            }
            consumed += slice.length();
            previous = slice;
        }
        return boundaries;
    }

    private ReplacementSegment buildSegment(OperatorRecord record, List<SpanSlice> slices, SegmentRole role,
                                            int from, int to) {
        String recordText = record.getDecodedText();
        List<SpanSlice> segmentSlices = sliceSpanSlices(slices, from, to);

        ShowTextItem item = containingItem(record, from, to);
        boolean coversWholeItem = item != null && item.getTextStart() == from && item.getTextEnd() == to;

        return ReplacementSegment.builder()
                .operatorIndex(record.getIndex())
                .operator(record.getOperator())
                .role(role)
                .text(recordText.substring(from, to))
                .localStart(from)
                .localEnd(to)
                .spanSlices(Collections.unmodifiableList(segmentSlices))
                .matrix(segmentMatrix(record, segmentSlices, from, to))
                .fontResource(record.getFontResource())
                .fontSize(record.getFontSize())
                .width(segmentWidth(record, segmentSlices, from, to))
                .literalKind(literalKindOf(record, from, to))
                .itemSlot(item != null ? item.getSlot() : -1)
                .coversWholeItem(coversWholeItem)
                .build();
    }

    /**
     * 全局分配替换文本，并决定哪些段需要隔离
     */
    private List<ReplacementSegment> allocate(List<ReplacementSegment> segments, String replacement) {
        List<Integer> matchPositions = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).isMatch()) {
                matchPositions.add(i);
            }
        }
        int[] lengths = new int[matchPositions.size()];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = segments.get(matchPositions.get(i)).length();
        }
        List<String> pieces = ReplacementAllocator.allocate(replacement, lengths);

        List<ReplacementSegment> result = new ArrayList<>(segments);
        int cursor = 0;
        for (int i = 0; i < matchPositions.size(); i++) {
            int position = matchPositions.get(i);
            ReplacementSegment segment = segments.get(position);
            String piece = pieces.get(i);
            boolean last = i == matchPositions.size() - 1;

            boolean isolate = piece.isEmpty()
                    && segment.length() > 0
                    && segment.isCoversWholeItem()
                    && isArrayLiteral(segment);
            if (piece.isEmpty() && !last && !isolate && segment.length() > 0) {
                if (isolateEmptyMiddleSegments) {
                    isolate = segment.getItemSlot() >= 0;
                } else {
                    log.warn("中间 MATCH 段分到空文本但不满足隔离条件，待人工复核: op={}, text='{}'",
                            segment.getOperatorIndex(), segment.getText());
                }
            }

            result.set(position, segment.toBuilder()
                    .plannedText(piece)
                    .replacementStart(cursor)
                    .replacementEnd(cursor + piece.length())
                    .requiresIsolation(isolate)
                    .build());
            cursor += piece.length();
        }
        return result;
    }

    private static boolean isArrayLiteral(ReplacementSegment segment) {
        return PdfOperators.SHOW_TEXT_ADJUSTED.equals(segment.getOperator());
    }

    /**
     * 把操作符的对齐切片截取到局部区间 [from, to)
     *
     * 调用方保证操作符文本与切片字符一一对应（见 {@link #alignedSlices}）
     */
    static List<SpanSlice> sliceSpanSlices(List<SpanSlice> slices, int from, int to) {
        List<SpanSlice> result = new ArrayList<>();
        if (to <= from) {
            return result;
        }
        int consumed = 0;
        for (SpanSlice slice : slices) {
            int length = slice.length();
            if (length <= 0) {
                continue;
            }
            int segStart = consumed;
            int segEnd = consumed + length;
            consumed = segEnd;
            if (segEnd <= from) {
                continue;
            }
            if (segStart >= to) {
                break;
            }
            int clipStart = Math.max(from, segStart) - segStart;
            int clipEnd = Math.min(to, segEnd) - segStart;
            result.add(new SpanSlice(slice.getSpan(), slice.getStart() + clipStart, slice.getStart() + clipEnd));
            if (segEnd >= to) {
                break;
            }
        }
        return result;
    }

    /**
     * 段起点矩阵
     *
     * 有切片：首字形包围盒左下角为原点，span 方向 × span 字号；
     * 无切片（或推出的矩阵无平移）：操作符起点矩阵（段从 0 开始）、前进后矩阵（段在末尾），
     * 中间段按字符比例在前进方向上插值。
     */
    private static AffineMatrix segmentMatrix(OperatorRecord record, List<SpanSlice> slices, int from, int to) {
        AffineMatrix fromSpans = null;
        if (!slices.isEmpty()) {
            SpanSlice first = slices.get(0);
            SpanRecord span = first.getSpan();
            List<CharBox> chars = span.getNormalizedChars();
            if (!chars.isEmpty()) {
                CharBox box = chars.get(Math.max(0, Math.min(chars.size() - 1, first.getStart())));
                double size = span.getFontSize();
                double dx = span.getDirectionX();
                double dy = span.getDirectionY();
                fromSpans = new AffineMatrix(dx * size, dy * size, -dy * size, dx * size, box.getX0(), box.getY0());
            } else {
                fromSpans = span.getMatrix();
            }
        }
        if (fromSpans != null && !fromSpans.isIdentity(EPSILON) && !fromSpans.hasZeroTranslation(EPSILON)) {
            return fromSpans;
        }

        AffineMatrix fallback = recordMatrix(record, from);
        return fallback != null ? fallback : (fromSpans != null ? fromSpans : AffineMatrix.identity());
    }

    private static AffineMatrix recordMatrix(OperatorRecord record, int from) {
        if (record.getCtm() == null || record.getTextMatrix() == null) {
            return null;
        }
        int total = record.getDecodedText().length();
        AffineMatrix textMatrix = record.getTextMatrix();
        if (total > 0 && from >= total && record.getPostTextMatrix() != null) {
            textMatrix = record.getPostTextMatrix();
        }
        AffineMatrix world = record.getCtm().compose(textMatrix);
        double size = record.getFontSize();
        double originX = world.getE();
        double originY = world.getF();

        if (from > 0 && from < total && record.getAdvance() != null) {
            double length = Math.hypot(world.getA(), world.getB());
            if (length > EPSILON) {
                double fraction = (double) from / total;
                originX += world.getA() / length * record.getAdvance() * fraction;
                originY += world.getB() / length * record.getAdvance() * fraction;
            }
        }
        return new AffineMatrix(world.getA() * size, world.getB() * size, world.getC() * size, world.getD() * size,
                originX, originY);
    }

    /**
     * 段宽度：切片字符包围盒宽度之和；未对齐时按字符数比例分摊操作符前进量
     */
    private static double segmentWidth(OperatorRecord record, List<SpanSlice> slices, int from, int to) {
        if (!slices.isEmpty()) {
            double width = 0;
            for (SpanSlice slice : slices) {
                width += slice.width();
            }
            return width;
        }
        int total = record.getDecodedText().length();
        if (record.getAdvance() == null || total == 0) {
            return 0.0;
        }
        return record.getAdvance() * (to - from) / total;
    }

    /**
     * 区间完全落在其中的字符串项；跨项或无项返回 null
     */
    private static ShowTextItem containingItem(OperatorRecord record, int from, int to) {
        for (ShowTextItem item : record.getStringItems()) {
            if (item.getTextStart() <= from && to <= item.getTextEnd() && item.getTextEnd() > item.getTextStart()) {
                return item;
            }
        }
        return null;
    }

    /**
     * 区间覆盖的字符串项字面量类型一致时返回该类型（TEXT/BYTE），混合或无法判断返回 null
     */
    private static LiteralKind literalKindOf(OperatorRecord record, int from, int to) {
        LiteralKind found = null;
        for (ShowTextItem item : record.getStringItems()) {
            if (to <= item.getTextStart() || from >= item.getTextEnd()) {
                continue;
            }
            LiteralKind kind = item.getLiteralKind();
            if (kind != LiteralKind.TEXT && kind != LiteralKind.BYTE) {
                return null;
            }
            if (found != null && found != kind) {
                return null;
            }
            found = kind;
        }
        return found;
    }
}
