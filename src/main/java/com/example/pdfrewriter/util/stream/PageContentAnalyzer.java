package com.example.pdfrewriter.util.stream;

import com.example.pdfrewriter.util.align.AdvanceMetrics;
import com.example.pdfrewriter.util.align.OperatorMetrics;
import com.example.pdfrewriter.util.align.SpanAligner;
import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import com.example.pdfrewriter.util.stream.dto.PageAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.util.Vector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单页内容分析：两遍状态跟踪 + 视觉对齐 + 前进量 + 漂移检查
 *
 * <h3>流程</h3>
 * <ol>
 *   <li>预备遍：朴素前进量跟踪，得到每个操作符的解码文本</li>
 *   <li>对齐：操作符文本 ↔ span 文本</li>
 *   <li>前进量：对齐成功的用 span 几何，失败的用朴素估算（用户空间）</li>
 *   <li>最终遍：resolver 把用户空间前进量换算回文本空间，得到准确的 postTextMatrix</li>
 *   <li>诊断：写入方向、投影、世界坐标起止点、位移、误差和警告</li>
 * </ol>
 *
 * 分析后 {@link OperatorRecord#getAdvance()} 是用户空间长度。
 * 警告只是诊断信息，不会中断分析：
 * <ul>
 *   <li>span extraction unavailable：整页没有 span，全部用朴素估算</li>
 *   <li>missing span alignment：该操作符没对齐，用朴素估算</li>
 *   <li>suffix matrix drift：矩阵位移与前进量的差超过容差</li>
 * </ul>
 */
@Slf4j
public class PageContentAnalyzer {

    public static final String WARNING_SPANS_UNAVAILABLE = "span extraction unavailable; using naive advance";
    public static final String WARNING_MISSING_ALIGNMENT = "missing span alignment; using naive advance";

    public static final double DEFAULT_DRIFT_TOLERANCE = 0.5;

    private final SpanAligner aligner;
    private final double driftTolerance;
    private final double driftTolerancePerFontSize;
    private final double naiveGlyphWidthFactor;

    public PageContentAnalyzer() {
        this(new SpanAligner(), DEFAULT_DRIFT_TOLERANCE, 0.0, NaiveAdvanceEstimator.DEFAULT_GLYPH_WIDTH_FACTOR);
    }

    public PageContentAnalyzer(SpanAligner aligner, double driftTolerance, double driftTolerancePerFontSize,
                               double naiveGlyphWidthFactor) {
        this.aligner = aligner;
        this.driftTolerance = driftTolerance;
        this.driftTolerancePerFontSize = driftTolerancePerFontSize;
        this.naiveGlyphWidthFactor = naiveGlyphWidthFactor;
    }

    /**
     * @param operations 页面内容流指令
     * @param spans      视觉 span；null 或空表示无法提取
     * @param decoder    文本解码器
     */
    public PageAnalysis analyze(int pageIndex, List<ContentOperation> operations, List<SpanRecord> spans,
                                TextFragmentDecoder decoder) {
        long start = System.currentTimeMillis();

        List<OperatorRecord> preliminary = new ContentStateTracker(null, decoder, naiveGlyphWidthFactor).walk(operations);

        boolean spansAvailable = spans != null && !spans.isEmpty();
        Map<Integer, List<SpanSlice>> alignment = spansAvailable
                ? aligner.align(preliminary, spans)
                : new HashMap<Integer, List<SpanSlice>>();

        final Map<Integer, AdvanceMetrics> metricsMap = new HashMap<>();
        for (OperatorRecord record : preliminary) {
            if (!record.hasTextPayload()) {
                continue;
            }
            AdvanceMetrics metrics = OperatorMetrics.fromSpans(alignment.get(record.getIndex()));
            if (metrics == null && record.getAdvance() != null) {
                double worldAdvance = record.getAdvance()
                        * OperatorMetrics.textToWorldScale(record.getCtm(), record.getTextMatrix());
                metrics = OperatorMetrics.fromRecord(record, worldAdvance);
            }
            if (metrics != null) {
                metricsMap.put(record.getIndex(), metrics);
            }
        }

        AdvanceResolver resolver = new AdvanceResolver() {
            @Override
            public Double resolve(OperatorRecord record, TextGraphicsState state) {
                AdvanceMetrics metrics = metricsMap.get(record.getIndex());
                if (metrics == null) {
                    return null;
                }
                return metrics.getAdvance() / OperatorMetrics.textToWorldScale(state.getCtm(), state.getTextMatrix());
            }
        };
        List<OperatorRecord> walked = new ContentStateTracker(resolver, decoder, naiveGlyphWidthFactor).walk(operations);

        List<OperatorRecord> finalRecords = new ArrayList<>(walked.size());
        int drifted = 0;
        for (OperatorRecord record : walked) {
            if (!record.hasTextPayload()) {
                finalRecords.add(record);
                continue;
            }
            OperatorRecord enriched = spansAvailable
                    ? diagnose(record, metricsMap.get(record.getIndex()))
                    : withoutSpans(record);
            if (enriched.getAdvanceError() != null && enriched.getAdvanceWarning() != null
                    && enriched.getAdvanceWarning().startsWith("suffix matrix drift")) {
                drifted++;
            }
            finalRecords.add(enriched);
        }

        log.info("第 {} 页内容分析完成: 指令 {} 条, span {} 个, 对齐 {} 个, 漂移超限 {} 个, 耗时 {} ms",
                pageIndex + 1, operations.size(), spansAvailable ? spans.size() : 0, alignment.size(), drifted,
                System.currentTimeMillis() - start);
        return new PageAnalysis(pageIndex, finalRecords, spans, alignment);
    }

    private OperatorRecord withoutSpans(OperatorRecord record) {
        Double worldAdvance = record.getAdvance() != null
                ? record.getAdvance() * OperatorMetrics.textToWorldScale(record.getCtm(), record.getTextMatrix())
                : null;
        return record.toBuilder()
                .advance(worldAdvance)
                .advanceWarning(WARNING_SPANS_UNAVAILABLE)
                .build();
    }

    private OperatorRecord diagnose(OperatorRecord record, AdvanceMetrics metrics) {
        if (metrics == null) {
            return record.toBuilder().advanceWarning(WARNING_MISSING_ALIGNMENT).build();
        }

        AffineMatrix startWorld = record.getCtm().compose(record.getTextMatrix());
        AffineMatrix endMatrix = record.getPostTextMatrix() != null ? record.getPostTextMatrix() : record.getTextMatrix();
        AffineMatrix endWorld = record.getCtm().compose(endMatrix);

        double dx = endWorld.getE() - startWorld.getE();
        double dy = endWorld.getF() - startWorld.getF();
        double expectedDx = metrics.getDirectionX() * metrics.getAdvance();
        double expectedDy = metrics.getDirectionY() * metrics.getAdvance();
        double error = Math.hypot(dx - expectedDx, dy - expectedDy);

        String warning = null;
        double tolerance = driftTolerance + driftTolerancePerFontSize * record.effectiveFontSize();
        if (error > tolerance) {
            warning = String.format("suffix matrix drift %.3fpt exceeds tolerance %.3fpt", error, tolerance);
            log.warn("第 {} 个指令前进量漂移: {}", record.getIndex(), warning);
        } else if (!metrics.isFromSpans()) {
            warning = WARNING_MISSING_ALIGNMENT;
        }

        return record.toBuilder()
                .advance(metrics.getAdvance())
                .advanceDirection(metrics.getDirection())
                .advanceStartProjection(metrics.getStartProjection())
                .advanceEndProjection(metrics.getEndProjection())
                .worldStart(new Vector((float) startWorld.getE(), (float) startWorld.getF()))
                .worldEnd(new Vector((float) endWorld.getE(), (float) endWorld.getF()))
                .advanceDelta(new Vector((float) dx, (float) dy))
                .advanceError(error)
                .advanceWarning(warning)
                .build();
    }
}
