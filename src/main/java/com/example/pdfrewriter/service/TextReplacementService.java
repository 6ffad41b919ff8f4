package com.example.pdfrewriter.service;

import com.example.pdfrewriter.config.RewriterProperties;
import com.example.pdfrewriter.exception.MatchNotFoundException;
import com.example.pdfrewriter.exception.PdfRewriteException;
import com.example.pdfrewriter.service.dto.PageRewriteResult;
import com.example.pdfrewriter.service.dto.ReplacementRequest;
import com.example.pdfrewriter.service.dto.RequestOutcome;
import com.example.pdfrewriter.service.dto.RequestStatus;
import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.plan.MatchPlanner;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.plan.dto.ReplacementSegment;
import com.example.pdfrewriter.util.rewrite.ContentStreamRewriter;
import com.example.pdfrewriter.util.rewrite.PdfFontWidthMeasurer;
import com.example.pdfrewriter.util.rewrite.SpanRewriteCollector;
import com.example.pdfrewriter.util.rewrite.dto.SpanKey;
import com.example.pdfrewriter.util.rewrite.dto.SpanMappingRef;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import com.example.pdfrewriter.util.stream.ContentOperation;
import com.example.pdfrewriter.util.stream.ContentStreamTokenizer;
import com.example.pdfrewriter.util.stream.FontAwareTextDecoder;
import com.example.pdfrewriter.util.stream.PageFonts;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import com.example.pdfrewriter.util.stream.dto.PageAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 页面文本替换服务
 *
 * <h3>每个请求</h3>
 * <ol>
 *   <li>按页面当前内容重新分析（前一个请求已经改过内容流，旧记录和旧 span 都失效）</li>
 *   <li>生成替换计划；找不到目标文本记为 NOT_FOUND</li>
 *   <li>计划分发到 span 累加器，生成 span 改写；校验失败的 span 上的段跳过不写，
 *       其余段照常写回并记为 PARTIALLY_APPLIED，全部失败记为 VALIDATION_FAILED</li>
 *   <li>改写内容流并写回页面，过宽的 span 对应操作符用 Tz 压缩；编码失败记为 EMISSION_FAILED</li>
 * </ol>
 * 一个请求失败不影响后面的请求。
 */
@Slf4j
@Service
public class TextReplacementService {

    private final PageAnalysisService analysisService;
    private final RewriteReportWriter reportWriter;
    private final RewriterProperties properties;

    public TextReplacementService(PageAnalysisService analysisService, RewriteReportWriter reportWriter,
                                  RewriterProperties properties) {
        this.analysisService = analysisService;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    /**
     * @param document  PDF 文档（原地修改）
     * @param pageIndex 页索引（从 0 开始）
     * @param requests  替换请求，按顺序处理
     * @param charWidths 单字符宽度覆盖表，可以为 null
     * @throws IOException 内容流读写失败
     */
    public PageRewriteResult rewritePage(PDDocument document, int pageIndex, List<ReplacementRequest> requests,
                                         Map<String, Double> charWidths) throws IOException {
        long start = System.currentTimeMillis();
        PDPage page = document.getPage(pageIndex);
        List<RequestOutcome> outcomes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (ReplacementRequest request : requests) {
            PageFonts fonts = new PageFonts(page.getResources());
            List<ContentOperation> operations = ContentStreamTokenizer.readOperations(page);
            PageAnalysis analysis = analysisService.analyze(document, pageIndex, operations, fonts);

            RequestOutcome outcome = process(document, page, analysis, operations, fonts, request, charWidths);
            outcomes.add(outcome);
            log.info("第 {} 页请求 {} 处理结果: {}{}", pageIndex + 1, request.getRequestId(), outcome.getStatus(),
                    outcome.getMessage() != null ? " (" + outcome.getMessage() + ")" : "");
        }

        PageAnalysis last = analysisService.analyze(document, pageIndex);
        for (OperatorRecord record : last.getWarnings()) {
            warnings.add("op " + record.getIndex() + ": " + record.getAdvanceWarning());
        }

        PageRewriteResult result = new PageRewriteResult(pageIndex, outcomes, warnings);
        log.info("第 {} 页改写完成: 请求 {} 个, 成功 {} 个, 警告 {} 条, 耗时 {} ms",
                pageIndex + 1, requests.size(), result.getAppliedCount(), warnings.size(),
                System.currentTimeMillis() - start);

        if (properties.isReportEnabled()) {
            reportWriter.writePageReport(result);
        }
        return result;
    }

    public PageRewriteResult rewritePage(PDDocument document, int pageIndex, List<ReplacementRequest> requests)
            throws IOException {
        return rewritePage(document, pageIndex, requests, null);
    }

    private RequestOutcome process(PDDocument document, PDPage page, PageAnalysis analysis,
                                   List<ContentOperation> operations, PageFonts fonts,
                                   ReplacementRequest request, Map<String, Double> charWidths) throws IOException {
        RequestOutcome.RequestOutcomeBuilder outcome = RequestOutcome.builder()
                .requestId(request.getRequestId())
                .original(request.getOriginal())
                .replacement(request.getReplacement());

        ReplacementPlan plan;
        try {
            plan = new MatchPlanner(properties.isIsolateEmptyMiddleSegments()).plan(analysis.getPageIndex(),
                    request.getOriginal(), request.getReplacement(), analysis.getRecords(), analysis.getAlignment());
        } catch (MatchNotFoundException e) {
            return outcome.status(RequestStatus.NOT_FOUND).message(e.getMessage()).build();
        }
        outcome.plan(plan);

        SpanRewriteCollector collector = new SpanRewriteCollector(properties.getMinScale());
        collector.collect(request.getRequestId(), plan);
        List<ValidationFailure> failures = new ArrayList<>();
        List<SpanRewriteEntry> entries = collector.buildEntries(analysis.getPageIndex(),
                new PdfFontWidthMeasurer(fonts), charWidths, failures);
        outcome.entries(Collections.unmodifiableList(entries))
                .validationFailures(Collections.unmodifiableList(failures));

        // 校验失败的 span 只跳过落在它上面的段，其余照常写回
        Set<SpanKey> failedSpans = collector.failedSpans();
        List<ReplacementSegment> emitted = new ArrayList<>();
        int skipped = 0;
        for (ReplacementSegment segment : plan.getMatchSegments()) {
            if (touches(segment, failedSpans)) {
                skipped++;
            } else {
                emitted.add(segment);
            }
        }
        if (emitted.isEmpty()) {
            return outcome.status(RequestStatus.VALIDATION_FAILED)
                    .message(failures.size() + " span(s) failed validation")
                    .build();
        }

        List<SpanKey> overlaySpans = new ArrayList<>();
        Map<Integer, Double> scales = scalesByOperator(entries, overlaySpans);
        if (!overlaySpans.isEmpty()) {
            log.warn("请求 {} 有 {} 个 span 压缩到下限仍放不下，需要覆盖层: {}",
                    request.getRequestId(), overlaySpans.size(), overlaySpans);
            outcome.overlaySpans(Collections.unmodifiableList(overlaySpans));
        }

        List<ContentOperation> rewritten;
        try {
            rewritten = new ContentStreamRewriter(fonts, new FontAwareTextDecoder(fonts))
                    .apply(operations, analysis.getRecords(), emitted, scales);
        } catch (PdfRewriteException e) {
            return outcome.status(RequestStatus.EMISSION_FAILED).message(e.getMessage()).build();
        }
        ContentStreamRewriter.writeToPage(document, page, rewritten);
        if (skipped > 0) {
            return outcome.status(RequestStatus.PARTIALLY_APPLIED)
                    .message(skipped + " segment(s) skipped on " + failedSpans.size() + " stale span(s)")
                    .build();
        }
        return outcome.status(RequestStatus.APPLIED).build();
    }

    private static boolean touches(ReplacementSegment segment, Set<SpanKey> spans) {
        if (spans.isEmpty()) {
            return false;
        }
        for (SpanSlice slice : segment.getSpanSlices()) {
            if (spans.contains(SpanKey.of(slice.getSpan()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 需要压缩的 span 改写 → 操作符压缩比例；一个操作符涉及多个 span 时取最小值
     */
    private static Map<Integer, Double> scalesByOperator(List<SpanRewriteEntry> entries, List<SpanKey> overlaySpans) {
        Map<Integer, Double> scales = new HashMap<>();
        for (SpanRewriteEntry entry : entries) {
            if (entry.isOverlayFallback()) {
                overlaySpans.add(entry.getSpanKey());
            }
            if (!entry.isRequiresScaling()) {
                continue;
            }
            for (SpanMappingRef mapping : entry.getMappings()) {
                Integer operatorIndex = mapping.getOperatorIndex();
                if (operatorIndex == null) {
                    continue;
                }
                Double current = scales.get(operatorIndex);
                if (current == null || entry.getScaleFactor() < current) {
                    scales.put(operatorIndex, entry.getScaleFactor());
                }
            }
        }
        return scales;
    }
}
