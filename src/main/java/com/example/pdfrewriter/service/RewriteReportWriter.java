package com.example.pdfrewriter.service;

import com.example.pdfrewriter.config.RewriterProperties;
import com.example.pdfrewriter.service.dto.PageRewriteResult;
import com.example.pdfrewriter.service.dto.RequestOutcome;
import com.example.pdfrewriter.util.font.dto.FontBuildResult;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.plan.dto.ReplacementSegment;
import com.example.pdfrewriter.util.rewrite.dto.SpanKey;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断报告（JSON）
 *
 * 只输出排查需要的字段，不直接序列化内部对象。
 */
@Slf4j
@Component
public class RewriteReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final RewriterProperties properties;

    public RewriteReportWriter(RewriterProperties properties) {
        this.properties = properties;
    }

    /**
     * 写出单页改写报告，返回文件路径；写出失败只记日志
     */
    public Path writePageReport(PageRewriteResult result) {
        return write("page" + (result.getPageIndex() + 1), toMap(result));
    }

    public Path writeFontReport(String name, List<FontBuildResult> results) {
        List<Map<String, Object>> fonts = new ArrayList<>();
        for (FontBuildResult item : results) {
            Map<String, Object> font = new LinkedHashMap<>();
            font.put("index", item.getIndex());
            font.put("hidden_char", item.getHiddenChar());
            font.put("visual_text", item.getVisualText());
            font.put("font_path", item.getFontPath().toString());
            font.put("used_cache", item.isUsedCache());
            fonts.add(font);
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("name", name);
        report.put("fonts", fonts);
        return write("fonts-" + name, report);
    }

    public String toJson(PageRewriteResult result) throws IOException {
        return mapper.writeValueAsString(toMap(result));
    }

    static Map<String, Object> toMap(PageRewriteResult result) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("page", result.getPageIndex() + 1);
        report.put("applied", result.getAppliedCount());

        List<Map<String, Object>> requests = new ArrayList<>();
        for (RequestOutcome outcome : result.getOutcomes()) {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("request_id", outcome.getRequestId());
            request.put("original", outcome.getOriginal());
            request.put("replacement", outcome.getReplacement());
            request.put("status", outcome.getStatus().name());
            if (outcome.getMessage() != null) {
                request.put("message", outcome.getMessage());
            }
            if (outcome.getPlan() != null) {
                request.put("segments", segments(outcome.getPlan()));
            }
            request.put("span_rewrites", entries(outcome.getEntries()));
            request.put("validation_failures", failures(outcome.getValidationFailures()));
            if (!outcome.getOverlaySpans().isEmpty()) {
                List<String> overlay = new ArrayList<>();
                for (SpanKey key : outcome.getOverlaySpans()) {
                    overlay.add(key.toString());
                }
                request.put("overlay_spans", overlay);
            }
            requests.add(request);
        }
        report.put("requests", requests);
        report.put("warnings", result.getWarnings());
        return report;
    }

    private static List<Map<String, Object>> segments(ReplacementPlan plan) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (ReplacementSegment segment : plan.getSegments()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("operator_index", segment.getOperatorIndex());
            item.put("operator", segment.getOperator());
            item.put("role", segment.getRole().name().toLowerCase());
            item.put("range", new int[]{segment.getLocalStart(), segment.getLocalEnd()});
            item.put("text", segment.getText());
            if (segment.isMatch()) {
                item.put("planned_text", segment.getPlannedText());
                item.put("isolate", segment.isRequiresIsolation());
            }
            item.put("aligned", segment.isAligned());
            item.put("width", segment.getWidth());
            if (segment.getMatrix() != null) {
                item.put("matrix", segment.getMatrix().toArray());
            }
            list.add(item);
        }
        return list;
    }

    private static List<Map<String, Object>> entries(List<SpanRewriteEntry> entries) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (SpanRewriteEntry entry : entries) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("span", entry.getSpanKey().toString());
            item.put("original", entry.getOriginalText());
            item.put("replacement", entry.getReplacementText());
            item.put("font", entry.getFont());
            item.put("font_size", entry.getFontSize());
            item.put("original_width", entry.getOriginalWidth());
            item.put("replacement_width", entry.getReplacementWidth());
            item.put("scale", entry.getScaleFactor());
            item.put("overlay_fallback", entry.isOverlayFallback());
            list.add(item);
        }
        return list;
    }

    private static List<Map<String, Object>> failures(List<ValidationFailure> failures) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (ValidationFailure failure : failures) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("span", failure.getSpanKey().toString());
            item.put("expected", failure.getExpected());
            item.put("observed", failure.getObserved());
            item.put("range", new int[]{failure.getStart(), failure.getEnd()});
            list.add(item);
        }
        return list;
    }

    private Path write(String name, Map<String, Object> report) {
        String timestamp = new SimpleDateFormat("yyyyMMdd-HHmmss-SSS").format(new Date());
        Path dir = Paths.get(properties.getReportDir());
        Path file = dir.resolve(name + "-" + timestamp + ".json");
        try {
            Files.createDirectories(dir);
            mapper.writeValue(file.toFile(), report);
            log.info("诊断报告已写出: {}", file);
            return file;
        } catch (IOException e) {
            log.error("诊断报告写出失败: {}, {}", file, e.getMessage());
            return null;
        }
    }
}
