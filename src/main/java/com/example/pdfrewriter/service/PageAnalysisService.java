package com.example.pdfrewriter.service;

import com.example.pdfrewriter.config.RewriterProperties;
import com.example.pdfrewriter.util.align.SpanAligner;
import com.example.pdfrewriter.util.span.SpanExtractor;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.ContentOperation;
import com.example.pdfrewriter.util.stream.ContentStreamTokenizer;
import com.example.pdfrewriter.util.stream.FontAwareTextDecoder;
import com.example.pdfrewriter.util.stream.PageContentAnalyzer;
import com.example.pdfrewriter.util.stream.PageFonts;
import com.example.pdfrewriter.util.stream.dto.PageAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * 单页分析服务：span 提取 + 内容流分词 + 两遍状态跟踪
 *
 * 无共享可变状态，不同页面/文档可以并发调用。
 */
@Slf4j
@Service
public class PageAnalysisService {

    private final RewriterProperties properties;

    public PageAnalysisService(RewriterProperties properties) {
        this.properties = properties;
    }

    /**
     * 读取页面当前内容流并分析
     *
     * @param document  PDF 文档
     * @param pageIndex 页索引（从 0 开始）
     * @throws IOException 内容流解析失败
     */
    public PageAnalysis analyze(PDDocument document, int pageIndex) throws IOException {
        PDPage page = document.getPage(pageIndex);
        List<ContentOperation> operations = ContentStreamTokenizer.readOperations(page);
        return analyze(document, pageIndex, operations, new PageFonts(page.getResources()));
    }

    /**
     * 分析给定的指令序列（span 仍从页面当前渲染结果提取）
     */
    public PageAnalysis analyze(PDDocument document, int pageIndex, List<ContentOperation> operations,
                                PageFonts fonts) {
        List<SpanRecord> spans = extractSpans(document, pageIndex);
        PageContentAnalyzer analyzer = new PageContentAnalyzer(
                new SpanAligner(properties.getMinPrefixLength()),
                properties.getDriftTolerance(),
                properties.getDriftTolerancePerFontSize(),
                properties.getNaiveGlyphWidthFactor());
        return analyzer.analyze(pageIndex, operations, spans, new FontAwareTextDecoder(fonts));
    }

    /**
     * span 提取失败不影响分析，所有操作符退回朴素前进量
     */
    private List<SpanRecord> extractSpans(PDDocument document, int pageIndex) {
        try {
            return new SpanExtractor().extract(document, pageIndex);
        } catch (IOException e) {
            log.warn("第 {} 页 span 提取失败，使用朴素前进量: {}", pageIndex + 1, e.getMessage());
            return null;
        }
    }
}
