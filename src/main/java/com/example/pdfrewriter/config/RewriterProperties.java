package com.example.pdfrewriter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

/**
 * 改写流水线配置（application.yml，前缀 rewriter）
 *
 * 流水线里的类不依赖 Spring，由 service 层把这里的值通过构造参数传进去。
 */
@Slf4j
@Component
public class RewriterProperties {

    // 对齐：前缀收缩重试的最短前缀
    @Value("${rewriter.alignment.min-prefix-length:16}")
    private int minPrefixLength;

    // 前进量漂移容差（点）+ 按有效字号放大的部分
    @Value("${rewriter.metrics.drift-tolerance:0.5}")
    private double driftTolerance;

    @Value("${rewriter.metrics.drift-tolerance-per-font-size:0.0}")
    private double driftTolerancePerFontSize;

    @Value("${rewriter.metrics.naive-glyph-width-factor:0.5}")
    private double naiveGlyphWidthFactor;

    @Value("${rewriter.plan.isolate-empty-middle-segments:false}")
    private boolean isolateEmptyMiddleSegments;

    @Value("${rewriter.rewrite.min-scale:0.5}")
    private double minScale;

    @Value("${rewriter.font.cache-dir:${java.io.tmpdir}/pdf-text-rewriter/font-cache}")
    private String fontCacheDir;

    // filesystem / memory
    @Value("${rewriter.font.cache-type:filesystem}")
    private String fontCacheType;

    @Value("${rewriter.report.enabled:false}")
    private boolean reportEnabled;

    @Value("${rewriter.report.dir:./data/reports}")
    private String reportDir;

    @PostConstruct
    public void init() {
        log.info("改写配置已加载: minPrefix={}, drift={}+{}/pt, naiveFactor={}, isolateEmptyMiddle={}, minScale={}, fontCache={}:{}, report={}:{}",
                minPrefixLength, driftTolerance, driftTolerancePerFontSize, naiveGlyphWidthFactor,
                isolateEmptyMiddleSegments, minScale, fontCacheType, fontCacheDir, reportEnabled, reportDir);
    }

    public int getMinPrefixLength() {
        return minPrefixLength;
    }

    public double getDriftTolerance() {
        return driftTolerance;
    }

    public double getDriftTolerancePerFontSize() {
        return driftTolerancePerFontSize;
    }

    public double getNaiveGlyphWidthFactor() {
        return naiveGlyphWidthFactor;
    }

    public boolean isIsolateEmptyMiddleSegments() {
        return isolateEmptyMiddleSegments;
    }

    public double getMinScale() {
        return minScale;
    }

    public String getFontCacheDir() {
        return fontCacheDir;
    }

    public String getFontCacheType() {
        return fontCacheType;
    }

    public boolean isReportEnabled() {
        return reportEnabled;
    }

    public String getReportDir() {
        return reportDir;
    }
}
