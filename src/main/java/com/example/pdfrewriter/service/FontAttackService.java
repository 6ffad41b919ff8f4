package com.example.pdfrewriter.service;

import com.example.pdfrewriter.config.RewriterProperties;
import com.example.pdfrewriter.util.font.ChunkPlanner;
import com.example.pdfrewriter.util.font.FontAttackBuilder;
import com.example.pdfrewriter.util.font.FontCache;
import com.example.pdfrewriter.util.font.dto.AttackPlan;
import com.example.pdfrewriter.util.font.dto.FontBuildResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 派生字体服务：字形分配 + 字体构建，共用进程级字体缓存
 */
@Slf4j
@Service
public class FontAttackService {

    private final FontCache fontCache;
    private final RewriteReportWriter reportWriter;
    private final RewriterProperties properties;

    public FontAttackService(FontCache fontCache, RewriteReportWriter reportWriter, RewriterProperties properties) {
        this.fontCache = fontCache;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    /**
     * 让 hiddenText 的字符渲染成 visualText
     *
     * @param baseFont   基础 TrueType 字体
     * @param hiddenText 文本层里的字符，不能为空
     * @param visualText 渲染出来的文本
     * @param outputDir  派生字体输出目录
     */
    public List<FontBuildResult> buildAttackFonts(Path baseFont, String hiddenText, String visualText,
                                                  Path outputDir) throws IOException {
        try (FontAttackBuilder builder = new FontAttackBuilder(baseFont, fontCache)) {
            AttackPlan plan = new ChunkPlanner(builder.getGlyphLookup()).plan(hiddenText, visualText);
            List<FontBuildResult> results = builder.buildFonts(plan, outputDir);
            log.info("字体攻击构建完成: hidden='{}', visual='{}', 字体 {} 个", hiddenText, visualText, results.size());
            if (properties.isReportEnabled()) {
                reportWriter.writeFontReport(baseFont.getFileName().toString(), results);
            }
            return results;
        }
    }

    /**
     * 只做字形分配，不生成字体
     */
    public AttackPlan planAttack(Path baseFont, String hiddenText, String visualText) throws IOException {
        try (FontAttackBuilder builder = new FontAttackBuilder(baseFont, null)) {
            return new ChunkPlanner(builder.getGlyphLookup()).plan(hiddenText, visualText);
        }
    }
}
