package com.example.pdfrewriter.util.stream;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 页面字体资源查找（带缓存）
 *
 * 解码、测宽、写回共用一个实例，同一页面内同名资源只加载一次。
 * 非线程安全，每页一个。
 */
@Slf4j
public class PageFonts {

    private final PDResources resources;
    private final Map<String, PDFont> byResource = new HashMap<>();

    public PageFonts(PDResources resources) {
        this.resources = resources;
    }

    /**
     * 按资源名（Tf 的第一个操作数）取字体；不存在或加载失败返回 null
     */
    public PDFont byResourceName(String fontResource) {
        if (resources == null || fontResource == null) {
            return null;
        }
        if (byResource.containsKey(fontResource)) {
            return byResource.get(fontResource);
        }
        PDFont font = null;
        try {
            font = resources.getFont(COSName.getPDFName(fontResource));
        } catch (IOException e) {
            log.warn("加载字体资源失败: {}, {}", fontResource, e.getMessage());
        }
        byResource.put(fontResource, font);
        return font;
    }

    /**
     * 按字体名（BaseFont，忽略子集前缀 "ABCDEF+"）取字体；找不到返回 null
     */
    public PDFont byFontName(String fontName) {
        if (resources == null || fontName == null || fontName.isEmpty()) {
            return null;
        }
        String wanted = stripSubsetPrefix(fontName);
        for (COSName name : resources.getFontNames()) {
            PDFont font = byResourceName(name.getName());
            if (font != null && font.getName() != null && stripSubsetPrefix(font.getName()).equals(wanted)) {
                return font;
            }
        }
        return null;
    }

    static String stripSubsetPrefix(String name) {
        int plus = name.indexOf('+');
        return plus == 6 ? name.substring(plus + 1) : name;
    }
}
