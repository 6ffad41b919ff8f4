package com.example.pdfrewriter.util.font;

import com.example.pdfrewriter.exception.FontBuildException;
import com.example.pdfrewriter.exception.GlyphLookupException;
import org.apache.fontbox.ttf.CmapLookup;
import org.apache.fontbox.ttf.HorizontalMetricsTable;
import org.apache.fontbox.ttf.PostScriptTable;
import org.apache.fontbox.ttf.TrueTypeFont;

import java.io.IOException;

/**
 * 基于 FontBox TrueTypeFont 的字形查询：Unicode cmap + hmtx + post 字形名
 *
 * post 表没有名字时用 uniXXXX（BMP 外用 uXXXXXX）。
 */
public class TrueTypeGlyphLookup implements GlyphLookup {

    private final String fontName;
    private final CmapLookup cmap;
    private final HorizontalMetricsTable hmtx;
    private final PostScriptTable post;

    public TrueTypeGlyphLookup(TrueTypeFont font) {
        try {
            this.fontName = font.getName();
            this.cmap = font.getUnicodeCmapLookup();
            this.hmtx = font.getHorizontalMetrics();
            this.post = font.getPostScript();
        } catch (IOException e) {
            throw new FontBuildException("读取字体 cmap/hmtx 失败", e);
        }
        if (cmap == null || hmtx == null) {
            throw new FontBuildException("字体缺少 Unicode cmap 或 hmtx 表: " + fontName);
        }
    }

    @Override
    public String fontName() {
        return fontName;
    }

    @Override
    public boolean isAvailable(int codePoint) {
        return cmap.getGlyphId(codePoint) > 0;
    }

    @Override
    public int glyphId(int codePoint) {
        int gid = cmap.getGlyphId(codePoint);
        if (gid <= 0) {
            throw new GlyphLookupException(fontName, new String(Character.toChars(codePoint)));
        }
        return gid;
    }

    @Override
    public String glyphName(int codePoint) {
        int gid = glyphId(codePoint);
        String name = post != null ? post.getName(gid) : null;
        if (name != null && !name.isEmpty() && !".notdef".equals(name)) {
            return name;
        }
        return codePoint <= 0xFFFF ? String.format("uni%04X", codePoint) : String.format("u%06X", codePoint);
    }

    @Override
    public double glyphWidth(int codePoint) {
        return hmtx.getAdvanceWidth(glyphId(codePoint));
    }
}
