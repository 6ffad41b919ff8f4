package com.example.pdfrewriter.util.stream;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于页面字体资源的解码器
 *
 * <h3>解码流程</h3>
 * <ol>
 *   <li>按资源名取 PDFont（{@link PageFonts} 缓存）</li>
 *   <li>PDFont.readCode 逐个读取字符编码（单字节/多字节由字体决定）</li>
 *   <li>PDFont.toUnicode 映射为 Unicode；没有映射的编码退回 ISO-8859-1 单字符</li>
 * </ol>
 *
 * 字体资源缺失或读取失败时整体退回 {@link TextFragmentDecoder#LATIN1}。
 */
@Slf4j
public class FontAwareTextDecoder implements TextFragmentDecoder {

    private final PageFonts fonts;

    public FontAwareTextDecoder(PageFonts fonts) {
        this.fonts = fonts;
    }

    @Override
    public String decode(String fontResource, COSString string) {
        Decoded decoded = decodeCodes(fontResource, string);
        return decoded != null ? decoded.text.toString() : LATIN1.decode(fontResource, string);
    }

    @Override
    public int[] byteOffsets(String fontResource, COSString string) {
        Decoded decoded = decodeCodes(fontResource, string);
        if (decoded == null) {
            return LATIN1.byteOffsets(fontResource, string);
        }
        int[] offsets = new int[decoded.offsets.size() + 1];
        for (int i = 0; i < decoded.offsets.size(); i++) {
            offsets[i] = decoded.offsets.get(i);
        }
        offsets[offsets.length - 1] = string.getBytes().length;
        return offsets;
    }

    private Decoded decodeCodes(String fontResource, COSString string) {
        PDFont font = fonts != null ? fonts.byResourceName(fontResource) : null;
        if (font == null) {
            return null;
        }

        byte[] bytes = string.getBytes();
        Decoded decoded = new Decoded();
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            while (in.available() > 0) {
                int codeStart = bytes.length - in.available();
                int code = font.readCode(in);
                String unicode = font.toUnicode(code);
                if (unicode == null) {
                    unicode = String.valueOf((char) (code & 0xFF));
                }
                decoded.text.append(unicode);
                for (int i = 0; i < unicode.length(); i++) {
                    decoded.offsets.add(codeStart);
                }
            }
        } catch (IOException e) {
            log.warn("字体解码失败，退回 Latin-1: font={}, error={}", fontResource, e.getMessage());
            return null;
        }
        return decoded;
    }

    private static final class Decoded {
        private final StringBuilder text = new StringBuilder();
        private final List<Integer> offsets = new ArrayList<>();
    }
}
