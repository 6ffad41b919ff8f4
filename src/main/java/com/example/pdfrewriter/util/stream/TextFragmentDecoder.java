package com.example.pdfrewriter.util.stream;

import org.apache.pdfbox.cos.COSString;

import java.nio.charset.StandardCharsets;

/**
 * 文本显示操作数解码器：字节串 → Unicode 文本
 */
public interface TextFragmentDecoder {

    /**
     * 按 ISO-8859-1 逐字节解码，不依赖字体资源
     */
    TextFragmentDecoder LATIN1 = new TextFragmentDecoder() {
        @Override
        public String decode(String fontResource, COSString string) {
            return new String(string.getBytes(), StandardCharsets.ISO_8859_1);
        }
    };

    /**
     * @param fontResource 当前字体资源名（Tf 的第一个操作数，如 "F1"），可能为 null
     * @param string       字符串操作数
     * @return 解码文本，不会返回 null
     */
    String decode(String fontResource, COSString string);

    /**
     * 解码文本每个字符位置 → 原始字节偏移
     *
     * 返回数组长度为 文本长度 + 1，最后一项是字节总数；
     * 一个编码解出多个字符时，这些字符都指向该编码的起始字节。
     * 默认实现按一字节一字符处理。
     */
    default int[] byteOffsets(String fontResource, COSString string) {
        int length = decode(fontResource, string).length();
        int byteCount = string.getBytes().length;
        int[] offsets = new int[length + 1];
        for (int i = 0; i <= length; i++) {
            offsets[i] = Math.min(i, byteCount);
        }
        offsets[length] = byteCount;
        return offsets;
    }
}
