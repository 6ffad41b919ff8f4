package com.example.pdfrewriter.support;

import com.example.pdfrewriter.util.span.dto.CharBox;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.ContentOperation;
import com.example.pdfrewriter.util.stream.ContentStreamTokenizer;
import com.example.pdfrewriter.util.stream.ContentStateTracker;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用内容流和 span
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static List<ContentOperation> ops(String content) {
        try {
            return ContentStreamTokenizer.readOperations(content.getBytes(StandardCharsets.ISO_8859_1));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<OperatorRecord> walk(String content) {
        return new ContentStateTracker().walk(ops(content));
    }

    /**
     * 水平 span：每个字符宽 fontSize / 2、高 fontSize，从 (x, y) 开始紧挨着排列
     */
    public static SpanRecord span(int spanIndex, String text, double x, double y, double fontSize) {
        List<CharBox> chars = new ArrayList<>();
        double cursor = x;
        double width = fontSize / 2;
        for (int i = 0; i < text.length(); i++) {
            chars.add(new CharBox(String.valueOf(text.charAt(i)), cursor, y, cursor + width, y + fontSize));
            cursor += width;
        }
        return SpanRecord.fromCharacters(0, 0, 0, spanIndex, "Helvetica", fontSize, x, y,
                new double[]{1, 0}, chars);
    }
}
