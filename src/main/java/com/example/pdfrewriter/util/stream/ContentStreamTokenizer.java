package com.example.pdfrewriter.util.stream;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDPage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 内容流分词器
 *
 * 将页面内容流（PDFStreamParser 的扁平 token 列表）归并为
 * {@code (operands, operator)} 指令序列，供状态跟踪器逐条重放。
 *
 * 遇到操作符之前累积的所有 COSBase 都视为该操作符的操作数。
 */
public final class ContentStreamTokenizer {

    private ContentStreamTokenizer() {
    }

    /**
     * 读取页面内容流
     *
     * @param page PDF 页面
     * @return 指令序列（页面没有内容流时为空列表）
     * @throws IOException 内容流解析失败
     */
    public static List<ContentOperation> readOperations(PDPage page) throws IOException {
        if (page == null || !page.hasContents()) {
            return new ArrayList<>();
        }
        PDFStreamParser parser = new PDFStreamParser(page);
        return group(parser.parse());
    }

    /**
     * 读取原始内容流字节（测试或表单 XObject 使用）
     */
    public static List<ContentOperation> readOperations(byte[] contentBytes) throws IOException {
        if (contentBytes == null || contentBytes.length == 0) {
            return new ArrayList<>();
        }
        PDFStreamParser parser = new PDFStreamParser(contentBytes);
        return group(parser.parse());
    }

    private static List<ContentOperation> group(List<Object> tokens) {
        List<ContentOperation> operations = new ArrayList<>();
        List<COSBase> pending = new ArrayList<>();
        for (Object token : tokens) {
            if (token instanceof Operator) {
                operations.add(new ContentOperation(pending, (Operator) token));
                pending = new ArrayList<>();
            } else if (token instanceof COSBase) {
                pending.add((COSBase) token);
            }
        }
        // 末尾残留的操作数没有操作符，丢弃
        return operations;
    }
}
