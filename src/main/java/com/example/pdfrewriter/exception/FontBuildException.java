package com.example.pdfrewriter.exception;

/**
 * 派生字体构建失败（基础字体不可用、缺少必要的表、写出失败）
 */
public class FontBuildException extends PdfRewriteException {

    public FontBuildException(String message) {
        super(message);
    }

    public FontBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
