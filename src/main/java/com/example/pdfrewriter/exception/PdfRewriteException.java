package com.example.pdfrewriter.exception;

/**
 * PDF 文本改写相关异常的根类型
 */
public class PdfRewriteException extends RuntimeException {

    public PdfRewriteException(String message) {
        super(message);
    }

    public PdfRewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
