package com.example.pdfrewriter.service.dto;

/**
 * 一次替换请求：把页面可见文本中的 original 换成 replacement
 */
public final class ReplacementRequest {

    private final String requestId;
    private final String original;
    private final String replacement;

    public ReplacementRequest(String requestId, String original, String replacement) {
        this.requestId = requestId;
        this.original = original;
        this.replacement = replacement != null ? replacement : "";
    }

    public String getRequestId() {
        return requestId;
    }

    public String getOriginal() {
        return original;
    }

    public String getReplacement() {
        return replacement;
    }

    @Override
    public String toString() {
        return "ReplacementRequest{id=" + requestId + ", '" + original + "' -> '" + replacement + "'}";
    }
}
