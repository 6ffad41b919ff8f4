package com.example.pdfrewriter.util.rewrite.dto;

/**
 * 替换来源：哪个请求、期望原文、替换文本、来自哪个操作符
 */
public final class SpanMappingRef {

    private final String requestId;
    private final String original;
    private final String replacement;
    private final Integer operatorIndex;

    public SpanMappingRef(String requestId, String original, String replacement, Integer operatorIndex) {
        this.requestId = requestId;
        this.original = original != null ? original : "";
        this.replacement = replacement != null ? replacement : "";
        this.operatorIndex = operatorIndex;
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

    public Integer getOperatorIndex() {
        return operatorIndex;
    }

    @Override
    public String toString() {
        return "SpanMappingRef{request=" + requestId + ", '" + original + "' -> '" + replacement
                + "', op=" + operatorIndex + '}';
    }
}
