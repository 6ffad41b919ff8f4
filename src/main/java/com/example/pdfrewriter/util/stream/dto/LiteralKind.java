package com.example.pdfrewriter.util.stream.dto;

/**
 * 文本显示操作数的字面量形式
 */
public enum LiteralKind {
    /** 括号字符串 (...) */
    TEXT,
    /** 十六进制字符串 &lt;...&gt; */
    BYTE,
    /** TJ 数组 */
    ARRAY,
    /** 非字符串操作数（畸形内容流） */
    UNKNOWN
}
