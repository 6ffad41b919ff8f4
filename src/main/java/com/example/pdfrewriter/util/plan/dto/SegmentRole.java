package com.example.pdfrewriter.util.plan.dto;

/**
 * 段在操作符内的角色
 */
public enum SegmentRole {
    /** 匹配区间之前，原样保留 */
    PREFIX,
    /** 匹配区间，承载替换文本 */
    MATCH,
    /** 匹配区间之后，原样保留 */
    SUFFIX
}
