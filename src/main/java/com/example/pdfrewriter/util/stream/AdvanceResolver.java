package com.example.pdfrewriter.util.stream;

import com.example.pdfrewriter.util.stream.dto.OperatorRecord;

/**
 * 前进量解析回调（跟踪器第二遍使用）
 *
 * 返回 null 表示无法给出，由跟踪器退回朴素估算。
 */
public interface AdvanceResolver {

    Double resolve(OperatorRecord record, TextGraphicsState state);
}
