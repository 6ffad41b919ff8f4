package com.example.pdfrewriter.service.dto;

public enum RequestStatus {
    APPLIED,
    /**
     * 部分 span 校验失败被跳过，其余段已写回
     */
    PARTIALLY_APPLIED,
    NOT_FOUND,
    VALIDATION_FAILED,
    EMISSION_FAILED
}
