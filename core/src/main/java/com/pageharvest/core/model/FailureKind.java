package com.pageharvest.core.model;

/** 실행기 오류 분류. 전부 재시도 대상이며, 예산 소진 시 에러 레코드로 남는다. */
public enum FailureKind {
    TIMEOUT,
    TRANSPORT,
    HTTP_STATUS,
    READINESS_TIMEOUT,
    EXTRACTION
}
