package com.pageharvest.core.service;

/** 워커에서 빠져나온 예외. 실행 전체가 중단되고 부분 결과는 반환하지 않는다. */
public class WorkerFailureException extends RuntimeException {
    public WorkerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
