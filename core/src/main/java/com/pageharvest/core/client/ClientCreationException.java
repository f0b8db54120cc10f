package com.pageharvest.core.client;

/** 워커가 어떤 클라이언트도 만들 수 없을 때. 실행 전체를 중단시킨다. */
public class ClientCreationException extends RuntimeException {
    private final int workerId;

    public ClientCreationException(int workerId, String message, Throwable cause) {
        super("worker " + workerId + ": " + message, cause);
        this.workerId = workerId;
    }

    public int getWorkerId() { return workerId; }
}
