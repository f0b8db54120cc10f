package com.pageharvest.core.client.browser;

/** 내비게이션 시간 초과 */
public class PageTimeoutException extends PageOperationException {
    public PageTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
