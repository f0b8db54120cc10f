package com.pageharvest.core.client.browser;

/** 브라우저/페이지 조작 실패 (전송 계열) */
public class PageOperationException extends RuntimeException {
    public PageOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
