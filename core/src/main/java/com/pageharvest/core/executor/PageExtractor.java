package com.pageharvest.core.executor;

import com.pageharvest.core.client.browser.LoadedPage;

import java.util.Map;

/** 준비된 페이지에서 필드를 뽑아낸다. 던진 예외는 EXTRACTION 실패로 분류된다. */
@FunctionalInterface
public interface PageExtractor {
    Map<String, Object> extract(LoadedPage page) throws Exception;
}
