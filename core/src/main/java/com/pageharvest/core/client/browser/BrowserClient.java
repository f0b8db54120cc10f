package com.pageharvest.core.client.browser;

import com.pageharvest.core.client.ClientHandle;

/** 워커 전용 브라우저 인스턴스. 작업마다 격리된 컨텍스트+페이지를 연다. */
public interface BrowserClient extends ClientHandle {
    /**
     * 새 컨텍스트와 페이지를 연다. 반환된 페이지를 닫으면 컨텍스트까지 정리된다.
     * @throws PageOperationException 컨텍스트 생성 실패
     */
    LoadedPage openPage(PageProfile profile);
}
