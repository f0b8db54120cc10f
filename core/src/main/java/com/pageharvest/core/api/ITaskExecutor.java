package com.pageharvest.core.api;

import com.pageharvest.core.client.ClientHandle;
import com.pageharvest.core.executor.ExecutionOutcome;
import com.pageharvest.core.model.FetchTask;

/**
 * 작업 한 건 실행 계약.
 * 모든 I/O 실패는 ExecutionOutcome(에러 레코드, 재시도 여부)로 접어서 돌려주고 예외로 던지지 않는다.
 * 재시도가 결정되면 task의 재시도 카운터는 이미 증가되어 있다.
 */
@FunctionalInterface
public interface ITaskExecutor<C extends ClientHandle> {
    ExecutionOutcome execute(C client, FetchTask task);
}
