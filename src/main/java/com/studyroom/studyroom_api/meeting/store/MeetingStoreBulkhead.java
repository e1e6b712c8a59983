package com.studyroom.studyroom_api.meeting.store;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.global.error.code.CommonErrorCode;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.function.Supplier;

/**
 * MeetingStore 호출의 동시 실행 수를 제한하고, 재시도 가능한 저장소 실패를 503 으로 바꾼다.
 * <p>
 * SemaphoreBulkhead 라서 호출 스레드는 그대로 쓰고 "동시 호출 수"만 제한한다.
 * <p>
 * 되돌려 줄 호출자가 없는 쓰기(연결 끊김 뒤의 퇴장 처리 등)는 {@link #callRetrying(Supplier)} 로
 * 503 계열 실패만 몇 번 더 시도한다. 횟수와 간격은 resilience4j.retry.configs.default 를 따른다.
 */
@Slf4j
@Component
public class MeetingStoreBulkhead {

    static final String MEETING_STORE_BULKHEAD = "meetingStore";
    static final String MEETING_STORE_RETRY = "meetingStore";

    private final Bulkhead bulkhead;
    private final Retry retry;

    public MeetingStoreBulkhead(BulkheadRegistry bulkheadRegistry, RetryRegistry retryRegistry) {
        this.bulkhead = bulkheadRegistry.bulkhead(MEETING_STORE_BULKHEAD);
        this.retry = retryRegistry.retry(MEETING_STORE_RETRY, RetryConfig.from(retryRegistry.getDefaultConfig())
                .retryOnException(MeetingStoreBulkhead::isRetryable)
                .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn("[MeetingStore] retry attempt={} cause={}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    public <T> T call(Supplier<T> supplier) {
        try {
            return bulkhead.executeSupplier(supplier);
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    public <T> T callRetrying(Supplier<T> supplier) {
        return retry.executeSupplier(() -> call(supplier));
    }

    public void run(Runnable runnable) {
        call(() -> {
            runnable.run();
            return null;
        });
    }

    private static boolean isRetryable(Throwable throwable) {
        return throwable instanceof ApiException && ((ApiException) throwable).isRetryable();
    }

    private RuntimeException translate(RuntimeException throwable) {
        if (throwable instanceof BulkheadFullException) {
            log.warn("[MeetingStore] bulkhead full name={}", bulkhead.getName());
            return new ApiException(CommonErrorCode.SERVICE_UNAVAILABLE, "meeting_store_bulkhead_full");
        }
        if (throwable instanceof TransactionTimedOutException
                || throwable instanceof ConcurrencyFailureException
                || throwable instanceof TransientDataAccessException) {
            log.warn("[MeetingStore] transient failure type={} message={}",
                    throwable.getClass().getSimpleName(), throwable.getMessage());
            return new ApiException(CommonErrorCode.SERVICE_UNAVAILABLE, "meeting_store_unavailable");
        }
        return throwable;
    }
}
