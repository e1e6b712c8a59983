package com.studyroom.studyroom_api.meeting.store;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.global.error.code.CommonErrorCode;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// 단위 테스트: 저장소 호출 실패가 어떤 에러코드로 바뀌는지 검증한다.
class MeetingStoreBulkheadTest {

    private BulkheadRegistry registry;
    private MeetingStoreBulkhead storeBulkhead;

    @BeforeEach
    void setUp() {
        // 동시 호출 1개, 대기 없음: permit 하나만 잡아 두면 바로 포화 상태를 만들 수 있다.
        registry = BulkheadRegistry.of(BulkheadConfig.custom()
                .maxConcurrentCalls(1)
                .maxWaitDuration(Duration.ZERO)
                .build());
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .build());
        storeBulkhead = new MeetingStoreBulkhead(registry, retryRegistry);
    }

    @Test
    void 정상_호출은_결과를_그대로_돌려준다() {
        assertThat(storeBulkhead.call(() -> "ok")).isEqualTo("ok");
    }

    @Test
    void 벌크헤드_포화는_서비스불가로_매핑된다() {
        Bulkhead bulkhead = registry.bulkhead(MeetingStoreBulkhead.MEETING_STORE_BULKHEAD);
        assertThat(bulkhead.tryAcquirePermission()).isTrue();
        try {
            assertThatThrownBy(() -> storeBulkhead.call(() -> "never"))
                    .isInstanceOf(ApiException.class)
                    .satisfies(ex -> {
                        ApiException api = (ApiException) ex;
                        assertThat(api.getErrorCode()).isEqualTo(CommonErrorCode.SERVICE_UNAVAILABLE);
                        assertThat(api.getData()).isEqualTo("meeting_store_bulkhead_full");
                    });
        } finally {
            bulkhead.onComplete();
        }
    }

    @Test
    void 락_획득_실패와_타임아웃은_서비스불가로_매핑된다() {
        assertServiceUnavailable(new CannotAcquireLockException("lock wait timeout"));
        assertServiceUnavailable(new QueryTimeoutException("query timeout"));
        assertServiceUnavailable(new TransactionTimedOutException("tx timeout"));
    }

    @Test
    void 도메인_예외와_무결성_위반은_그대로_전달된다() {
        ApiException notFound = new ApiException(MeetingErrorCode.MEETING_NOT_FOUND);
        assertThatThrownBy(() -> storeBulkhead.call(() -> {
            throw notFound;
        })).isSameAs(notFound);

        DataIntegrityViolationException duplicate = new DataIntegrityViolationException("duplicate");
        assertThatThrownBy(() -> storeBulkhead.run(() -> {
            throw duplicate;
        })).isSameAs(duplicate);
    }

    @Test
    void 재시도_호출은_일시적_실패_뒤_성공한_결과를_돌려준다() {
        AtomicInteger calls = new AtomicInteger();

        String result = storeBulkhead.callRetrying(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new CannotAcquireLockException("lock wait timeout");
            }
            return "left";
        });

        assertThat(result).isEqualTo("left");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void 재시도_호출은_도메인_예외를_다시_시도하지_않는다() {
        AtomicInteger calls = new AtomicInteger();
        ApiException notFound = new ApiException(MeetingErrorCode.MEETING_NOT_FOUND);

        assertThatThrownBy(() -> storeBulkhead.callRetrying(() -> {
            calls.incrementAndGet();
            throw notFound;
        })).isSameAs(notFound);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void 재시도_횟수를_넘기면_서비스불가를_던진다() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> storeBulkhead.callRetrying(() -> {
            calls.incrementAndGet();
            throw new QueryTimeoutException("query timeout");
        }))
                .isInstanceOf(ApiException.class)
                .extracting(ex -> ((ApiException) ex).getErrorCode())
                .isEqualTo(CommonErrorCode.SERVICE_UNAVAILABLE);
        assertThat(calls.get()).isEqualTo(3);
    }

    private void assertServiceUnavailable(RuntimeException failure) {
        assertThatThrownBy(() -> storeBulkhead.call(() -> {
            throw failure;
        }))
                .isInstanceOf(ApiException.class)
                .satisfies(ex -> {
                    ApiException api = (ApiException) ex;
                    assertThat(api.getErrorCode()).isEqualTo(CommonErrorCode.SERVICE_UNAVAILABLE);
                    assertThat(api.isRetryable()).isTrue();
                });
    }
}
