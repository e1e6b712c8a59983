package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.meeting.config.MeetingProperties;
import com.studyroom.studyroom_api.meeting.event.MeetingEndedEvent;
import com.studyroom.studyroom_api.meeting.store.FinishedMeeting;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RecordingLiveConnection;
import com.studyroom.studyroom_api.presence.RoomEventType;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

// 단위 테스트: 저장소는 mock 으로, 방 연결은 실제 PresenceBroadcaster 로 두고 종료 정책만 검증한다.
class MeetingLifecycleServiceImplTest {

    private MeetingStore meetingStore;
    private PresenceBroadcaster presenceBroadcaster;
    private ApplicationEventPublisher eventPublisher;

    @BeforeEach
    void setUp() {
        meetingStore = mock(MeetingStore.class);
        presenceBroadcaster = new PresenceBroadcaster();
        eventPublisher = mock(ApplicationEventPublisher.class);
    }

    @Test
    void 즉시_종료_정책이_꺼져_있으면_빈_방을_그대로_둔다() {
        MeetingLifecycleServiceImpl service = service(false);

        service.onRoomEmpty("7hk3m9pqrt");

        verify(meetingStore, never()).finishIfIdle(anyString(), any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void 즉시_종료_정책이_켜져_있으면_빈_방을_닫는다() {
        MeetingLifecycleServiceImpl service = service(true);
        RecordingLiveConnection lingering = new RecordingLiveConnection("user-a");
        presenceBroadcaster.register("room_7hk3m9pqrt", lingering);
        when(meetingStore.finishIfIdle(eq("7hk3m9pqrt"), any()))
                .thenReturn(Optional.of(new FinishedMeeting("7hk3m9pqrt", "room_7hk3m9pqrt", 0, Instant.now())));

        service.onRoomEmpty("7hk3m9pqrt");

        assertThat(lingering.eventTypes()).containsExactly(RoomEventType.MEETING_ENDED);
        assertThat(lingering.isClosed()).isTrue();
        verify(eventPublisher).publishEvent(any(MeetingEndedEvent.class));
    }

    @Test
    void 그사이_재입장했으면_조건부_종료가_실패하고_아무것도_하지_않는다() {
        MeetingLifecycleServiceImpl service = service(true);
        when(meetingStore.finishIfIdle(eq("7hk3m9pqrt"), any())).thenReturn(Optional.empty());

        service.onRoomEmpty("7hk3m9pqrt");

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void 스윕은_유예시간_이전부터_빈_회의만_후보로_조회한다() {
        MeetingLifecycleServiceImpl service = service(false);
        when(meetingStore.findIdleMeetingIds(any())).thenReturn(List.of("aaaaaaaaaa", "bbbbbbbbbb"));
        when(meetingStore.finishIfIdle(eq("aaaaaaaaaa"), any()))
                .thenReturn(Optional.of(new FinishedMeeting("aaaaaaaaaa", "room_aaaaaaaaaa", 0, Instant.now())));
        // 두 번째 후보는 조회와 종료 사이에 누가 들어왔다
        when(meetingStore.finishIfIdle(eq("bbbbbbbbbb"), any())).thenReturn(Optional.empty());

        Instant before = Instant.now();
        int ended = service.sweepIdleMeetings();
        Instant after = Instant.now();

        assertThat(ended).isEqualTo(1);
        ArgumentCaptor<Instant> threshold = ArgumentCaptor.forClass(Instant.class);
        verify(meetingStore).findIdleMeetingIds(threshold.capture());
        assertThat(threshold.getValue())
                .isBetween(before.minus(Duration.ofMinutes(5)), after.minus(Duration.ofMinutes(5)));
    }

    private MeetingLifecycleServiceImpl service(boolean endWhenEmpty) {
        MeetingProperties properties = new MeetingProperties(
                null, new MeetingProperties.Lifecycle(endWhenEmpty, Duration.ofMinutes(5), null), null, null);
        return new MeetingLifecycleServiceImpl(
                meetingStore,
                new MeetingStoreBulkhead(BulkheadRegistry.ofDefaults(), RetryRegistry.ofDefaults()),
                presenceBroadcaster,
                eventPublisher,
                properties
        );
    }
}
