package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.global.error.code.CommonErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingLifecycleService;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import com.studyroom.studyroom_api.meeting.store.ParticipantDeparture;
import com.studyroom.studyroom_api.meeting.store.ParticipantSnapshot;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RecordingLiveConnection;
import com.studyroom.studyroom_api.presence.RoomEventType;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

// 단위 테스트: 저장소는 mock 으로, 방 연결은 실제 PresenceBroadcaster 로 두고 연결 끊김 퇴장을 검증한다.
class MeetingAdmissionServiceImplTest {

    private static final String MEETING_ID = "7hk3m9pqrt";
    private static final String ROOM_ID = "room_7hk3m9pqrt";

    private MeetingStore meetingStore;
    private MeetingLifecycleService meetingLifecycleService;
    private PresenceBroadcaster presenceBroadcaster;
    private MeetingAdmissionServiceImpl meetingAdmissionService;

    private RecordingLiveConnection leaving;
    private RecordingLiveConnection staying;

    @BeforeEach
    void setUp() {
        meetingStore = mock(MeetingStore.class);
        meetingLifecycleService = mock(MeetingLifecycleService.class);
        presenceBroadcaster = new PresenceBroadcaster();
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .build());
        meetingAdmissionService = new MeetingAdmissionServiceImpl(
                meetingStore,
                new MeetingStoreBulkhead(BulkheadRegistry.ofDefaults(), retryRegistry),
                meetingLifecycleService,
                mock(MeetingReadService.class),
                presenceBroadcaster
        );

        leaving = new RecordingLiveConnection("user-a");
        staying = new RecordingLiveConnection("user-b");
        presenceBroadcaster.register(ROOM_ID, leaving);
        presenceBroadcaster.register(ROOM_ID, staying);
        when(meetingStore.get(MEETING_ID)).thenReturn(Optional.empty());
    }

    @Test
    void 끊김_퇴장은_일시적_저장소_실패를_다시_시도해_좌석을_비운다() {
        // given: 첫 퇴장 처리만 락 대기 실패
        when(meetingStore.markLeft(MEETING_ID, "user-a"))
                .thenThrow(new CannotAcquireLockException("lock wait timeout"))
                .thenReturn(Optional.of(departure(1)));

        // when
        meetingAdmissionService.disconnect(MEETING_ID, "user-a", leaving);

        // then
        verify(meetingStore, times(2)).markLeft(MEETING_ID, "user-a");
        assertThat(staying.eventTypes()).containsExactly(RoomEventType.PARTICIPANT_LEFT);
        assertThat(staying.events().get(0).participantCount()).isEqualTo(1);
        assertThat(presenceBroadcaster.connectionCount(ROOM_ID)).isEqualTo(1);
        verify(meetingLifecycleService, never()).onRoomEmpty(anyString());
    }

    @Test
    void 재시도까지_실패하면_서비스불가를_던지고_퇴장_알림은_보내지_않는다() {
        // given
        when(meetingStore.markLeft(MEETING_ID, "user-a"))
                .thenThrow(new CannotAcquireLockException("lock wait timeout"));

        // when & then
        assertThatThrownBy(() -> meetingAdmissionService.disconnect(MEETING_ID, "user-a", leaving))
                .isInstanceOf(ApiException.class)
                .extracting(ex -> ((ApiException) ex).getErrorCode())
                .isEqualTo(CommonErrorCode.SERVICE_UNAVAILABLE);
        verify(meetingStore, times(3)).markLeft(MEETING_ID, "user-a");
        assertThat(staying.events()).isEmpty();
    }

    @Test
    void 마지막_참여자의_끊김은_빈_방_처리로_이어진다() {
        // given
        presenceBroadcaster.deregister(ROOM_ID, staying);
        when(meetingStore.markLeft(MEETING_ID, "user-a")).thenReturn(Optional.of(departure(0)));

        // when
        meetingAdmissionService.disconnect(MEETING_ID, "user-a", leaving);

        // then
        verify(meetingLifecycleService).onRoomEmpty(MEETING_ID);
    }

    @Test
    void 이미_교체된_연결의_끊김은_저장소를_건드리지_않는다() {
        // given: 같은 사용자가 새 연결로 다시 붙었다
        RecordingLiveConnection replacement = new RecordingLiveConnection("user-a");
        presenceBroadcaster.register(ROOM_ID, replacement);

        // when
        meetingAdmissionService.disconnect(MEETING_ID, "user-a", leaving);

        // then
        verify(meetingStore, never()).markLeft(anyString(), anyString());
        assertThat(presenceBroadcaster.connectionCount(ROOM_ID)).isEqualTo(2);
    }

    private ParticipantDeparture departure(int remaining) {
        Instant joinedAt = Instant.now().minusSeconds(60);
        ParticipantSnapshot participant = new ParticipantSnapshot(11L, "user-a", "에이", null, joinedAt, Instant.now());
        return new ParticipantDeparture(ROOM_ID, participant, remaining);
    }
}
