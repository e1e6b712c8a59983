package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.StudyroomApiApplication;
import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.dto.CreateMeetingRequest;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingCommand;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingDetailResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingSettingsRequest;
import com.studyroom.studyroom_api.meeting.dto.ParticipantResponse;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingAdmissionService;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.service.MeetingService;
import com.studyroom.studyroom_api.presence.RecordingLiveConnection;
import com.studyroom.studyroom_api.presence.RoomEventType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// 통합 테스트: 실제 스프링 컨텍스트와 H2(MySQL 모드) 위에서 입장/퇴장 흐름을 검증한다.
@SpringBootTest(classes = StudyroomApiApplication.class)
class MeetingAdmissionServiceImplIntegrationTest {

    @Autowired
    private MeetingService meetingService;

    @Autowired
    private MeetingAdmissionService meetingAdmissionService;

    @Autowired
    private MeetingReadService meetingReadService;

    @Test
    void joinUntilFullThenRejects() {
        // given: 정원 2명, 비밀번호 없는 회의
        String meetingId = createMeeting(2, null);

        // when
        JoinMeetingResponse first = meetingAdmissionService.join(command(meetingId, "user-a", null), null);
        JoinMeetingResponse second = meetingAdmissionService.join(command(meetingId, "user-b", null), null);

        // then
        assertThat(first.participantCount()).isEqualTo(1);
        assertThat(first.meeting().status()).isEqualTo(MeetingStatus.ACTIVE);
        assertThat(first.meeting().actualStartTime()).isNotNull();
        assertThat(first.alreadyActive()).isFalse();
        assertThat(second.participantCount()).isEqualTo(2);

        assertThatThrownBy(() -> meetingAdmissionService.join(command(meetingId, "user-c", null), null))
                .isInstanceOf(ApiException.class)
                .satisfies(ex -> {
                    ApiException api = (ApiException) ex;
                    assertThat(api.getErrorCode()).isEqualTo(MeetingErrorCode.MEETING_FULL);
                    assertThat(api.getData()).isEqualTo("participantCount=2");
                });
        assertThat(meetingReadService.getMeeting(meetingId).participantCount()).isEqualTo(2);
    }

    @Test
    void wrongPasswordLeavesRosterUnchanged() {
        // given
        String meetingId = createMeeting(4, "abcd");

        // when & then
        assertThatThrownBy(() -> meetingAdmissionService.join(command(meetingId, "user-a", "wrong"), null))
                .isInstanceOf(ApiException.class)
                .extracting(ex -> ((ApiException) ex).getErrorCode())
                .isEqualTo(MeetingErrorCode.WRONG_ROOM_PASSWORD);
        assertThatThrownBy(() -> meetingAdmissionService.join(command(meetingId, "user-a", null), null))
                .isInstanceOf(ApiException.class)
                .extracting(ex -> ((ApiException) ex).getErrorCode())
                .isEqualTo(MeetingErrorCode.WRONG_ROOM_PASSWORD);

        MeetingDetailResponse untouched = meetingReadService.getMeeting(meetingId);
        assertThat(untouched.participantCount()).isZero();
        assertThat(untouched.status()).isEqualTo(MeetingStatus.SCHEDULED);

        JoinMeetingResponse joined = meetingAdmissionService.join(command(meetingId, "user-a", "abcd"), null);
        assertThat(joined.participantCount()).isEqualTo(1);
    }

    @Test
    void joinUnknownMeetingIsNotFound() {
        assertThatThrownBy(() -> meetingAdmissionService.join(command("zzzzzzzzzz", "user-a", null), null))
                .isInstanceOf(ApiException.class)
                .extracting(ex -> ((ApiException) ex).getErrorCode())
                .isEqualTo(MeetingErrorCode.MEETING_NOT_FOUND);
    }

    @Test
    void rejoinWhileActiveReturnsExistingAttendance() {
        // given
        String meetingId = createMeeting(3, null);
        JoinMeetingResponse first = meetingAdmissionService.join(command(meetingId, "user-a", null), null);

        // when
        JoinMeetingResponse again = meetingAdmissionService.join(command(meetingId, "user-a", null), null);

        // then: 좌석을 하나 더 차지하지 않는다
        assertThat(first.alreadyActive()).isFalse();
        assertThat(again.alreadyActive()).isTrue();
        assertThat(again.participantCount()).isEqualTo(1);
        assertThat(meetingReadService.getMeeting(meetingId).participants()).hasSize(1);
    }

    @Test
    void leaveIsIdempotent() {
        // given
        String meetingId = createMeeting(3, null);
        meetingAdmissionService.join(command(meetingId, "user-a", null), null);
        meetingAdmissionService.join(command(meetingId, "user-b", null), null);

        // when: 같은 퇴장을 두 번, 입장한 적 없는 사용자의 퇴장을 한 번
        meetingAdmissionService.leave(meetingId, "user-a");
        meetingAdmissionService.leave(meetingId, "user-a");
        meetingAdmissionService.leave(meetingId, "nobody");

        // then
        MeetingDetailResponse meeting = meetingReadService.getMeeting(meetingId);
        assertThat(meeting.participantCount()).isEqualTo(1);
        assertThat(meeting.participants()).extracting(ParticipantResponse::userId).containsExactly("user-b");
    }

    @Test
    void leaveThenRejoinCreatesNewAttendance() {
        // given
        String meetingId = createMeeting(2, null);
        meetingAdmissionService.join(command(meetingId, "user-a", null), null);
        meetingAdmissionService.leave(meetingId, "user-a");

        // when
        JoinMeetingResponse rejoined = meetingAdmissionService.join(command(meetingId, "user-a", null), null);

        // then: 퇴장 후 재입장은 새 입장으로 본다
        assertThat(rejoined.alreadyActive()).isFalse();
        assertThat(rejoined.participantCount()).isEqualTo(1);
        assertThat(rejoined.meeting().status()).isEqualTo(MeetingStatus.ACTIVE);
    }

    @Test
    void liveConnectionsReceiveJoinAndLeaveButNotTheirOwnJoin() {
        // given
        String meetingId = createMeeting(4, null);
        RecordingLiveConnection alice = new RecordingLiveConnection("user-a");
        RecordingLiveConnection bob = new RecordingLiveConnection("user-b");

        // when
        meetingAdmissionService.join(command(meetingId, "user-a", null), alice);
        meetingAdmissionService.join(command(meetingId, "user-b", null), bob);
        meetingAdmissionService.leave(meetingId, "user-b");

        // then
        assertThat(alice.eventTypes())
                .containsExactly(RoomEventType.PARTICIPANT_JOINED, RoomEventType.PARTICIPANT_LEFT);
        assertThat(alice.events().get(0).participantCount()).isEqualTo(2);
        assertThat(alice.events().get(1).participantCount()).isEqualTo(1);
        assertThat(bob.events()).isEmpty();
        // 명시적 퇴장은 그 사용자의 연결도 닫는다
        assertThat(bob.isClosed()).isTrue();
        assertThat(alice.isClosed()).isFalse();
    }

    @Test
    void staleDisconnectDoesNotRemoveNewerConnection() {
        // given: 같은 사용자가 새 연결로 다시 붙었다
        String meetingId = createMeeting(4, null);
        RecordingLiveConnection oldConnection = new RecordingLiveConnection("user-a");
        RecordingLiveConnection newConnection = new RecordingLiveConnection("user-a");
        meetingAdmissionService.join(command(meetingId, "user-a", null), oldConnection);
        meetingAdmissionService.join(command(meetingId, "user-a", null), newConnection);

        // when: 예전 연결의 끊김이 늦게 도착
        meetingAdmissionService.disconnect(meetingId, "user-a", oldConnection);

        // then: 입장 상태는 유지된다
        assertThat(oldConnection.isClosed()).isTrue();
        assertThat(meetingReadService.getMeeting(meetingId).participantCount()).isEqualTo(1);

        // when: 현재 연결이 끊기면 퇴장 처리
        meetingAdmissionService.disconnect(meetingId, "user-a", newConnection);
        assertThat(meetingReadService.getMeeting(meetingId).participantCount()).isZero();
    }

    @Test
    void concurrentJoinsNeverExceedCapacity() throws Exception {
        // given: 정원 3명 회의에 12명이 동시에 입장
        int capacity = 3;
        int attempts = 12;
        String meetingId = createMeeting(capacity, null);

        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> unexpected = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < attempts; i++) {
            String userId = "racer-" + i;
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    start.await();
                    meetingAdmissionService.join(command(meetingId, userId, null), null);
                    admitted.incrementAndGet();
                } catch (ApiException e) {
                    // 벌크헤드(50)와 커넥션 풀(20)이 12명을 모두 받으므로 정원 초과만 허용
                    if (e.getErrorCode() != MeetingErrorCode.MEETING_FULL) {
                        unexpected.add(e);
                    }
                } catch (Exception e) {
                    unexpected.add(e);
                }
            }, pool));
        }

        // when
        start.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        pool.shutdown();

        // then
        MeetingDetailResponse meeting = meetingReadService.getMeeting(meetingId);
        assertThat(unexpected).isEmpty();
        assertThat(admitted.get()).isEqualTo(capacity);
        assertThat(meeting.participantCount()).isEqualTo(admitted.get());
        assertThat(meeting.participants()).hasSize(admitted.get());
    }

    private String createMeeting(int maxParticipants, String roomPassword) {
        MeetingSettingsRequest settings = new MeetingSettingsRequest(
                maxParticipants, null, null, null, null, null, null);
        return meetingService.createMeeting(new CreateMeetingRequest(
                "스터디", null, "user-a", null, settings, roomPassword)).meetingId();
    }

    private JoinMeetingCommand command(String meetingId, String userId, String roomPassword) {
        return new JoinMeetingCommand(meetingId, userId, "name-" + userId, null, roomPassword);
    }
}
