package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.global.error.code.CommonErrorCode;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingCommand;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingDetailResponse;
import com.studyroom.studyroom_api.meeting.dto.ParticipantPresenceData;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingAdmissionService;
import com.studyroom.studyroom_api.meeting.service.MeetingLifecycleService;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.store.AdmissionDecision;
import com.studyroom.studyroom_api.meeting.store.AdmissionOutcome;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import com.studyroom.studyroom_api.meeting.store.ParticipantDeparture;
import com.studyroom.studyroom_api.meeting.store.ParticipantSnapshot;
import com.studyroom.studyroom_api.presence.LiveConnection;
import com.studyroom.studyroom_api.presence.ParticipantMediaState;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RoomEvent;
import com.studyroom.studyroom_api.presence.RoomEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingAdmissionServiceImpl implements MeetingAdmissionService {

    private final MeetingStore meetingStore;
    private final MeetingStoreBulkhead storeBulkhead;
    private final MeetingLifecycleService meetingLifecycleService;
    private final MeetingReadService meetingReadService;
    private final PresenceBroadcaster presenceBroadcaster;

    @Override
    public JoinMeetingResponse join(JoinMeetingCommand command, LiveConnection connection) {
        String meetingId = command.meetingId();
        String roomId = Meeting.roomIdOf(meetingId);

        AdmissionOutcome outcome = admit(command);
        ParticipantSnapshot participant = requireAdmitted(meetingId, command.userId(), outcome);
        boolean firstAdmission = outcome.decision() == AdmissionDecision.ADMITTED;

        // 재입장이어도 SCHEDULED 로 남아 있으면 시작 처리한다. activate 는 조건부라 중복 호출해도 된다
        if (outcome.observedStatus() != MeetingStatus.ACTIVE) {
            meetingLifecycleService.activate(meetingId);
        }
        if (connection != null) {
            presenceBroadcaster.register(roomId, connection);
        }

        MeetingDetailResponse snapshot = storeBulkhead.call(() -> meetingReadService.getMeeting(meetingId));
        if (snapshot.status() == MeetingStatus.ENDED) {
            // 등록 직전에 방이 닫혔다면 이 연결은 closeRoom 에서 빠졌다
            if (connection != null && presenceBroadcaster.deregister(roomId, connection)) {
                connection.close();
            }
            throw new ApiException(MeetingErrorCode.MEETING_ENDED);
        }

        if (connection != null) {
            presenceBroadcaster.seedMedia(roomId, ParticipantMediaState.onEntry(
                    participant.userId(), participant.displayName(), snapshot.settings().muteOnEntry()));
        }

        // 재입장도 다시 알린다. 같은 입장 기록의 퇴장이 이미 나갔으면 broadcaster 가 버린다
        RoomEvent event = RoomEvent.of(
                RoomEventType.PARTICIPANT_JOINED,
                roomId,
                snapshot.participantCount(),
                ParticipantPresenceData.joined(participant, participant.userId().equals(snapshot.hostUserId()))
        );
        presenceBroadcaster.announceJoin(
                roomId, participant.attendanceId(), event, connection != null ? connection.id() : null);

        log.info("[MeetingAdmission] joined meetingId={} userId={} decision={} participantCount={} live={}",
                meetingId, command.userId(), outcome.decision(), snapshot.participantCount(), connection != null);
        return new JoinMeetingResponse(snapshot, roomId, snapshot.participantCount(), !firstAdmission);
    }

    @Override
    public void leave(String meetingId, String userId) {
        Meeting meeting = storeBulkhead.call(() -> meetingStore.get(meetingId))
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));

        Optional<ParticipantDeparture> departure = storeBulkhead.call(() -> meetingStore.markLeft(meetingId, userId));
        presenceBroadcaster.evict(meeting.getRoomId(), userId).ifPresent(LiveConnection::close);
        departure.ifPresent(d -> afterDeparture(meetingId, meeting.getHostUserId(), d));

        if (departure.isEmpty()) {
            log.debug("[MeetingAdmission] leave ignored meetingId={} userId={}", meetingId, userId);
        }
    }

    @Override
    public void disconnect(String meetingId, String userId, LiveConnection connection) {
        String roomId = Meeting.roomIdOf(meetingId);
        if (!presenceBroadcaster.deregister(roomId, connection)) {
            log.debug("[MeetingAdmission] stale connection closed meetingId={} userId={} connectionId={}",
                    meetingId, userId, connection.id());
            return;
        }
        // 연결은 이미 방에서 빠졌으므로 여기서 실패하면 좌석이 남는다. 일시적 실패는 다시 시도한다
        Optional<ParticipantDeparture> departure =
                storeBulkhead.callRetrying(() -> meetingStore.markLeft(meetingId, userId));
        if (departure.isEmpty()) {
            return;
        }
        String hostUserId = storeBulkhead.callRetrying(() -> meetingStore.get(meetingId))
                .map(Meeting::getHostUserId)
                .orElse(null);
        afterDeparture(meetingId, hostUserId, departure.get());
    }

    private AdmissionOutcome admit(JoinMeetingCommand command) {
        try {
            return storeBulkhead.call(() -> meetingStore.tryAddParticipant(
                    command.meetingId(), command.toCandidate(), command.roomPassword()));
        } catch (DataIntegrityViolationException e) {
            // 같은 사용자의 동시 입장: 먼저 커밋된 입장 기록을 그대로 돌려준다
            log.info("[MeetingAdmission] concurrent duplicate join meetingId={} userId={}",
                    command.meetingId(), command.userId());
            ParticipantSnapshot existing = storeBulkhead.call(
                            () -> meetingStore.findActiveParticipant(command.meetingId(), command.userId()))
                    .orElseThrow(() -> new ApiException(CommonErrorCode.SERVICE_UNAVAILABLE, "admission_conflict"));
            return AdmissionOutcome.accepted(AdmissionDecision.ALREADY_ACTIVE, null, existing, 0);
        }
    }

    private ParticipantSnapshot requireAdmitted(String meetingId, String userId, AdmissionOutcome outcome) {
        if (outcome.decision().isAdmitted()) {
            return outcome.participant();
        }
        log.info("[MeetingAdmission] rejected meetingId={} userId={} decision={} participantCount={}",
                meetingId, userId, outcome.decision(), outcome.activeCount());
        throw switch (outcome.decision()) {
            case NOT_FOUND -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND);
            case MEETING_ENDED -> new ApiException(MeetingErrorCode.MEETING_ENDED);
            case WRONG_PASSWORD -> new ApiException(MeetingErrorCode.WRONG_ROOM_PASSWORD);
            case ROOM_FULL -> new ApiException(MeetingErrorCode.MEETING_FULL, "participantCount=" + outcome.activeCount());
            default -> new IllegalStateException("unexpected admission decision: " + outcome.decision());
        };
    }

    private void afterDeparture(String meetingId, String hostUserId, ParticipantDeparture departure) {
        ParticipantSnapshot participant = departure.participant();
        RoomEvent event = RoomEvent.of(
                RoomEventType.PARTICIPANT_LEFT,
                departure.roomId(),
                departure.remainingCount(),
                ParticipantPresenceData.left(participant, participant.userId().equals(hostUserId))
        );
        presenceBroadcaster.announceLeave(departure.roomId(), participant.attendanceId(), event);
        log.info("[MeetingAdmission] left meetingId={} userId={} remaining={}",
                meetingId, participant.userId(), departure.remainingCount());

        if (departure.remainingCount() == 0) {
            meetingLifecycleService.onRoomEmpty(meetingId);
        }
    }
}
