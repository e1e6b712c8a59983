package com.studyroom.studyroom_api.meeting.store;

import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingParticipant;
import com.studyroom.studyroom_api.meeting.entity.MeetingSettings;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.repository.MeetingParticipantRepository;
import com.studyroom.studyroom_api.meeting.repository.MeetingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 회의 레코드의 유일한 쓰기 경로.
 * <p>
 * 참여자 수는 {@link MeetingRepository#reserveSeat} 조건부 UPDATE 로만 증가하므로
 * "조회 후 저장" 사이에 다른 입장이 끼어들어 정원을 넘기는 일이 없다.
 * 같은 회의 행을 건드리는 쓰기는 모두 회의 행 락을 먼저 잡고 참여자 행을 나중에 잡는다.
 */
@Component
@RequiredArgsConstructor
public class MeetingStore {

    public static final int WRITE_TIMEOUT_SECONDS = 3;

    private final MeetingRepository meetingRepository;
    private final MeetingParticipantRepository participantRepository;

    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public Meeting create(Meeting meeting) {
        return meetingRepository.saveAndFlush(meeting);
    }

    @Transactional(readOnly = true)
    public boolean exists(String meetingId) {
        return meetingRepository.existsByMeetingId(meetingId);
    }

    @Transactional(readOnly = true)
    public Optional<Meeting> get(String meetingId) {
        return meetingRepository.findByMeetingId(meetingId);
    }

    @Transactional(readOnly = true)
    public List<Meeting> findActive() {
        return meetingRepository.findByStatusOrderByActualStartTimeDesc(MeetingStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public Page<Meeting> findForUser(String userId, MeetingStatus status, Pageable pageable) {
        return meetingRepository.findUserMeetings(userId, status, pageable);
    }

    @Transactional(readOnly = true)
    public List<MeetingParticipant> activeParticipants(Long meetingPk) {
        return participantRepository.findActiveByMeeting(meetingPk);
    }

    @Transactional(readOnly = true)
    public Optional<ParticipantSnapshot> findActiveParticipant(String meetingId, String userId) {
        return meetingRepository.findByMeetingId(meetingId)
                .flatMap(meeting -> participantRepository.findActive(meeting.getId(), userId))
                .map(ParticipantSnapshot::from);
    }

    @Transactional(readOnly = true)
    public List<String> findIdleMeetingIds(Instant threshold) {
        return meetingRepository.findIdleMeetingIds(MeetingStatus.ACTIVE, threshold);
    }

    /**
     * 비밀번호, 상태, 정원 확인과 참여자 추가를 한 트랜잭션에서 수행한다.
     * 같은 사용자의 동시 재입장은 (meeting_id, active_key) 유니크 제약 위반으로 끝나며,
     * 이때 좌석 예약도 함께 롤백된다.
     */
    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public AdmissionOutcome tryAddParticipant(String meetingId, ParticipantCandidate candidate, String suppliedPassword) {
        Meeting meeting = meetingRepository.findByMeetingId(meetingId).orElse(null);
        if (meeting == null) {
            return AdmissionOutcome.rejected(AdmissionDecision.NOT_FOUND, null, 0);
        }

        Long meetingPk = meeting.getId();
        MeetingStatus observed = meeting.getStatus();

        // 같은 회의의 입장/퇴장을 직렬화한다. 정원 조건은 아래 reserveSeat 가 다시 확인한다.
        meetingRepository.findByIdForUpdate(meetingPk);

        if (!observed.isJoinable()) {
            return AdmissionOutcome.rejected(AdmissionDecision.MEETING_ENDED, observed, 0);
        }
        if (!passwordMatches(meeting, suppliedPassword)) {
            return AdmissionOutcome.rejected(AdmissionDecision.WRONG_PASSWORD, observed, meeting.getActiveParticipantCount());
        }

        Optional<MeetingParticipant> existing = participantRepository.findActive(meetingPk, candidate.userId());
        if (existing.isPresent()) {
            return AdmissionOutcome.accepted(
                    AdmissionDecision.ALREADY_ACTIVE,
                    observed,
                    ParticipantSnapshot.from(existing.get()),
                    meeting.getActiveParticipantCount()
            );
        }

        Instant now = Instant.now();
        int reserved = meetingRepository.reserveSeat(meetingPk, MeetingStatus.JOINABLE, now);
        if (reserved == 0) {
            // 다른 트랜잭션이 마지막 좌석을 가져갔거나 그 사이 회의가 종료됐다
            Meeting latest = meetingRepository.findById(meetingPk).orElseThrow();
            AdmissionDecision decision = latest.getStatus().isJoinable()
                    ? AdmissionDecision.ROOM_FULL
                    : AdmissionDecision.MEETING_ENDED;
            return AdmissionOutcome.rejected(decision, latest.getStatus(), latest.getActiveParticipantCount());
        }

        MeetingParticipant participant = participantRepository.saveAndFlush(MeetingParticipant.builder()
                .meeting(meetingRepository.getReferenceById(meetingPk))
                .userId(candidate.userId())
                .displayName(candidate.displayName())
                .email(candidate.email())
                .joinedAt(now)
                .build());

        return AdmissionOutcome.accepted(
                AdmissionDecision.ADMITTED,
                observed,
                ParticipantSnapshot.from(participant),
                meetingRepository.findActiveParticipantCount(meetingPk)
        );
    }

    /**
     * 입장 중인 기록에 leftAt 을 채운다. 이미 나갔거나 입장한 적 없으면 빈 값(no-op).
     */
    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public Optional<ParticipantDeparture> markLeft(String meetingId, String userId) {
        Meeting meeting = meetingRepository.findByMeetingId(meetingId).orElse(null);
        if (meeting == null) {
            return Optional.empty();
        }
        Long meetingPk = meeting.getId();
        String roomId = meeting.getRoomId();

        meetingRepository.findByIdForUpdate(meetingPk);

        MeetingParticipant active = participantRepository.findActive(meetingPk, userId).orElse(null);
        if (active == null) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        ParticipantSnapshot snapshot = ParticipantSnapshot.from(active).withLeftAt(now);

        if (participantRepository.markLeftIfActive(active.getId(), now) == 0) {
            return Optional.empty();
        }
        meetingRepository.releaseSeat(meetingPk, now);
        meetingRepository.markEmptySince(meetingPk, MeetingStatus.JOINABLE, now);

        int remaining = meetingRepository.findActiveParticipantCount(meetingPk);
        return Optional.of(new ParticipantDeparture(roomId, snapshot, remaining));
    }

    /**
     * @return 갱신됐으면 true, 경쟁에서 졌거나 조건이 맞지 않으면 false
     */
    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public boolean updateSettings(String meetingId, MeetingSettings settings) {
        Meeting meeting = meetingRepository.findByMeetingId(meetingId).orElse(null);
        if (meeting == null) {
            return false;
        }
        return meetingRepository.updateSettingsIfFits(
                meeting.getId(),
                settings.getMaxParticipants(),
                settings.isPublic(),
                settings.isRequireApproval(),
                settings.isAllowChat(),
                settings.isAllowScreenShare(),
                settings.isAllowRecording(),
                settings.isMuteOnEntry(),
                MeetingStatus.JOINABLE,
                Instant.now()
        ) == 1;
    }

    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public boolean activate(String meetingId) {
        return meetingRepository.activateIfMatch(
                meetingId, MeetingStatus.SCHEDULED, MeetingStatus.ACTIVE, Instant.now()) == 1;
    }

    /**
     * SCHEDULED/ACTIVE → ENDED. 이미 종료됐으면 빈 값.
     */
    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public Optional<FinishedMeeting> finish(String meetingId) {
        Meeting meeting = meetingRepository.findByMeetingId(meetingId).orElse(null);
        if (meeting == null) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        int changed = meetingRepository.finishIfMatch(meeting.getId(), MeetingStatus.JOINABLE, MeetingStatus.ENDED, now);
        if (changed == 0) {
            return Optional.empty();
        }
        return Optional.of(closeRoster(meeting.getId(), now));
    }

    /**
     * 참여자 0명 상태로 threshold 이전부터 비어 있던 ACTIVE 회의만 종료한다.
     */
    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public Optional<FinishedMeeting> finishIfIdle(String meetingId, Instant threshold) {
        Meeting meeting = meetingRepository.findByMeetingId(meetingId).orElse(null);
        if (meeting == null) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        int changed = meetingRepository.finishIfIdle(
                meeting.getId(), MeetingStatus.ACTIVE, MeetingStatus.ENDED, threshold, now);
        if (changed == 0) {
            return Optional.empty();
        }
        return Optional.of(closeRoster(meeting.getId(), now));
    }

    /**
     * 회의 행을 잠근 채 다음 메시지 순번을 발급한다. 호출한 트랜잭션이 롤백되면 순번도 되돌아가므로 빈 번호가 생기지 않는다.
     * 입장 인원도 잠금 이후에 읽으므로 대기 중에 바뀐 인원이 반영된다.
     *
     * @return 종료된 회의면 빈 값
     */
    @Transactional(timeout = WRITE_TIMEOUT_SECONDS)
    public Optional<MessageSlot> nextMessageSlot(Long meetingPk) {
        if (meetingRepository.incrementMessageSequence(meetingPk, MeetingStatus.JOINABLE) == 0) {
            return Optional.empty();
        }
        return Optional.of(new MessageSlot(
                meetingRepository.findLastMessageSequence(meetingPk),
                meetingRepository.findActiveParticipantCount(meetingPk)
        ));
    }

    private FinishedMeeting closeRoster(Long meetingPk, Instant now) {
        int forced = participantRepository.markAllLeft(meetingPk, now);
        Meeting ended = meetingRepository.findById(meetingPk).orElseThrow();
        ended.recordDuration();
        return new FinishedMeeting(ended.getMeetingId(), ended.getRoomId(), forced, ended.getEndedAt());
    }

    private boolean passwordMatches(Meeting meeting, String supplied) {
        if (!meeting.requiresPassword()) {
            return true;
        }
        if (supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
                meeting.getRoomPassword().getBytes(StandardCharsets.UTF_8),
                supplied.trim().getBytes(StandardCharsets.UTF_8)
        );
    }
}
