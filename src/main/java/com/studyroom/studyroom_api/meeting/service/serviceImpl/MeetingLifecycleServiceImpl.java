package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.config.MeetingProperties;
import com.studyroom.studyroom_api.meeting.dto.EndMeetingResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingEndedData;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.event.MeetingEndedEvent;
import com.studyroom.studyroom_api.meeting.service.MeetingLifecycleService;
import com.studyroom.studyroom_api.meeting.store.FinishedMeeting;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RoomEvent;
import com.studyroom.studyroom_api.presence.RoomEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 상태 전이는 모두 MeetingStore 의 조건부 UPDATE 로 일어나므로
 * 동시에 여러 곳에서 종료를 시도해도 한 번만 성공하고, 성공한 쪽만 방을 닫는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingLifecycleServiceImpl implements MeetingLifecycleService {

    private static final String REASON_HOST = "host";
    private static final String REASON_EMPTY = "empty";
    private static final String REASON_IDLE = "idle";

    private final MeetingStore meetingStore;
    private final MeetingStoreBulkhead storeBulkhead;
    private final PresenceBroadcaster presenceBroadcaster;
    private final ApplicationEventPublisher eventPublisher;
    private final MeetingProperties meetingProperties;

    @Override
    public boolean activate(String meetingId) {
        boolean activated = storeBulkhead.call(() -> meetingStore.activate(meetingId));
        if (activated) {
            log.info("[MeetingLifecycle] activated meetingId={}", meetingId);
        }
        return activated;
    }

    @Override
    public EndMeetingResponse endMeeting(String meetingId, String userId) {
        Meeting meeting = loadMeeting(meetingId);
        if (!meeting.isHost(userId)) {
            throw new ApiException(MeetingErrorCode.ONLY_HOST_ALLOWED);
        }
        if (meeting.getStatus() == MeetingStatus.ENDED) {
            return EndMeetingResponse.of(meeting, true);
        }

        Optional<FinishedMeeting> finished = storeBulkhead.call(() -> meetingStore.finish(meetingId));
        finished.ifPresent(f -> closeRoom(f, REASON_HOST));

        return EndMeetingResponse.of(loadMeeting(meetingId), finished.isEmpty());
    }

    @Override
    public void onRoomEmpty(String meetingId) {
        if (!meetingProperties.lifecycle().endWhenEmpty()) {
            log.debug("[MeetingLifecycle] room empty, left to idle sweep meetingId={}", meetingId);
            return;
        }
        // 그 사이 누가 다시 들어왔으면 조건이 맞지 않아 아무 일도 일어나지 않는다
        Instant now = Instant.now();
        storeBulkhead.call(() -> meetingStore.finishIfIdle(meetingId, now))
                .ifPresent(f -> closeRoom(f, REASON_EMPTY));
    }

    @Override
    public int sweepIdleMeetings() {
        Instant threshold = Instant.now().minus(meetingProperties.lifecycle().idleGracePeriod());
        List<String> candidates = storeBulkhead.call(() -> meetingStore.findIdleMeetingIds(threshold));

        int ended = 0;
        for (String meetingId : candidates) {
            try {
                Optional<FinishedMeeting> finished = storeBulkhead.call(() -> meetingStore.finishIfIdle(meetingId, threshold));
                if (finished.isPresent()) {
                    closeRoom(finished.get(), REASON_IDLE);
                    ended++;
                }
            } catch (ApiException e) {
                // 다음 주기에 다시 시도된다
                log.warn("[MeetingLifecycle] idle sweep skipped meetingId={} code={}",
                        meetingId, e.getErrorCode().getCode());
            }
        }
        if (ended > 0) {
            log.info("[MeetingLifecycle] idle sweep ended={} candidates={}", ended, candidates.size());
        }
        return ended;
    }

    private void closeRoom(FinishedMeeting finished, String reason) {
        RoomEvent event = RoomEvent.of(
                RoomEventType.MEETING_ENDED,
                finished.roomId(),
                0,
                new MeetingEndedData(finished.meetingId(), reason, finished.endedAt())
        );
        int closed = presenceBroadcaster.closeRoom(finished.roomId(), event);
        eventPublisher.publishEvent(new MeetingEndedEvent(finished.meetingId(), finished.roomId(), finished.endedAt()));
        log.info("[MeetingLifecycle] ended meetingId={} reason={} forcedDepartures={} closedConnections={}",
                finished.meetingId(), reason, finished.forcedDepartures(), closed);
    }

    private Meeting loadMeeting(String meetingId) {
        return storeBulkhead.call(() -> meetingStore.get(meetingId))
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));
    }
}
