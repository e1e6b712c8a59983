package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingMediaService;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import com.studyroom.studyroom_api.presence.LiveConnection;
import com.studyroom.studyroom_api.presence.MediaSignal;
import com.studyroom.studyroom_api.presence.ParticipantMediaState;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RoomEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingMediaServiceImpl implements MeetingMediaService {

    private final MeetingStore meetingStore;
    private final MeetingStoreBulkhead storeBulkhead;
    private final PresenceBroadcaster presenceBroadcaster;

    @Override
    public ParticipantMediaState changeMedia(String meetingId, LiveConnection sender, MediaSignal signal, boolean flag) {
        Meeting meeting = storeBulkhead.call(() -> meetingStore.get(meetingId))
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));
        if (meeting.getStatus() == MeetingStatus.ENDED) {
            throw new ApiException(MeetingErrorCode.MEETING_ENDED);
        }
        if (signal == MediaSignal.START_SCREEN_SHARE && !meeting.getSettings().isAllowScreenShare()) {
            throw new ApiException(MeetingErrorCode.SCREEN_SHARE_DISABLED);
        }

        String roomId = meeting.getRoomId();
        ParticipantMediaState changed = presenceBroadcaster.changeMedia(
                        roomId,
                        sender,
                        state -> signal.apply(state, flag),
                        state -> RoomEvent.of(signal.eventType(), roomId, meeting.getActiveParticipantCount(), state)
                )
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_JOINED));

        log.debug("[MeetingMedia] meetingId={} userId={} signal={}", meetingId, sender.userId(), signal.frameType());
        return changed;
    }

    @Override
    public List<ParticipantMediaState> roomMedia(String meetingId) {
        return presenceBroadcaster.mediaStates(Meeting.roomIdOf(meetingId));
    }
}
