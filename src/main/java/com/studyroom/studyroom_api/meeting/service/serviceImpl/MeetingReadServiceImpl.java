package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.dto.ActiveMeetingsResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingDetailResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingJoinInfoResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingSummary;
import com.studyroom.studyroom_api.meeting.dto.UserMeetingsResponse;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RoomStats;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MeetingReadServiceImpl implements MeetingReadService {

    private final MeetingStore meetingStore;
    private final PresenceBroadcaster presenceBroadcaster;

    @Override
    public MeetingDetailResponse getMeeting(String meetingId) {
        Meeting meeting = loadMeeting(meetingId);
        return MeetingDetailResponse.of(meeting, meetingStore.activeParticipants(meeting.getId()));
    }

    @Override
    public MeetingJoinInfoResponse getJoinInfo(String meetingId) {
        return MeetingJoinInfoResponse.from(loadMeeting(meetingId));
    }

    @Override
    public UserMeetingsResponse getUserMeetings(String userId, MeetingStatus status, int page, int size) {
        Page<Meeting> result = meetingStore.findForUser(userId, status, PageRequest.of(page, size));
        List<MeetingSummary> items = result.getContent().stream()
                .map(MeetingSummary::from)
                .toList();
        return new UserMeetingsResponse(
                items,
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages(),
                result.hasNext()
        );
    }

    @Override
    public ActiveMeetingsResponse getActiveMeetings() {
        List<MeetingSummary> items = meetingStore.findActive().stream()
                .map(MeetingSummary::from)
                .toList();
        return new ActiveMeetingsResponse(items, items.size());
    }

    @Override
    public RoomStats getRoomStats() {
        return presenceBroadcaster.roomStats();
    }

    private Meeting loadMeeting(String meetingId) {
        return meetingStore.get(meetingId)
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));
    }
}
