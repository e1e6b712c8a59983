package com.studyroom.studyroom_api.meeting.service;

import com.studyroom.studyroom_api.meeting.dto.ActiveMeetingsResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingDetailResponse;
import com.studyroom.studyroom_api.meeting.dto.MeetingJoinInfoResponse;
import com.studyroom.studyroom_api.meeting.dto.UserMeetingsResponse;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.presence.RoomStats;

public interface MeetingReadService {

    MeetingDetailResponse getMeeting(String meetingId);

    MeetingJoinInfoResponse getJoinInfo(String meetingId);

    UserMeetingsResponse getUserMeetings(String userId, MeetingStatus status, int page, int size);

    ActiveMeetingsResponse getActiveMeetings();

    RoomStats getRoomStats();
}
