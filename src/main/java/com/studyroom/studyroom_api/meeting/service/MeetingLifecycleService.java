package com.studyroom.studyroom_api.meeting.service;

import com.studyroom.studyroom_api.meeting.dto.EndMeetingResponse;

public interface MeetingLifecycleService {

    boolean activate(String meetingId);

    EndMeetingResponse endMeeting(String meetingId, String userId);

    void onRoomEmpty(String meetingId);

    int sweepIdleMeetings();
}
