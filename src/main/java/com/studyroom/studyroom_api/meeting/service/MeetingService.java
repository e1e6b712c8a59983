package com.studyroom.studyroom_api.meeting.service;

import com.studyroom.studyroom_api.meeting.dto.CreateMeetingRequest;
import com.studyroom.studyroom_api.meeting.dto.MeetingDetailResponse;
import com.studyroom.studyroom_api.meeting.dto.UpdateMeetingSettingsRequest;

public interface MeetingService {

    MeetingDetailResponse createMeeting(CreateMeetingRequest request);

    MeetingDetailResponse updateSettings(String meetingId, UpdateMeetingSettingsRequest request);
}
