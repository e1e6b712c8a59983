package com.studyroom.studyroom_api.meeting.dto;

import java.util.List;

public record ActiveMeetingsResponse(List<MeetingSummary> items, int count) {
}
