package com.studyroom.studyroom_api.meeting.dto;

import java.util.List;

public record UserMeetingsResponse(
        List<MeetingSummary> items,
        int page,
        int size,
        long totalItems,
        int totalPages,
        boolean hasNext
) {
}
