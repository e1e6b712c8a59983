package com.studyroom.studyroom_api.meeting.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "회의 입장 결과")
public record JoinMeetingResponse(
        MeetingDetailResponse meeting,
        @Schema(example = "room_7hk3m9pqrt") String roomId,
        int participantCount,
        @Schema(description = "이미 입장 중이던 세션을 그대로 돌려준 경우 true") boolean alreadyActive
) {
}
