package com.studyroom.studyroom_api.meeting.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "퇴장/종료 요청")
public record MeetingActionRequest(
        @Schema(example = "user-1")
        @NotBlank(message = "userId는 필수입니다.")
        String userId
) {
}
