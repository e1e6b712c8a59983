package com.studyroom.studyroom_api.meeting.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "회의 설정 변경 요청 (호스트만 가능)")
public record UpdateMeetingSettingsRequest(
        @Schema(example = "user-1")
        @NotBlank(message = "userId는 필수입니다.")
        String userId,

        @Valid
        @NotNull(message = "settings는 필수입니다.")
        MeetingSettingsRequest settings
) {
}
