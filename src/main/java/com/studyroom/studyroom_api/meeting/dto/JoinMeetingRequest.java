package com.studyroom.studyroom_api.meeting.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "회의 입장 요청")
public record JoinMeetingRequest(
        @Schema(example = "user-2")
        @NotBlank(message = "userId는 필수입니다.")
        @Size(max = 128)
        String userId,

        @Schema(example = "김철수")
        @NotBlank(message = "displayName은 필수입니다.")
        @Size(max = 100, message = "displayName은 100자 이하여야 합니다.")
        String displayName,

        @Email(message = "email 형식이 올바르지 않습니다.")
        @Size(max = 320)
        String email,

        @Schema(example = "1234")
        String roomPassword
) {
}
