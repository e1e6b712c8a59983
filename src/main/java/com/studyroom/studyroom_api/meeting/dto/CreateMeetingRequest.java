package com.studyroom.studyroom_api.meeting.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;

@Schema(description = "회의 생성 요청")
public record CreateMeetingRequest(
        @Schema(example = "알고리즘 스터디 3주차")
        @NotBlank(message = "title은 필수입니다.")
        @Size(max = 200, message = "title은 200자 이하여야 합니다.")
        String title,

        @Size(max = 1000, message = "description은 1000자 이하여야 합니다.")
        String description,

        @Schema(example = "user-1", description = "호스트 사용자 ID")
        @NotBlank(message = "hostUserId는 필수입니다.")
        @Size(max = 128)
        String hostUserId,

        @Schema(description = "예정 시작 시각(UTC)", example = "2026-10-20T10:00:00Z")
        Instant scheduledStartTime,

        @Valid
        MeetingSettingsRequest settings,

        @Schema(description = "입장 비밀번호(4~20자, 생략 시 공개 입장)", example = "1234")
        String roomPassword
) {
}
