package com.studyroom.studyroom_api.chat.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "채팅 전송 요청")
public record SendChatMessageRequest(
        @Schema(example = "user-2")
        @NotBlank(message = "userId는 필수입니다.")
        String userId,

        @Schema(example = "안녕하세요")
        @NotBlank(message = "body는 필수입니다.")
        @Size(max = 2000, message = "body는 2000자 이하여야 합니다.")
        String body
) {
}
