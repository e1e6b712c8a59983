package com.studyroom.studyroom_api.chat.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "채팅 이력")
public record ChatHistoryResponse(
        String meetingId,
        List<ChatMessageResponse> items,
        @Schema(description = "다음 조회 시 afterSequence 로 넘길 값") Long lastSequence,
        boolean hasMore
) {
}
