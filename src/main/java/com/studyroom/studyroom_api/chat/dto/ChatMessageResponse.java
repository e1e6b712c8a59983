package com.studyroom.studyroom_api.chat.dto;

import com.studyroom.studyroom_api.chat.entity.ChatMessage;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "채팅 메시지")
public record ChatMessageResponse(
        @Schema(example = "7hk3m9pqrt") String meetingId,
        @Schema(example = "12", description = "회의별 순번") long sequence,
        String senderUserId,
        String senderName,
        String body,
        Instant sentAt
) {

    public static ChatMessageResponse from(ChatMessage message) {
        return new ChatMessageResponse(
                message.getMeetingId(),
                message.getSequence(),
                message.getSenderUserId(),
                message.getSenderName(),
                message.getBody(),
                message.getSentAt()
        );
    }
}
