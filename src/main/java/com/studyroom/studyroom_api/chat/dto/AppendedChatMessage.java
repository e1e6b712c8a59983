package com.studyroom.studyroom_api.chat.dto;

/**
 * 저장된 메시지와 저장 시점의 입장 인원.
 */
public record AppendedChatMessage(ChatMessageResponse message, int participantCount) {
}
