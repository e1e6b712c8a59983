package com.studyroom.studyroom_api.chat.service;

import com.studyroom.studyroom_api.chat.dto.ChatHistoryResponse;
import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;

import java.time.Instant;
import java.util.List;

public interface MeetingChatService {

    ChatMessageResponse send(String meetingId, String userId, String body);

    ChatHistoryResponse getHistory(String meetingId, Long afterSequence, Instant since, Integer limit);

    List<ChatMessageResponse> recentHistory(String meetingId);
}
