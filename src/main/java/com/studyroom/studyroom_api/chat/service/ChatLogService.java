package com.studyroom.studyroom_api.chat.service;

import com.studyroom.studyroom_api.chat.dto.AppendedChatMessage;
import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;

import java.time.Instant;
import java.util.List;

public interface ChatLogService {

    AppendedChatMessage append(String meetingId, String senderUserId, String senderName, String body);

    /**
     * 순번 오름차순. 두 조건은 모두 선택이며 함께 주면 둘 다 만족하는 메시지만 돌려준다.
     */
    List<ChatMessageResponse> fetchSince(String meetingId, Long afterSequence, Instant since, int limit);

    /**
     * 최근 limit 건을 순번 오름차순으로.
     */
    List<ChatMessageResponse> recent(String meetingId, int limit);
}
