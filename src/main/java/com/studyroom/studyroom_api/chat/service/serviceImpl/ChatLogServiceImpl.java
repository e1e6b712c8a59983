package com.studyroom.studyroom_api.chat.service.serviceImpl;

import com.studyroom.studyroom_api.chat.dto.AppendedChatMessage;
import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;
import com.studyroom.studyroom_api.chat.entity.ChatMessage;
import com.studyroom.studyroom_api.chat.repository.ChatMessageRepository;
import com.studyroom.studyroom_api.chat.service.ChatLogService;
import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MessageSlot;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ChatLogServiceImpl implements ChatLogService {

    private final MeetingStore meetingStore;
    private final ChatMessageRepository chatMessageRepository;

    @Override
    @Transactional(timeout = MeetingStore.WRITE_TIMEOUT_SECONDS)
    public AppendedChatMessage append(String meetingId, String senderUserId, String senderName, String body) {
        Meeting meeting = meetingStore.get(meetingId)
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));

        MessageSlot slot = meetingStore.nextMessageSlot(meeting.getId())
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_ENDED));

        ChatMessage saved = chatMessageRepository.save(ChatMessage.builder()
                .meetingId(meetingId)
                .sequence(slot.sequence())
                .senderUserId(senderUserId)
                .senderName(senderName)
                .body(body)
                .sentAt(Instant.now())
                .build());
        return new AppendedChatMessage(ChatMessageResponse.from(saved), slot.participantCount());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessageResponse> fetchSince(String meetingId, Long afterSequence, Instant since, int limit) {
        return chatMessageRepository.findSince(
                        meetingId,
                        afterSequence != null ? afterSequence : 0L,
                        since != null ? since : Instant.EPOCH,
                        PageRequest.of(0, limit)
                ).stream()
                .map(ChatMessageResponse::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessageResponse> recent(String meetingId, int limit) {
        List<ChatMessageResponse> latestFirst = new ArrayList<>(
                chatMessageRepository.findByMeetingIdOrderBySequenceDesc(meetingId, PageRequest.of(0, limit)).stream()
                        .map(ChatMessageResponse::from)
                        .toList());
        Collections.reverse(latestFirst);
        return latestFirst;
    }
}
