package com.studyroom.studyroom_api.chat.service.serviceImpl;

import com.studyroom.studyroom_api.chat.dto.AppendedChatMessage;
import com.studyroom.studyroom_api.chat.dto.ChatHistoryResponse;
import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;
import com.studyroom.studyroom_api.chat.error.ChatErrorCode;
import com.studyroom.studyroom_api.chat.service.ChatLogService;
import com.studyroom.studyroom_api.chat.service.MeetingChatService;
import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.global.error.code.CommonErrorCode;
import com.studyroom.studyroom_api.meeting.config.MeetingProperties;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.event.MeetingEndedEvent;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import com.studyroom.studyroom_api.meeting.store.ParticipantSnapshot;
import com.studyroom.studyroom_api.presence.PresenceBroadcaster;
import com.studyroom.studyroom_api.presence.RoomEvent;
import com.studyroom.studyroom_api.presence.RoomEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 순번 발급과 실시간 전달을 회의별 락 안에서 함께 처리해,
 * 같은 방 참여자가 받는 chat-message 순서가 저장된 순번 순서와 같도록 한다.
 */
@Slf4j
@Service
public class MeetingChatServiceImpl implements MeetingChatService {

    private static final int MAX_BODY_LENGTH = 2000;
    private static final int DEFAULT_FETCH_LIMIT = 50;

    private final MeetingStore meetingStore;
    private final MeetingStoreBulkhead storeBulkhead;
    private final ChatLogService chatLogService;
    private final PresenceBroadcaster presenceBroadcaster;
    private final MeetingProperties.Chat chatProperties;

    private final ConcurrentMap<String, ReentrantLock> appendLocks = new ConcurrentHashMap<>();

    public MeetingChatServiceImpl(
            MeetingStore meetingStore,
            MeetingStoreBulkhead storeBulkhead,
            ChatLogService chatLogService,
            PresenceBroadcaster presenceBroadcaster,
            MeetingProperties meetingProperties
    ) {
        this.meetingStore = meetingStore;
        this.storeBulkhead = storeBulkhead;
        this.chatLogService = chatLogService;
        this.presenceBroadcaster = presenceBroadcaster;
        this.chatProperties = meetingProperties.chat();
    }

    @Override
    public ChatMessageResponse send(String meetingId, String userId, String body) {
        Meeting meeting = loadMeeting(meetingId);
        if (meeting.getStatus() == MeetingStatus.ENDED) {
            throw new ApiException(MeetingErrorCode.MEETING_ENDED);
        }
        if (!meeting.getSettings().isAllowChat()) {
            throw new ApiException(ChatErrorCode.CHAT_DISABLED);
        }
        String text = normalizeBody(body);

        ParticipantSnapshot sender = storeBulkhead.call(() -> meetingStore.findActiveParticipant(meetingId, userId))
                .orElseThrow(() -> new ApiException(MeetingErrorCode.NOT_ACTIVE_PARTICIPANT));

        ReentrantLock lock = appendLocks.computeIfAbsent(meetingId, key -> new ReentrantLock());
        acquire(lock, meetingId);
        try {
            AppendedChatMessage appended = storeBulkhead.call(
                    () -> chatLogService.append(meetingId, sender.userId(), sender.displayName(), text));
            ChatMessageResponse message = appended.message();
            RoomEvent event = RoomEvent.of(
                    RoomEventType.CHAT_MESSAGE,
                    meeting.getRoomId(),
                    appended.participantCount(),
                    message
            );
            presenceBroadcaster.broadcast(meeting.getRoomId(), event, null);
            log.debug("[MeetingChat] sent meetingId={} userId={} sequence={}", meetingId, userId, message.sequence());
            return message;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ChatHistoryResponse getHistory(String meetingId, Long afterSequence, Instant since, Integer limit) {
        loadMeeting(meetingId);
        int size = resolveLimit(limit);

        // 한 건 더 읽어서 다음 페이지 유무를 판단한다
        List<ChatMessageResponse> fetched = storeBulkhead.call(
                () -> chatLogService.fetchSince(meetingId, afterSequence, since, size + 1));
        boolean hasMore = fetched.size() > size;
        List<ChatMessageResponse> items = hasMore ? fetched.subList(0, size) : fetched;
        Long lastSequence = items.isEmpty() ? afterSequence : items.get(items.size() - 1).sequence();
        return new ChatHistoryResponse(meetingId, items, lastSequence, hasMore);
    }

    @Override
    public List<ChatMessageResponse> recentHistory(String meetingId) {
        return storeBulkhead.call(() -> chatLogService.recent(meetingId, chatProperties.historyOnJoin()));
    }

    @EventListener
    public void onMeetingEnded(MeetingEndedEvent event) {
        appendLocks.remove(event.meetingId());
    }

    private void acquire(ReentrantLock lock, String meetingId) {
        try {
            if (!lock.tryLock(chatProperties.appendLockWait().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[MeetingChat] append lock timeout meetingId={}", meetingId);
                throw new ApiException(CommonErrorCode.SERVICE_UNAVAILABLE, "chat_append_lock_timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(CommonErrorCode.SERVICE_UNAVAILABLE, "chat_append_interrupted");
        }
    }

    private String normalizeBody(String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            throw new ApiException(ChatErrorCode.EMPTY_MESSAGE);
        }
        if (text.length() > MAX_BODY_LENGTH) {
            throw new ApiException(ChatErrorCode.MESSAGE_TOO_LONG);
        }
        return text;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_FETCH_LIMIT;
        }
        return Math.max(1, Math.min(limit, chatProperties.maxFetchLimit()));
    }

    private Meeting loadMeeting(String meetingId) {
        return storeBulkhead.call(() -> meetingStore.get(meetingId))
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));
    }
}
