package com.studyroom.studyroom_api.presence.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;
import com.studyroom.studyroom_api.chat.service.MeetingChatService;
import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.global.error.api.ErrorResponse;
import com.studyroom.studyroom_api.global.error.api.FieldErrorData;
import com.studyroom.studyroom_api.global.error.code.CommonErrorCode;
import com.studyroom.studyroom_api.global.error.code.ErrorCode;
import com.studyroom.studyroom_api.meeting.config.MeetingProperties;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingCommand;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingResponse;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingAdmissionService;
import com.studyroom.studyroom_api.meeting.service.MeetingMediaService;
import com.studyroom.studyroom_api.presence.MediaSignal;
import com.studyroom.studyroom_api.presence.ParticipantMediaState;
import com.studyroom.studyroom_api.presence.RoomEvent;
import com.studyroom.studyroom_api.presence.RoomEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * /ws/meetings 실시간 채널.
 * <p>
 * 입장 전에는 세션에 직접 응답하고, 입장 후에는 모든 프레임이 연결의 송신 대기열을 거친다.
 * 소켓이 닫히면 그 연결이 아직 현재 연결일 때만 퇴장 처리한다.
 */
@Slf4j
@Component
public class MeetingSocketHandler extends TextWebSocketHandler {

    private final MeetingAdmissionService meetingAdmissionService;
    private final MeetingChatService meetingChatService;
    private final MeetingMediaService meetingMediaService;
    private final ObjectMapper objectMapper;
    private final Executor deliveryExecutor;
    private final MeetingProperties.Presence presenceProperties;

    public MeetingSocketHandler(
            MeetingAdmissionService meetingAdmissionService,
            MeetingChatService meetingChatService,
            MeetingMediaService meetingMediaService,
            ObjectMapper objectMapper,
            @Qualifier("presenceDeliveryExecutor") Executor deliveryExecutor,
            MeetingProperties meetingProperties
    ) {
        this.meetingAdmissionService = meetingAdmissionService;
        this.meetingChatService = meetingChatService;
        this.meetingMediaService = meetingMediaService;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
        this.presenceProperties = meetingProperties.presence();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) presenceProperties.sendTimeLimit().toMillis(),
                presenceProperties.sendBufferSizeLimit()
        );
        session.getAttributes().put(SocketSessionState.ATTRIBUTE, new SocketSessionState(outbound));
        log.debug("[MeetingSocket] connected sessionId={}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SocketSessionState state = state(session);

        ClientFrame frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), ClientFrame.class);
        } catch (JsonProcessingException e) {
            replyError(state, new ApiException(CommonErrorCode.INVALID_JSON));
            return;
        }

        String type = frame.type() == null ? "" : frame.type();
        try {
            switch (type) {
                case ClientFrame.JOIN -> handleJoin(state, frame);
                case ClientFrame.CHAT -> handleChat(state, frame);
                case ClientFrame.PING -> reply(state, RoomEvent.of(RoomEventType.PONG, roomIdOf(state), 0, null));
                case ClientFrame.LEAVE -> handleLeave(state);
                case ClientFrame.MUTE_AUDIO, ClientFrame.MUTE_VIDEO, ClientFrame.HAND_RAISE,
                        ClientFrame.START_SCREEN_SHARE, ClientFrame.STOP_SCREEN_SHARE ->
                        handleMedia(state, frame, MediaSignal.fromFrameType(type));
                default -> throw new ApiException(CommonErrorCode.UNKNOWN_FRAME_TYPE, "type=" + type);
            }
        } catch (ApiException e) {
            replyError(state, e);
        } catch (RuntimeException e) {
            log.error("[MeetingSocket] frame failed sessionId={} type={}", session.getId(), type, e);
            replyError(state, new ApiException(CommonErrorCode.INTERNAL_SERVER_ERROR));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("[MeetingSocket] transport error sessionId={} message={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SocketSessionState state = (SocketSessionState) session.getAttributes().get(SocketSessionState.ATTRIBUTE);
        if (state == null || !state.isJoined()) {
            return;
        }
        try {
            meetingAdmissionService.disconnect(state.meetingId(), state.userId(), state.connection());
        } catch (ApiException e) {
            // 재시도까지 실패하면 참여 기록이 남는다. 같은 사용자의 재입장 뒤 퇴장이나 회의 종료 때 정리된다
            log.warn("[MeetingSocket] disconnect failed meetingId={} userId={} code={}",
                    state.meetingId(), state.userId(), e.getErrorCode().getCode());
        } finally {
            state.clear();
        }
        log.debug("[MeetingSocket] closed sessionId={} status={}", session.getId(), status.getCode());
    }

    private void handleJoin(SocketSessionState state, ClientFrame frame) {
        validateJoinFrame(frame);
        String meetingId = frame.meetingId().trim();
        String userId = frame.userId().trim();

        WebSocketLiveConnection connection;
        if (state.isJoined() && state.isJoinedAs(meetingId, userId)) {
            connection = state.connection();
        } else {
            if (state.isJoined()) {
                // 다른 회의나 다른 사용자로 다시 입장하면 기존 입장은 먼저 정리한다
                meetingAdmissionService.disconnect(state.meetingId(), state.userId(), state.connection());
                state.clear();
            }
            connection = new WebSocketLiveConnection(
                    state.outbound(), userId, objectMapper, deliveryExecutor, presenceProperties.outboundQueueCapacity());
        }

        JoinMeetingResponse response = meetingAdmissionService.join(
                new JoinMeetingCommand(meetingId, userId, frame.displayName(), frame.email(), frame.roomPassword()),
                connection
        );
        state.bind(meetingId, userId, connection);

        List<ChatMessageResponse> history = meetingChatService.recentHistory(meetingId);
        List<ParticipantMediaState> participantMedia = meetingMediaService.roomMedia(meetingId);
        ParticipantMediaState own = participantMedia.stream()
                .filter(media -> media.userId().equals(userId))
                .findFirst()
                .orElse(null);
        connection.send(RoomEvent.of(
                RoomEventType.JOINED,
                response.roomId(),
                response.participantCount(),
                new JoinedReply(response, history, own, participantMedia)
        ));
    }

    private void handleMedia(SocketSessionState state, ClientFrame frame, MediaSignal signal) {
        requireJoined(state);
        Boolean flag = switch (signal) {
            case MUTE_AUDIO, MUTE_VIDEO -> requireFlag(frame.isMuted(), "isMuted");
            case HAND_RAISE -> requireFlag(frame.isRaised(), "isRaised");
            case START_SCREEN_SHARE, STOP_SCREEN_SHARE -> Boolean.TRUE;
        };
        meetingMediaService.changeMedia(state.meetingId(), state.connection(), signal, flag);
    }

    private Boolean requireFlag(Boolean value, String field) {
        if (value == null) {
            throw new ApiException(CommonErrorCode.VALIDATION_FAILED,
                    List.of(new FieldErrorData(field, "필수값입니다.")), null);
        }
        return value;
    }

    private void handleChat(SocketSessionState state, ClientFrame frame) {
        requireJoined(state);
        meetingChatService.send(state.meetingId(), state.userId(), frame.body());
    }

    private void handleLeave(SocketSessionState state) {
        requireJoined(state);
        // 소켓은 유지하고 방에서만 나간다
        meetingAdmissionService.disconnect(state.meetingId(), state.userId(), state.connection());
        state.clear();
    }

    private void validateJoinFrame(ClientFrame frame) {
        List<FieldErrorData> errors = new ArrayList<>();
        if (isBlank(frame.meetingId())) {
            errors.add(new FieldErrorData("meetingId", "필수값입니다."));
        }
        if (isBlank(frame.userId())) {
            errors.add(new FieldErrorData("userId", "필수값입니다."));
        }
        if (isBlank(frame.displayName())) {
            errors.add(new FieldErrorData("displayName", "필수값입니다."));
        } else if (frame.displayName().trim().length() > 100) {
            errors.add(new FieldErrorData("displayName", "100자 이하여야 합니다."));
        }
        if (!errors.isEmpty()) {
            throw new ApiException(CommonErrorCode.VALIDATION_FAILED, errors, null);
        }
    }

    private void requireJoined(SocketSessionState state) {
        if (!state.isJoined()) {
            throw new ApiException(MeetingErrorCode.MEETING_NOT_JOINED);
        }
    }

    private void replyError(SocketSessionState state, ApiException e) {
        ErrorCode ec = e.getErrorCode();
        if (ec.getStatus().is5xxServerError()) {
            log.warn("[MeetingSocket] error reply code={} data={}", ec.getCode(), e.getData());
        }
        reply(state, RoomEvent.of(RoomEventType.ERROR, roomIdOf(state), 0, ErrorResponse.of(e)));
    }

    private void reply(SocketSessionState state, RoomEvent event) {
        WebSocketLiveConnection connection = state.connection();
        if (connection != null && connection.isOpen()) {
            connection.send(event);
            return;
        }
        // 입장 전: 송신 대기열이 없으므로 세션에 바로 쓴다
        try {
            state.outbound().sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        } catch (IOException | IllegalStateException e) {
            log.warn("[MeetingSocket] direct reply failed sessionId={} message={}", state.outbound().getId(), e.getMessage());
        }
    }

    private SocketSessionState state(WebSocketSession session) {
        return (SocketSessionState) session.getAttributes().get(SocketSessionState.ATTRIBUTE);
    }

    private String roomIdOf(SocketSessionState state) {
        return state.isJoined() ? Meeting.roomIdOf(state.meetingId()) : null;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
