package com.studyroom.studyroom_api.presence.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyroom.studyroom_api.presence.LiveConnection;
import com.studyroom.studyroom_api.presence.RoomEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket 세션 하나를 감싼 연결.
 * <p>
 * send 는 직렬화한 프레임을 고정 크기 대기열에 넣기만 하고 즉시 돌아온다.
 * 실제 전송은 공용 executor 에서 연결마다 한 스레드씩만 돌며 순서대로 처리한다.
 * 대기열이 넘치면 느린 연결로 보고 남은 프레임을 버리고 세션을 닫는다.
 */
@Slf4j
public class WebSocketLiveConnection implements LiveConnection {

    private final WebSocketSession session;
    private final String userId;
    private final ObjectMapper objectMapper;
    private final Executor deliveryExecutor;
    private final BlockingQueue<String> outbound;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean sessionClosed = new AtomicBoolean(false);
    private volatile boolean closeRequested;
    private volatile boolean overflowed;

    public WebSocketLiveConnection(
            WebSocketSession session,
            String userId,
            ObjectMapper objectMapper,
            Executor deliveryExecutor,
            int queueCapacity
    ) {
        this.session = session;
        this.userId = userId;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public boolean send(RoomEvent event) {
        if (closeRequested || overflowed || !session.isOpen()) {
            return false;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[LiveConnection] serialize failed connectionId={} type={}", id(), event.type().wireName(), e);
            return false;
        }
        if (!outbound.offer(payload)) {
            overflowed = true;
            log.warn("[LiveConnection] slow consumer dropped connectionId={} userId={} queued={}",
                    id(), userId, outbound.size());
            scheduleDrain();
            return false;
        }
        scheduleDrain();
        return true;
    }

    @Override
    public void close() {
        closeRequested = true;
        scheduleDrain();
    }

    @Override
    public boolean isOpen() {
        return !closeRequested && !overflowed && session.isOpen();
    }

    int pendingFrames() {
        return outbound.size();
    }

    private void scheduleDrain() {
        if (sessionClosed.get() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("[LiveConnection] delivery rejected connectionId={}", id());
            closeSession(CloseStatus.SERVICE_OVERLOAD);
        }
    }

    private void drain() {
        try {
            String payload;
            while (!overflowed && (payload = outbound.poll()) != null) {
                session.sendMessage(new TextMessage(payload));
            }
            if (overflowed) {
                outbound.clear();
                closeSession(CloseStatus.SESSION_NOT_RELIABLE);
            } else if (closeRequested) {
                closeSession(CloseStatus.NORMAL);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[LiveConnection] send failed connectionId={} userId={} message={}", id(), userId, e.getMessage());
            outbound.clear();
            closeSession(CloseStatus.SERVER_ERROR);
        } finally {
            draining.set(false);
        }
        // 드레인이 끝나는 사이에 들어온 프레임/종료 요청을 놓치지 않도록 한 번 더 확인한다
        if (!sessionClosed.get() && (!outbound.isEmpty() || closeRequested || overflowed)) {
            scheduleDrain();
        }
    }

    private void closeSession(CloseStatus status) {
        if (!sessionClosed.compareAndSet(false, true)) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("[LiveConnection] close failed connectionId={} message={}", id(), e.getMessage());
        }
    }
}
