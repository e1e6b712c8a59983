package com.studyroom.studyroom_api.presence.websocket;

import org.springframework.web.socket.WebSocketSession;

/**
 * 세션 하나의 입장 상태. 한 세션의 콜백은 컨테이너가 순서대로 호출하므로 별도 동기화는 하지 않는다.
 */
final class SocketSessionState {

    static final String ATTRIBUTE = SocketSessionState.class.getName();

    private final WebSocketSession outbound;
    private String meetingId;
    private String userId;
    private WebSocketLiveConnection connection;

    SocketSessionState(WebSocketSession outbound) {
        this.outbound = outbound;
    }

    WebSocketSession outbound() {
        return outbound;
    }

    boolean isJoined() {
        return meetingId != null;
    }

    boolean isJoinedAs(String meetingId, String userId) {
        return meetingId.equals(this.meetingId) && userId.equals(this.userId);
    }

    String meetingId() {
        return meetingId;
    }

    String userId() {
        return userId;
    }

    WebSocketLiveConnection connection() {
        return connection;
    }

    void bind(String meetingId, String userId, WebSocketLiveConnection connection) {
        this.meetingId = meetingId;
        this.userId = userId;
        this.connection = connection;
    }

    void clear() {
        this.meetingId = null;
        this.userId = null;
        this.connection = null;
    }
}
