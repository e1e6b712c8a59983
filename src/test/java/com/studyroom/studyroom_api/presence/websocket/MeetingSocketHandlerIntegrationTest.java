package com.studyroom.studyroom_api.presence.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studyroom.studyroom_api.StudyroomApiApplication;
import com.studyroom.studyroom_api.meeting.dto.CreateMeetingRequest;
import com.studyroom.studyroom_api.meeting.dto.MeetingSettingsRequest;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.service.MeetingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

// 통합 테스트: 실제 포트로 서버를 띄우고 WebSocket 클라이언트로 프레임을 주고받는다.
@SpringBootTest(
        classes = StudyroomApiApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "spring.datasource.url=jdbc:h2:mem:studyroom_ws;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000"
)
class MeetingSocketHandlerIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private MeetingService meetingService;

    @Autowired
    private MeetingReadService meetingReadService;

    @Autowired
    private ObjectMapper objectMapper;

    private final List<WebSocketSession> sessions = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    @Test
    void joinChatAndLeaveOverWebSocket() throws Exception {
        // given
        String meetingId = createMeeting();
        Client alice = connect();
        Client bob = connect();

        // when: 두 사람이 입장
        alice.send(joinFrame(meetingId, "user-a"));
        JsonNode aliceJoined = alice.next("joined");
        assertThat(aliceJoined.at("/participantCount").asInt()).isEqualTo(1);
        assertThat(aliceJoined.at("/data/join/roomId").asText()).isEqualTo("room_" + meetingId);

        bob.send(joinFrame(meetingId, "user-b"));
        bob.next("joined");
        JsonNode joinedEvent = alice.next("participant-joined");
        assertThat(joinedEvent.at("/data/userId").asText()).isEqualTo("user-b");
        assertThat(joinedEvent.at("/participantCount").asInt()).isEqualTo(2);

        // when: 채팅
        bob.send(frame("type", "chat", "body", "hi all"));
        assertThat(alice.next("chat-message").at("/data/body").asText()).isEqualTo("hi all");
        assertThat(bob.next("chat-message").at("/data/sequence").asLong()).isEqualTo(1L);

        // when: bob 의 소켓이 끊긴다
        bob.session.close(CloseStatus.NORMAL);

        // then
        JsonNode leftEvent = alice.next("participant-left");
        assertThat(leftEvent.at("/data/userId").asText()).isEqualTo("user-b");
        assertThat(leftEvent.at("/participantCount").asInt()).isEqualTo(1);
        assertThat(meetingReadService.getMeeting(meetingId).participantCount()).isEqualTo(1);
    }

    @Test
    void lateJoinerReceivesRecentHistory() throws Exception {
        String meetingId = createMeeting();
        Client alice = connect();
        alice.send(joinFrame(meetingId, "user-a"));
        alice.next("joined");
        alice.send(frame("type", "chat", "body", "first"));
        alice.next("chat-message");

        Client bob = connect();
        bob.send(joinFrame(meetingId, "user-b"));
        JsonNode joined = bob.next("joined");

        assertThat(joined.at("/data/recentMessages/0/body").asText()).isEqualTo("first");
    }

    @Test
    void framesBeforeJoinAndUnknownFramesGetErrors() throws Exception {
        Client client = connect();

        client.send(frame("type", "chat", "body", "too early"));
        assertThat(client.next("error").at("/data/code").asText()).isEqualTo("MEETING_NOT_JOINED");

        client.send(frame("type", "dance"));
        assertThat(client.next("error").at("/data/code").asText()).isEqualTo("UNKNOWN_FRAME_TYPE");

        client.send("{not json");
        assertThat(client.next("error").at("/data/code").asText()).isEqualTo("INVALID_JSON");

        client.send(frame("type", "join", "meetingId", "zzzzzzzzzz", "userId", "user-a", "displayName", "A"));
        assertThat(client.next("error").at("/data/code").asText()).isEqualTo("MEETING_NOT_FOUND");

        client.send(frame("type", "ping"));
        client.next("pong");
        assertThat(client.session.isOpen()).isTrue();
    }

    @Test
    void leaveFrameKeepsSocketOpen() throws Exception {
        String meetingId = createMeeting();
        Client client = connect();
        client.send(joinFrame(meetingId, "user-a"));
        client.next("joined");

        client.send(frame("type", "leave"));
        client.send(frame("type", "chat", "body", "after leave"));

        assertThat(client.next("error").at("/data/code").asText()).isEqualTo("MEETING_NOT_JOINED");
        assertThat(meetingReadService.getMeeting(meetingId).participantCount()).isZero();
    }

    @Test
    void mediaSignalsAreRelayedToOthersButNotToSender() throws Exception {
        // given
        String meetingId = createMeeting();
        Client alice = connect();
        Client bob = connect();
        alice.send(joinFrame(meetingId, "user-a"));
        alice.next("joined");
        bob.send(joinFrame(meetingId, "user-b"));
        bob.next("joined");
        alice.next("participant-joined");

        // when: alice 가 음소거 후 손을 든다
        alice.send(frame("type", "mute-audio", "isMuted", true));
        alice.send(frame("type", "hand-raise", "isRaised", true));
        alice.send(frame("type", "ping"));

        // then: bob 은 누적된 상태를 받는다
        JsonNode audio = bob.next("participant-audio-changed");
        assertThat(audio.at("/data/userId").asText()).isEqualTo("user-a");
        assertThat(audio.at("/data/isAudioMuted").asBoolean()).isTrue();
        assertThat(audio.at("/participantCount").asInt()).isEqualTo(2);
        JsonNode hand = bob.next("participant-hand-raised");
        assertThat(hand.at("/data/displayName").asText()).isEqualTo("name-user-a");
        assertThat(hand.at("/data/isHandRaised").asBoolean()).isTrue();
        assertThat(hand.at("/data/isAudioMuted").asBoolean()).isTrue();

        // 보낸 사람에게는 되돌아오지 않는다
        assertThat(alice.nextAny().path("type").asText()).isEqualTo("pong");

        // when: bob 이 비디오를 끄고 화면 공유를 시작했다가 멈춘다
        bob.send(frame("type", "mute-video", "isMuted", true));
        bob.send(frame("type", "start-screen-share"));
        bob.send(frame("type", "stop-screen-share"));

        // then
        assertThat(alice.next("participant-video-changed").at("/data/isVideoMuted").asBoolean()).isTrue();
        assertThat(alice.next("participant-screen-share-started").at("/data/isScreenSharing").asBoolean()).isTrue();
        JsonNode stopped = alice.next("participant-screen-share-stopped");
        assertThat(stopped.at("/data/userId").asText()).isEqualTo("user-b");
        assertThat(stopped.at("/data/isScreenSharing").asBoolean()).isFalse();
    }

    @Test
    void screenShareIsRejectedWhenMeetingDisallowsIt() throws Exception {
        // given: 화면 공유를 막은 회의
        String meetingId = createMeeting(new MeetingSettingsRequest(4, null, null, null, false, null, null));
        Client alice = connect();
        Client bob = connect();
        alice.send(joinFrame(meetingId, "user-a"));
        alice.next("joined");
        bob.send(joinFrame(meetingId, "user-b"));
        bob.next("joined");

        // when
        alice.send(frame("type", "start-screen-share"));

        // then
        assertThat(alice.next("error").at("/data/code").asText()).isEqualTo("SCREEN_SHARE_DISABLED");
        bob.send(frame("type", "ping"));
        assertThat(bob.nextAny().path("type").asText()).isEqualTo("pong");
    }

    @Test
    void joinedReplyCarriesMuteOnEntryState() throws Exception {
        // given: 입장 시 음소거 회의
        String meetingId = createMeeting(new MeetingSettingsRequest(4, null, null, null, null, null, true));
        Client alice = connect();
        Client bob = connect();

        // when
        alice.send(joinFrame(meetingId, "user-a"));
        JsonNode aliceJoined = alice.next("joined");
        bob.send(joinFrame(meetingId, "user-b"));
        JsonNode bobJoined = bob.next("joined");

        // then
        assertThat(aliceJoined.at("/data/mediaState/userId").asText()).isEqualTo("user-a");
        assertThat(aliceJoined.at("/data/mediaState/isAudioMuted").asBoolean()).isTrue();
        assertThat(aliceJoined.at("/data/mediaState/isVideoMuted").asBoolean()).isFalse();
        JsonNode participantMedia = bobJoined.at("/data/participantMedia");
        assertThat(participantMedia).hasSize(2);
        assertThat(participantMedia.get(0).path("userId").asText()).isEqualTo("user-a");
        assertThat(participantMedia.get(1).path("isAudioMuted").asBoolean()).isTrue();
    }

    @Test
    void mediaFramesNeedJoinAndFlag() throws Exception {
        Client client = connect();

        client.send(frame("type", "mute-audio", "isMuted", true));
        assertThat(client.next("error").at("/data/code").asText()).isEqualTo("MEETING_NOT_JOINED");

        String meetingId = createMeeting();
        client.send(joinFrame(meetingId, "user-a"));
        client.next("joined");

        client.send(frame("type", "hand-raise"));
        JsonNode error = client.next("error");
        assertThat(error.at("/data/code").asText()).isEqualTo("VALIDATION_FAILED");
        assertThat(error.at("/data/errors/0/field").asText()).isEqualTo("isRaised");
    }

    private String createMeeting() {
        return createMeeting(new MeetingSettingsRequest(4, null, null, null, null, null, null));
    }

    private String createMeeting(MeetingSettingsRequest settings) {
        return meetingService.createMeeting(new CreateMeetingRequest(
                "소켓 스터디", null, "user-a", null, settings, null)).meetingId();
    }

    private String joinFrame(String meetingId, String userId) throws Exception {
        return frame("type", "join", "meetingId", meetingId, "userId", userId, "displayName", "name-" + userId);
    }

    private String frame(Object... keyValues) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            body.put((String) keyValues[i], keyValues[i + 1]);
        }
        return objectMapper.writeValueAsString(body);
    }

    private Client connect() throws Exception {
        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        WebSocketSession session = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                        inbox.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/ws/meetings")
                .get(5, TimeUnit.SECONDS);
        sessions.add(session);
        return new Client(session, inbox);
    }

    private final class Client {

        private final WebSocketSession session;
        private final BlockingQueue<String> inbox;

        private Client(WebSocketSession session, BlockingQueue<String> inbox) {
            this.session = session;
            this.inbox = inbox;
        }

        void send(String payload) throws Exception {
            session.sendMessage(new TextMessage(payload));
        }

        // 원하는 type 이 올 때까지 다른 이벤트는 건너뛴다
        JsonNode next(String type) throws Exception {
            long deadline = System.currentTimeMillis() + 5000;
            while (System.currentTimeMillis() < deadline) {
                String payload = inbox.poll(deadline - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
                if (payload == null) {
                    break;
                }
                JsonNode node = objectMapper.readTree(payload);
                if (type.equals(node.path("type").asText())) {
                    return node;
                }
            }
            return fail("no '" + type + "' frame within 5s");
        }

        JsonNode nextAny() throws Exception {
            String payload = inbox.poll(5, TimeUnit.SECONDS);
            if (payload == null) {
                return fail("no frame within 5s");
            }
            return objectMapper.readTree(payload);
        }
    }
}
