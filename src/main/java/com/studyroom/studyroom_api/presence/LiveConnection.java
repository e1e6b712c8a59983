package com.studyroom.studyroom_api.presence;

/**
 * 한 참여자의 실시간 연결.
 * {@link #send} 는 호출 스레드를 막지 않아야 하며, 연결 종료 콜백을 같은 스레드에서 부르지 않아야 한다.
 */
public interface LiveConnection {

    String id();

    String userId();

    /**
     * @return 대기열에 들어갔으면 true. 느린 연결로 판단돼 버려졌거나 이미 닫혔으면 false.
     */
    boolean send(RoomEvent event);

    /**
     * 이미 넣어 둔 이벤트를 모두 보낸 뒤 연결을 닫는다.
     */
    void close();

    boolean isOpen();
}
