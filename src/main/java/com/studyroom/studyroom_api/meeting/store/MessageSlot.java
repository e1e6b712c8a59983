package com.studyroom.studyroom_api.meeting.store;

/**
 * 채팅 순번 발급 결과. participantCount 는 순번을 올린 같은 트랜잭션 안에서 읽은 값이다.
 */
public record MessageSlot(long sequence, int participantCount) {
}
