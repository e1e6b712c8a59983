package com.studyroom.studyroom_api.meeting.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "meeting")
public record MeetingProperties(
	Allocation allocation,
	Lifecycle lifecycle,
	Presence presence,
	Chat chat
) {

	public MeetingProperties {
		allocation = allocation != null ? allocation : new Allocation(0, 0);
		lifecycle = lifecycle != null ? lifecycle : new Lifecycle(false, null, null);
		presence = presence != null ? presence : new Presence(0, null, 0);
		chat = chat != null ? chat : new Chat(0, 0, null);
	}

	/**
	 * @param idLength    meetingId 길이
	 * @param maxAttempts 충돌 시 재시도 상한
	 */
	public record Allocation(int idLength, int maxAttempts) {
		public Allocation {
			idLength = idLength > 0 ? idLength : 10;
			maxAttempts = maxAttempts > 0 ? maxAttempts : 5;
		}
	}

	/**
	 * @param endWhenEmpty      마지막 참여자가 나가면 바로 종료할지 여부(false 면 유휴 스윕에 맡긴다)
	 * @param idleGracePeriod   참여자 0명 상태를 허용하는 시간
	 * @param idleSweepInterval 유휴 스윕 주기
	 */
	public record Lifecycle(boolean endWhenEmpty, Duration idleGracePeriod, Duration idleSweepInterval) {
		public Lifecycle {
			idleGracePeriod = idleGracePeriod != null ? idleGracePeriod : Duration.ofMinutes(5);
			idleSweepInterval = idleSweepInterval != null ? idleSweepInterval : Duration.ofSeconds(30);
		}
	}

	/**
	 * @param outboundQueueCapacity 연결별 송신 대기열 크기. 넘치면 느린 연결로 보고 끊는다.
	 * @param sendTimeLimit         소켓 한 번 쓰기에 허용하는 시간
	 * @param sendBufferSizeLimit   소켓 버퍼 상한(byte)
	 */
	public record Presence(int outboundQueueCapacity, Duration sendTimeLimit, int sendBufferSizeLimit) {
		public Presence {
			outboundQueueCapacity = outboundQueueCapacity > 0 ? outboundQueueCapacity : 64;
			sendTimeLimit = sendTimeLimit != null ? sendTimeLimit : Duration.ofSeconds(5);
			sendBufferSizeLimit = sendBufferSizeLimit > 0 ? sendBufferSizeLimit : 512 * 1024;
		}
	}

	/**
	 * @param historyOnJoin   WebSocket 입장 응답에 담는 최근 메시지 수
	 * @param maxFetchLimit   이력 조회 한 번의 최대 건수
	 * @param appendLockWait  같은 회의 채팅 순서 보장을 위한 대기 상한
	 */
	public record Chat(int historyOnJoin, int maxFetchLimit, Duration appendLockWait) {
		public Chat {
			historyOnJoin = historyOnJoin > 0 ? historyOnJoin : 50;
			maxFetchLimit = maxFetchLimit > 0 ? maxFetchLimit : 200;
			appendLockWait = appendLockWait != null ? appendLockWait : Duration.ofSeconds(2);
		}
	}
}
