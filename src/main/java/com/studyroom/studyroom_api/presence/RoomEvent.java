package com.studyroom.studyroom_api.presence;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "실시간 채널로 내려가는 이벤트")
public record RoomEvent(
        @Schema(example = "participant-joined") RoomEventType type,
        @Schema(example = "room_7hk3m9pqrt") String roomId,
        @Schema(description = "현재 입장 중인 참여자 수") int participantCount,
        @Schema(description = "이벤트별 본문") Object data,
        Instant occurredAt
) {

    public static RoomEvent of(RoomEventType type, String roomId, int participantCount, Object data) {
        return new RoomEvent(type, roomId, participantCount, data, Instant.now());
    }
}
