package com.studyroom.studyroom_api.presence;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

@Schema(description = "방별 연결 수 통계 (참여자 식별 정보는 포함하지 않음)")
public record RoomStats(
        int totalRooms,
        int totalConnections,
        List<RoomStat> rooms
) {

    public record RoomStat(
            @Schema(example = "room_7hk3m9pqrt") String roomId,
            int connectionCount,
            Instant createdAt
    ) {
    }
}
