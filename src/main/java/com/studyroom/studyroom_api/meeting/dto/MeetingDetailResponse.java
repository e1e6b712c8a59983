package com.studyroom.studyroom_api.meeting.dto;

import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingParticipant;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * 비밀번호 원문은 절대 담지 않는다. requiresPassword 만 노출한다.
 */
@Schema(description = "회의 상세")
public record MeetingDetailResponse(
        @Schema(example = "7hk3m9pqrt") String meetingId,
        String title,
        String description,
        String hostUserId,
        @Schema(example = "active") MeetingStatus status,
        MeetingSettingsResponse settings,
        boolean requiresPassword,
        @Schema(example = "room_7hk3m9pqrt") String roomId,
        int participantCount,
        List<ParticipantResponse> participants,
        Instant scheduledStartTime,
        Instant actualStartTime,
        Instant endedAt,
        Long durationMinutes,
        Instant createdAt
) {

    public static MeetingDetailResponse of(Meeting meeting, List<MeetingParticipant> activeParticipants) {
        List<ParticipantResponse> participants = activeParticipants.stream()
                .map(p -> ParticipantResponse.of(p, meeting.getHostUserId()))
                .toList();
        return new MeetingDetailResponse(
                meeting.getMeetingId(),
                meeting.getTitle(),
                meeting.getDescription(),
                meeting.getHostUserId(),
                meeting.getStatus(),
                MeetingSettingsResponse.from(meeting.getSettings()),
                meeting.requiresPassword(),
                meeting.getRoomId(),
                meeting.getActiveParticipantCount(),
                participants,
                meeting.getScheduledStartTime(),
                meeting.getActualStartTime(),
                meeting.getEndedAt(),
                meeting.getDurationMinutes(),
                meeting.getCreatedAt()
        );
    }
}
