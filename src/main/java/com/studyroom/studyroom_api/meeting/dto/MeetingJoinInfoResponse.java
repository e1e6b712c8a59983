package com.studyroom.studyroom_api.meeting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "입장 전 공개 정보")
public record MeetingJoinInfoResponse(
        String meetingId,
        String title,
        String description,
        MeetingStatus status,
        int maxParticipants,
        int currentParticipants,
        boolean requiresPassword,
        boolean allowChat,
        boolean allowScreenShare,
        @JsonProperty("isJoinable") boolean isJoinable,
        @JsonProperty("isFull") boolean isFull
) {

    public static MeetingJoinInfoResponse from(Meeting meeting) {
        boolean full = meeting.isFull();
        return new MeetingJoinInfoResponse(
                meeting.getMeetingId(),
                meeting.getTitle(),
                meeting.getDescription(),
                meeting.getStatus(),
                meeting.getSettings().getMaxParticipants(),
                meeting.getActiveParticipantCount(),
                meeting.requiresPassword(),
                meeting.getSettings().isAllowChat(),
                meeting.getSettings().isAllowScreenShare(),
                meeting.getStatus().isJoinable() && !full,
                full
        );
    }
}
