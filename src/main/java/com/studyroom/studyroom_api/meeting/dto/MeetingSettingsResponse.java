package com.studyroom.studyroom_api.meeting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.studyroom.studyroom_api.meeting.entity.MeetingSettings;

public record MeetingSettingsResponse(
        int maxParticipants,
        @JsonProperty("isPublic") boolean isPublic,
        boolean requireApproval,
        boolean allowChat,
        boolean allowScreenShare,
        boolean allowRecording,
        boolean muteOnEntry
) {

    public static MeetingSettingsResponse from(MeetingSettings settings) {
        return new MeetingSettingsResponse(
                settings.getMaxParticipants(),
                settings.isPublic(),
                settings.isRequireApproval(),
                settings.isAllowChat(),
                settings.isAllowScreenShare(),
                settings.isAllowRecording(),
                settings.isMuteOnEntry()
        );
    }
}
