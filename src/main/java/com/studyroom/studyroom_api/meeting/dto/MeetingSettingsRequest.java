package com.studyroom.studyroom_api.meeting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.studyroom.studyroom_api.meeting.entity.MeetingSettings;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 부분 수정용. null 인 항목은 기존 값을 유지한다.
 */
@Schema(description = "회의 설정")
public record MeetingSettingsRequest(
        @Schema(example = "4", description = "최대 참여자 수 (2~6)")
        @Min(value = MeetingSettings.MIN_PARTICIPANTS, message = "최대 참여자 수는 2 이상이어야 합니다.")
        @Max(value = MeetingSettings.MAX_PARTICIPANTS, message = "최대 참여자 수는 6 이하여야 합니다.")
        Integer maxParticipants,

        @JsonProperty("isPublic")
        Boolean isPublic,
        Boolean requireApproval,
        Boolean allowChat,
        Boolean allowScreenShare,
        Boolean allowRecording,
        Boolean muteOnEntry
) {

    public MeetingSettings applyTo(MeetingSettings base) {
        return base.toBuilder()
                .maxParticipants(maxParticipants != null ? maxParticipants : base.getMaxParticipants())
                .isPublic(isPublic != null ? isPublic : base.isPublic())
                .requireApproval(requireApproval != null ? requireApproval : base.isRequireApproval())
                .allowChat(allowChat != null ? allowChat : base.isAllowChat())
                .allowScreenShare(allowScreenShare != null ? allowScreenShare : base.isAllowScreenShare())
                .allowRecording(allowRecording != null ? allowRecording : base.isAllowRecording())
                .muteOnEntry(muteOnEntry != null ? muteOnEntry : base.isMuteOnEntry())
                .build();
    }
}
