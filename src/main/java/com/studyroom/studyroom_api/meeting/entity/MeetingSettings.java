package com.studyroom.studyroom_api.meeting.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class MeetingSettings {

    public static final int MIN_PARTICIPANTS = 2;
    public static final int MAX_PARTICIPANTS = 6;

    @Column(name = "max_participants", nullable = false)
    private int maxParticipants;

    @Column(name = "is_public", nullable = false)
    private boolean isPublic;

    @Column(name = "require_approval", nullable = false)
    private boolean requireApproval;

    @Column(name = "allow_chat", nullable = false)
    private boolean allowChat;

    @Column(name = "allow_screen_share", nullable = false)
    private boolean allowScreenShare;

    @Column(name = "allow_recording", nullable = false)
    private boolean allowRecording;

    @Column(name = "mute_on_entry", nullable = false)
    private boolean muteOnEntry;

    public static MeetingSettings defaults() {
        return MeetingSettings.builder()
                .maxParticipants(MAX_PARTICIPANTS)
                .isPublic(false)
                .requireApproval(false)
                .allowChat(true)
                .allowScreenShare(true)
                .allowRecording(false)
                .muteOnEntry(false)
                .build();
    }
}
