package com.studyroom.studyroom_api.meeting.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Entity
@Table(
        name = "meetings",
        uniqueConstraints = @UniqueConstraint(name = "uk_meetings_meeting_id", columnNames = "meeting_id"),
        indexes = {
                @Index(name = "idx_meetings_status_empty_since", columnList = "status, empty_since"),
                @Index(name = "idx_meetings_created_by", columnList = "created_by, created_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Meeting {

    public static final String ROOM_ID_PREFIX = "room_";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "meeting_id", nullable = false, length = 32)
    private String meetingId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Column(name = "created_by", nullable = false, length = 128)
    private String createdBy;

    @Column(name = "host_user_id", nullable = false, length = 128)
    private String hostUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MeetingStatus status;

    @Embedded
    private MeetingSettings settings;

    @Column(name = "room_password", length = 20)
    private String roomPassword;

    @Column(name = "room_id", nullable = false, length = 40)
    private String roomId;

    // 조건부 UPDATE 로만 증감한다 (MeetingRepository 참고)
    @Column(name = "active_participant_count", nullable = false)
    private int activeParticipantCount;

    @Column(name = "last_message_sequence", nullable = false)
    private long lastMessageSequence;

    @Column(name = "scheduled_start_time")
    private Instant scheduledStartTime;

    @Column(name = "actual_start_time")
    private Instant actualStartTime;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "duration_minutes")
    private Long durationMinutes;

    @Column(name = "empty_since")
    private Instant emptySince;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Builder
    private Meeting(
            String meetingId,
            String title,
            String description,
            String hostUserId,
            MeetingSettings settings,
            String roomPassword,
            Instant scheduledStartTime
    ) {
        this.meetingId = meetingId;
        this.title = title;
        this.description = description;
        this.createdBy = hostUserId;
        this.hostUserId = hostUserId;
        this.settings = settings != null ? settings : MeetingSettings.defaults();
        this.roomPassword = roomPassword;
        this.roomId = roomIdOf(meetingId);
        this.scheduledStartTime = scheduledStartTime;
        this.status = MeetingStatus.SCHEDULED;
        this.activeParticipantCount = 0;
        this.lastMessageSequence = 0L;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public static String roomIdOf(String meetingId) {
        return ROOM_ID_PREFIX + meetingId;
    }

    public boolean isHost(String userId) {
        return hostUserId.equals(userId);
    }

    public boolean requiresPassword() {
        return roomPassword != null && !roomPassword.isBlank();
    }

    public boolean isFull() {
        return activeParticipantCount >= settings.getMaxParticipants();
    }

    public void recordDuration() {
        if (actualStartTime == null || endedAt == null) {
            return;
        }
        this.durationMinutes = Math.round(Duration.between(actualStartTime, endedAt).toSeconds() / 60.0);
    }
}
