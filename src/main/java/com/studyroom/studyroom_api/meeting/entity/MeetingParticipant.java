package com.studyroom.studyroom_api.meeting.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 한 번의 입장 기록. 퇴장해도 삭제하지 않고 leftAt 만 채운다.
 * activeKey 는 입장 중일 때만 userId 를 갖고, (meeting_id, active_key) 유니크 제약으로
 * 같은 사용자의 중복 활성 입장을 막는다.
 */
@Entity
@Table(
        name = "meeting_participants",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_meeting_participants_active",
                columnNames = {"meeting_id", "active_key"}
        ),
        indexes = @Index(name = "idx_meeting_participants_user", columnList = "user_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MeetingParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "meeting_id", nullable = false)
    private Meeting meeting;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(length = 320)
    private String email;

    @Column(name = "active_key", length = 128)
    private String activeKey;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    @Column(name = "left_at")
    private Instant leftAt;

    @Builder
    private MeetingParticipant(Meeting meeting, String userId, String displayName, String email, Instant joinedAt) {
        this.meeting = meeting;
        this.userId = userId;
        this.displayName = displayName;
        this.email = email;
        this.activeKey = userId;
        this.joinedAt = joinedAt != null ? joinedAt : Instant.now();
    }

    public boolean isActive() {
        return leftAt == null;
    }
}
