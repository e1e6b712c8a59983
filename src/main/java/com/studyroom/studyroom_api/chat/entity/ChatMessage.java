package com.studyroom.studyroom_api.chat.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(
        name = "meeting_messages",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_meeting_messages_sequence",
                columnNames = {"meeting_id", "message_sequence"}
        )
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "meeting_id", nullable = false, length = 32)
    private String meetingId;

    // 회의별 1부터 빈 번호 없이 증가
    @Column(name = "message_sequence", nullable = false)
    private long sequence;

    @Column(name = "sender_user_id", nullable = false, length = 128)
    private String senderUserId;

    @Column(name = "sender_name", nullable = false, length = 100)
    private String senderName;

    @Column(nullable = false, length = 2000)
    private String body;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @Builder
    private ChatMessage(String meetingId, long sequence, String senderUserId, String senderName, String body, Instant sentAt) {
        this.meetingId = meetingId;
        this.sequence = sequence;
        this.senderUserId = senderUserId;
        this.senderName = senderName;
        this.body = body;
        this.sentAt = sentAt != null ? sentAt : Instant.now();
    }
}
