package com.studyroom.studyroom_api.meeting.service;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.config.MeetingProperties;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 공유하기 쉬운 짧은 meetingId 를 발급한다.
 * 헷갈리는 문자(0/o, 1/l/i)는 빼고 소문자로만 만든다.
 */
@Slf4j
@Component
public class MeetingIdAllocator {

    static final String ALPHABET = "23456789abcdefghjkmnpqrstuvwxyz";

    private final MeetingStore meetingStore;
    private final int idLength;
    private final int maxAttempts;
    private final SecureRandom secureRandom = new SecureRandom();

    public MeetingIdAllocator(MeetingStore meetingStore, MeetingProperties properties) {
        this.meetingStore = meetingStore;
        this.idLength = properties.allocation().idLength();
        this.maxAttempts = properties.allocation().maxAttempts();
    }

    public String allocate() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = nextCandidate();
            if (!meetingStore.exists(candidate)) {
                return candidate;
            }
            log.warn("[MeetingIdAllocator] collision attempt={} candidate={}", attempt, candidate);
        }
        throw new ApiException(MeetingErrorCode.MEETING_ID_ALLOCATION_EXHAUSTED, "attempts=" + maxAttempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    String nextCandidate() {
        StringBuilder sb = new StringBuilder(idLength);
        for (int i = 0; i < idLength; i++) {
            sb.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
