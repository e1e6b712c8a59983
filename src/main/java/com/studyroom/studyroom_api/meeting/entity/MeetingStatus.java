package com.studyroom.studyroom_api.meeting.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 회의 생명주기. SCHEDULED → ACTIVE → ENDED 방향으로만 움직이며, 호스트가 종료하면
 * SCHEDULED → ENDED 도 허용된다. ENDED 는 종료 상태다.
 */
public enum MeetingStatus {
    SCHEDULED,
    ACTIVE,
    ENDED;

    public static final Set<MeetingStatus> JOINABLE = EnumSet.of(SCHEDULED, ACTIVE);

    public boolean isJoinable() {
        return JOINABLE.contains(this);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MeetingStatus fromWireName(String value) {
        return value == null ? null : MeetingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
