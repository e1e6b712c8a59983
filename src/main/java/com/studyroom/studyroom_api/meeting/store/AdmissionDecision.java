package com.studyroom.studyroom_api.meeting.store;

public enum AdmissionDecision {
    ADMITTED,
    ALREADY_ACTIVE,
    WRONG_PASSWORD,
    ROOM_FULL,
    MEETING_ENDED,
    NOT_FOUND;

    public boolean isAdmitted() {
        return this == ADMITTED || this == ALREADY_ACTIVE;
    }
}
