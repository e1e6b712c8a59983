package com.studyroom.studyroom_api.meeting.store;

import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;

public record AdmissionOutcome(
        AdmissionDecision decision,
        MeetingStatus observedStatus,
        ParticipantSnapshot participant,
        int activeCount
) {

    public static AdmissionOutcome rejected(AdmissionDecision decision, MeetingStatus status, int activeCount) {
        return new AdmissionOutcome(decision, status, null, activeCount);
    }

    public static AdmissionOutcome accepted(
            AdmissionDecision decision,
            MeetingStatus status,
            ParticipantSnapshot participant,
            int activeCount
    ) {
        return new AdmissionOutcome(decision, status, participant, activeCount);
    }
}
