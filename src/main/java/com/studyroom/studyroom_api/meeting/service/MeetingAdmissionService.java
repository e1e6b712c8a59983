package com.studyroom.studyroom_api.meeting.service;

import com.studyroom.studyroom_api.meeting.dto.JoinMeetingCommand;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingResponse;
import com.studyroom.studyroom_api.presence.LiveConnection;

public interface MeetingAdmissionService {

    /**
     * @param connection WebSocket 입장이면 해당 연결, REST 입장이면 null
     */
    JoinMeetingResponse join(JoinMeetingCommand command, LiveConnection connection);

    void leave(String meetingId, String userId);

    /**
     * 연결이 끊겼을 때 호출된다. 이 연결이 아직 사용자의 현재 연결일 때만 퇴장 처리한다.
     */
    void disconnect(String meetingId, String userId, LiveConnection connection);
}
