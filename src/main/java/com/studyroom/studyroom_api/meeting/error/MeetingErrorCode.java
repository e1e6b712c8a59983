package com.studyroom.studyroom_api.meeting.error;

import com.studyroom.studyroom_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum MeetingErrorCode implements ErrorCode {

    // 400
    INVALID_ROOM_PASSWORD_FORMAT(HttpStatus.BAD_REQUEST, "회의실 비밀번호는 4~20자여야 합니다."),
    INVALID_MAX_PARTICIPANTS(HttpStatus.BAD_REQUEST, "최대 참여자 수는 2~6명이어야 합니다."),

    // 401
    WRONG_ROOM_PASSWORD(HttpStatus.UNAUTHORIZED, "회의실 비밀번호가 올바르지 않습니다."),

    // 403
    ONLY_HOST_ALLOWED(HttpStatus.FORBIDDEN, "호스트만 수행할 수 있습니다."),
    NOT_ACTIVE_PARTICIPANT(HttpStatus.FORBIDDEN, "회의 참여자만 접근할 수 있습니다."),
    SCREEN_SHARE_DISABLED(HttpStatus.FORBIDDEN, "화면 공유가 허용되지 않은 회의입니다."),

    // 404
    MEETING_NOT_FOUND(HttpStatus.NOT_FOUND, "회의를 찾을 수 없습니다."),

    // 409
    MEETING_FULL(HttpStatus.CONFLICT, "회의실 정원이 가득 찼습니다."),
    MEETING_ENDED(HttpStatus.CONFLICT, "이미 종료된 회의입니다."),
    MEETING_NOT_JOINED(HttpStatus.CONFLICT, "먼저 회의에 입장해야 합니다."),
    INVALID_SETTINGS_CHANGE(HttpStatus.CONFLICT, "현재 참여자 수보다 작은 정원으로 변경할 수 없습니다."),

    // 503
    MEETING_ID_ALLOCATION_EXHAUSTED(HttpStatus.SERVICE_UNAVAILABLE, "회의 ID 생성에 실패했습니다.");

    private final HttpStatus status;
    private final String message;

    MeetingErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return this.name(); } // code는 enum name()
}
