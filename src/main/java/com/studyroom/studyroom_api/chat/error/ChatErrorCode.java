package com.studyroom.studyroom_api.chat.error;

import com.studyroom.studyroom_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum ChatErrorCode implements ErrorCode {

    // 400
    EMPTY_MESSAGE(HttpStatus.BAD_REQUEST, "메시지 내용이 비어 있습니다."),
    MESSAGE_TOO_LONG(HttpStatus.BAD_REQUEST, "메시지는 2000자 이하여야 합니다."),

    // 403
    CHAT_DISABLED(HttpStatus.FORBIDDEN, "이 회의에서는 채팅이 비활성화되어 있습니다.");

    private final HttpStatus status;
    private final String message;

    ChatErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return this.name(); }
}
