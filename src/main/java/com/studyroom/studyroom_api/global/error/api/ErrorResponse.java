package com.studyroom.studyroom_api.global.error.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ErrorResponse")
public record ErrorResponse(
    @Schema(example = "MEETING_FULL") String code,
    @Schema(example = "회의실 정원이 가득 찼습니다.") String message,
    @Schema(description = "Validation 실패 시 주로 사용") List<FieldErrorData> errors,
    @Schema(description = "비즈니스 에러에서 추가 정보 필요 시 사용 (예: 현재 참여자 수)") Object data
) {

    public static ErrorResponse of(ApiException ex) {
        return new ErrorResponse(ex.getErrorCode().getCode(), ex.getErrorCode().getMessage(), ex.getErrors(), ex.getData());
    }
}
