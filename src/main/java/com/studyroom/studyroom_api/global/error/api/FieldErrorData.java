package com.studyroom.studyroom_api.global.error.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FieldErrorData")
public record FieldErrorData (
        @Schema(example = "roomPassword") String field,
        @Schema(example = "비밀번호는 4~20자여야 합니다.") String reason) {
}
