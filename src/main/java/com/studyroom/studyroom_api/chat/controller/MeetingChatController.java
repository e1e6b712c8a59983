package com.studyroom.studyroom_api.chat.controller;

import com.studyroom.studyroom_api.chat.dto.ChatHistoryResponse;
import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;
import com.studyroom.studyroom_api.chat.dto.SendChatMessageRequest;
import com.studyroom.studyroom_api.chat.service.MeetingChatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@Tag(name = "Meeting Chat", description = "회의 채팅 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/meetings/{meetingId}/messages")
public class MeetingChatController {

    private final MeetingChatService meetingChatService;

    @Operation(summary = "채팅 이력 조회", description = "순번 오름차순. 종료된 회의도 조회 가능")
    @GetMapping
    public ResponseEntity<ChatHistoryResponse> getHistory(
            @PathVariable String meetingId,
            @RequestParam(required = false) @Min(0) Long afterSequence,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit
    ) {
        return ResponseEntity.ok(meetingChatService.getHistory(meetingId, afterSequence, since, limit));
    }

    @Operation(summary = "채팅 전송", description = "입장 중인 참여자만 전송 가능. 방의 실시간 연결에도 전달된다")
    @ApiResponse(responseCode = "201", description = "created")
    @PostMapping
    public ResponseEntity<ChatMessageResponse> send(
            @PathVariable String meetingId,
            @Valid @RequestBody SendChatMessageRequest request
    ) {
        ChatMessageResponse response = meetingChatService.send(meetingId, request.userId(), request.body());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
