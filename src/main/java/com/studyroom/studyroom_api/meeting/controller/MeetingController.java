package com.studyroom.studyroom_api.meeting.controller;

import com.studyroom.studyroom_api.meeting.dto.*;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.service.MeetingAdmissionService;
import com.studyroom.studyroom_api.meeting.service.MeetingLifecycleService;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.service.MeetingService;
import com.studyroom.studyroom_api.presence.RoomStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Meeting", description = "화상 회의실 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/meetings")
public class MeetingController {

    private final MeetingService meetingService;
    private final MeetingReadService meetingReadService;
    private final MeetingAdmissionService meetingAdmissionService;
    private final MeetingLifecycleService meetingLifecycleService;

    @Operation(summary = "회의 생성", description = "회의를 만들고 공유용 meetingId 반환")
    @ApiResponse(responseCode = "201", description = "created")
    @PostMapping
    public ResponseEntity<MeetingDetailResponse> createMeeting(@Valid @RequestBody CreateMeetingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(meetingService.createMeeting(request));
    }

    @Operation(summary = "회의 상세 조회", description = "설정과 현재 참여자 목록 포함")
    @GetMapping("/{meetingId}")
    public ResponseEntity<MeetingDetailResponse> getMeeting(@PathVariable String meetingId) {
        return ResponseEntity.ok(meetingReadService.getMeeting(meetingId));
    }

    @Operation(summary = "입장 정보 조회", description = "입장 전 화면용 공개 정보 (비밀번호 필요 여부만 노출)")
    @GetMapping("/{meetingId}/info")
    public ResponseEntity<MeetingJoinInfoResponse> getJoinInfo(@PathVariable String meetingId) {
        return ResponseEntity.ok(meetingReadService.getJoinInfo(meetingId));
    }

    @Operation(summary = "회의 설정 변경", description = "호스트만 가능. 현재 참여자 수보다 작은 정원으로는 변경 불가")
    @PatchMapping("/{meetingId}/settings")
    public ResponseEntity<MeetingDetailResponse> updateSettings(
            @PathVariable String meetingId,
            @Valid @RequestBody UpdateMeetingSettingsRequest request
    ) {
        return ResponseEntity.ok(meetingService.updateSettings(meetingId, request));
    }

    @Operation(summary = "회의 입장", description = "이미 입장 중이면 기존 세션을 그대로 반환")
    @PostMapping("/{meetingId}/join")
    public ResponseEntity<JoinMeetingResponse> join(
            @PathVariable String meetingId,
            @Valid @RequestBody JoinMeetingRequest request
    ) {
        return ResponseEntity.ok(meetingAdmissionService.join(JoinMeetingCommand.of(meetingId, request), null));
    }

    @Operation(summary = "회의 퇴장", description = "멱등. 입장 중이 아니어도 204")
    @ApiResponse(responseCode = "204", description = "No Content")
    @PostMapping("/{meetingId}/leave")
    public ResponseEntity<Void> leave(
            @PathVariable String meetingId,
            @Valid @RequestBody MeetingActionRequest request
    ) {
        meetingAdmissionService.leave(meetingId, request.userId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "회의 종료", description = "호스트만 가능. 이미 종료된 회의면 그대로 성공")
    @PostMapping("/{meetingId}/end")
    public ResponseEntity<EndMeetingResponse> endMeeting(
            @PathVariable String meetingId,
            @Valid @RequestBody MeetingActionRequest request
    ) {
        return ResponseEntity.ok(meetingLifecycleService.endMeeting(meetingId, request.userId()));
    }

    @Operation(summary = "사용자 회의 목록", description = "사용자가 만들었거나 참여했던 회의")
    @GetMapping("/users/{userId}")
    public ResponseEntity<UserMeetingsResponse> getUserMeetings(
            @PathVariable String userId,
            @RequestParam(required = false) MeetingStatus status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size
    ) {
        return ResponseEntity.ok(meetingReadService.getUserMeetings(userId, status, page, size));
    }

    @Operation(summary = "진행 중인 회의 목록")
    @GetMapping("/status/active")
    public ResponseEntity<ActiveMeetingsResponse> getActiveMeetings() {
        return ResponseEntity.ok(meetingReadService.getActiveMeetings());
    }

    @Operation(summary = "방별 실시간 연결 통계", description = "참여자 식별 정보는 포함하지 않음")
    @GetMapping("/stats/rooms")
    public ResponseEntity<RoomStats> getRoomStats() {
        return ResponseEntity.ok(meetingReadService.getRoomStats());
    }
}
