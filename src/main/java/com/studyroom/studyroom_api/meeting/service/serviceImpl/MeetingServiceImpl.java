package com.studyroom.studyroom_api.meeting.service.serviceImpl;

import com.studyroom.studyroom_api.global.error.api.ApiException;
import com.studyroom.studyroom_api.meeting.dto.CreateMeetingRequest;
import com.studyroom.studyroom_api.meeting.dto.MeetingDetailResponse;
import com.studyroom.studyroom_api.meeting.dto.UpdateMeetingSettingsRequest;
import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingSettings;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import com.studyroom.studyroom_api.meeting.error.MeetingErrorCode;
import com.studyroom.studyroom_api.meeting.service.MeetingIdAllocator;
import com.studyroom.studyroom_api.meeting.service.MeetingReadService;
import com.studyroom.studyroom_api.meeting.service.MeetingService;
import com.studyroom.studyroom_api.meeting.store.MeetingStore;
import com.studyroom.studyroom_api.meeting.store.MeetingStoreBulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingServiceImpl implements MeetingService {

    private static final int MIN_PASSWORD_LENGTH = 4;
    private static final int MAX_PASSWORD_LENGTH = 20;

    private final MeetingStore meetingStore;
    private final MeetingStoreBulkhead storeBulkhead;
    private final MeetingIdAllocator meetingIdAllocator;
    private final MeetingReadService meetingReadService;

    @Override
    public MeetingDetailResponse createMeeting(CreateMeetingRequest req) {
        String roomPassword = normalizePassword(req.roomPassword());
        MeetingSettings settings = req.settings() != null
                ? req.settings().applyTo(MeetingSettings.defaults())
                : MeetingSettings.defaults();
        validateCapacity(settings.getMaxParticipants());

        // 존재 확인과 INSERT 사이에 같은 ID 가 먼저 저장될 수 있어 유니크 제약 위반도 재시도한다
        int maxAttempts = meetingIdAllocator.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String meetingId = meetingIdAllocator.allocate();
            Meeting meeting = Meeting.builder()
                    .meetingId(meetingId)
                    .title(req.title().trim())
                    .description(req.description())
                    .hostUserId(req.hostUserId())
                    .settings(settings)
                    .roomPassword(roomPassword)
                    .scheduledStartTime(req.scheduledStartTime())
                    .build();
            try {
                Meeting saved = storeBulkhead.call(() -> meetingStore.create(meeting));
                log.info("[Meeting] created meetingId={} hostUserId={} maxParticipants={} passwordProtected={}",
                        saved.getMeetingId(), saved.getHostUserId(),
                        settings.getMaxParticipants(), saved.requiresPassword());
                return MeetingDetailResponse.of(saved, List.of());
            } catch (DataIntegrityViolationException e) {
                log.warn("[Meeting] meetingId conflict on insert attempt={} meetingId={}", attempt, meetingId);
            }
        }
        throw new ApiException(MeetingErrorCode.MEETING_ID_ALLOCATION_EXHAUSTED, "attempts=" + maxAttempts);
    }

    @Override
    public MeetingDetailResponse updateSettings(String meetingId, UpdateMeetingSettingsRequest req) {
        Meeting meeting = storeBulkhead.call(() -> meetingStore.get(meetingId))
                .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));
        if (!meeting.isHost(req.userId())) {
            throw new ApiException(MeetingErrorCode.ONLY_HOST_ALLOWED);
        }
        if (meeting.getStatus() == MeetingStatus.ENDED) {
            throw new ApiException(MeetingErrorCode.MEETING_ENDED);
        }

        MeetingSettings next = req.settings().applyTo(meeting.getSettings());
        validateCapacity(next.getMaxParticipants());

        boolean updated = storeBulkhead.call(() -> meetingStore.updateSettings(meetingId, next));
        if (!updated) {
            Meeting latest = storeBulkhead.call(() -> meetingStore.get(meetingId))
                    .orElseThrow(() -> new ApiException(MeetingErrorCode.MEETING_NOT_FOUND));
            if (latest.getStatus() == MeetingStatus.ENDED) {
                throw new ApiException(MeetingErrorCode.MEETING_ENDED);
            }
            throw new ApiException(MeetingErrorCode.INVALID_SETTINGS_CHANGE,
                    "currentParticipants=" + latest.getActiveParticipantCount());
        }

        log.info("[Meeting] settings updated meetingId={} maxParticipants={} allowChat={}",
                meetingId, next.getMaxParticipants(), next.isAllowChat());
        return meetingReadService.getMeeting(meetingId);
    }

    private String normalizePassword(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.length() < MIN_PASSWORD_LENGTH || trimmed.length() > MAX_PASSWORD_LENGTH) {
            throw new ApiException(MeetingErrorCode.INVALID_ROOM_PASSWORD_FORMAT);
        }
        return trimmed;
    }

    private void validateCapacity(int maxParticipants) {
        if (maxParticipants < MeetingSettings.MIN_PARTICIPANTS || maxParticipants > MeetingSettings.MAX_PARTICIPANTS) {
            throw new ApiException(MeetingErrorCode.INVALID_MAX_PARTICIPANTS);
        }
    }
}
