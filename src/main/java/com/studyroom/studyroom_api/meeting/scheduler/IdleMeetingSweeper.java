package com.studyroom.studyroom_api.meeting.scheduler;

import com.studyroom.studyroom_api.meeting.service.MeetingLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "meeting.lifecycle.idle-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class IdleMeetingSweeper {

    private final MeetingLifecycleService meetingLifecycleService;

    @Scheduled(
            initialDelayString = "${meeting.lifecycle.idle-sweep-interval:PT30S}",
            fixedDelayString = "${meeting.lifecycle.idle-sweep-interval:PT30S}"
    )
    public void sweep() {
        try {
            meetingLifecycleService.sweepIdleMeetings();
        } catch (RuntimeException e) {
            // 스케줄러 스레드는 살려 두고 다음 주기에 다시 시도한다
            log.error("[IdleMeetingSweeper] sweep failed", e);
        }
    }
}
