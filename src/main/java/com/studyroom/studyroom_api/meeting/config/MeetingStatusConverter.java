package com.studyroom.studyroom_api.meeting.config;

import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * 쿼리 파라미터의 소문자 상태값(active 등)을 enum 으로 바꾼다.
 */
@Component
public class MeetingStatusConverter implements Converter<String, MeetingStatus> {

    @Override
    public MeetingStatus convert(String source) {
        return source.isBlank() ? null : MeetingStatus.fromWireName(source);
    }
}
