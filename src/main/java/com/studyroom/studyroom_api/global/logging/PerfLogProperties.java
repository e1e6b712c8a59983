package com.studyroom.studyroom_api.global.logging;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param slowRequest         이 시간 이상 걸린 요청을 남긴다
 * @param slowQuery           요청 하나의 쿼리 시간 합이 이 값 이상이면 남긴다. 쿼리 단건 debug 로그 기준이기도 하다
 * @param excludePathPrefixes 필터를 타지 않는 경로. WebSocket 업그레이드(/ws)는 요청 시간이 연결 수명이라 뺀다
 */
@ConfigurationProperties(prefix = "perf-log")
public record PerfLogProperties(
	@DefaultValue("true") boolean enabled,
	Duration slowRequest,
	Duration slowQuery,
	List<String> excludePathPrefixes
) {

	public PerfLogProperties {
		slowRequest = slowRequest != null ? slowRequest : Duration.ofMillis(300);
		slowQuery = slowQuery != null ? slowQuery : Duration.ofMillis(100);
		excludePathPrefixes = excludePathPrefixes != null
			? List.copyOf(excludePathPrefixes)
			: List.of("/actuator", "/swagger-ui", "/v3/api-docs", "/ws");
	}

	boolean isExcluded(String path) {
		return path != null && excludePathPrefixes.stream()
			.anyMatch(prefix -> prefix != null && !prefix.isBlank() && path.startsWith(prefix));
	}
}
