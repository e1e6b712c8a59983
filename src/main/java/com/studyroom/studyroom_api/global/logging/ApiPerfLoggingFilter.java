package com.studyroom.studyroom_api.global.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 느린 요청, 느린 쿼리, 5xx 응답만 골라 한 줄 JSON으로 남긴다.
 * 회의실 API는 경로에서 meetingId를 뽑아 같이 기록한다(방 단위 장애 추적용).
 */
@Component
public class ApiPerfLoggingFilter extends OncePerRequestFilter {

	private static final Logger LOG = LoggerFactory.getLogger("api.perf");
	private static final Pattern MEETING_PATH = Pattern.compile("^/api/v1/meetings/([a-z0-9]+)(/.*)?$");

	private final PerfLogProperties perfLogProperties;
	private final ObjectMapper objectMapper;

	public ApiPerfLoggingFilter(
		PerfLogProperties perfLogProperties,
		ObjectMapper objectMapper
	) {
		this.perfLogProperties = perfLogProperties;
		this.objectMapper = objectMapper;
	}

	@Override
	protected boolean shouldNotFilter(HttpServletRequest request) {
		return !perfLogProperties.enabled() || perfLogProperties.isExcluded(request.getRequestURI());
	}

	@Override
	protected void doFilterInternal(
		HttpServletRequest request,
		HttpServletResponse response,
		FilterChain filterChain
	) throws ServletException, IOException {
		long startNs = System.nanoTime();
		RequestSqlMetricsContext.start();
		Throwable throwable = null;
		try {
			filterChain.doFilter(request, response);
		} catch (Throwable ex) {
			throwable = ex;
			throw ex;
		} finally {
			long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
			RequestSqlMetricsContext.SqlMetrics sqlMetrics = RequestSqlMetricsContext.finish();

			int status = resolveStatus(response, throwable);
			PerfFlags flags = new PerfFlags(
				elapsedMs >= perfLogProperties.slowRequest().toMillis(),
				sqlMetrics.queryTimeMs() >= perfLogProperties.slowQuery().toMillis()
					|| sqlMetrics.failedQueryCount() > 0,
				status >= HttpStatus.INTERNAL_SERVER_ERROR.value()
			);

			if (flags.any()) {
				logAsJson(request, status, elapsedMs, sqlMetrics, flags);
			}
		}
	}

	private int resolveStatus(HttpServletResponse response, Throwable throwable) {
		if (throwable != null && response.getStatus() < HttpStatus.BAD_REQUEST.value()) {
			return HttpStatus.INTERNAL_SERVER_ERROR.value();
		}
		return response.getStatus();
	}

	private void logAsJson(
		HttpServletRequest request,
		int status,
		long elapsedMs,
		RequestSqlMetricsContext.SqlMetrics sqlMetrics,
		PerfFlags flags
	) {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("type", "api_perf");
		fields.put("method", request.getMethod());
		fields.put("path", request.getRequestURI());
		String meetingId = extractMeetingId(request.getRequestURI());
		if (meetingId != null) {
			fields.put("meetingId", meetingId);
		}
		fields.put("status", status);
		fields.put("elapsedMs", elapsedMs);
		fields.put("queryCount", sqlMetrics.queryCount());
		fields.put("queryTimeMs", sqlMetrics.queryTimeMs());
		fields.put("failedQueryCount", sqlMetrics.failedQueryCount());
		fields.put("slowRequest", flags.slowRequest());
		fields.put("slowQuery", flags.slowQuery());
		fields.put("serverError", flags.serverError());

		String requestId = request.getHeader("X-Request-Id");
		if (requestId != null && !requestId.isBlank()) {
			fields.put("requestId", requestId);
		}

		try {
			LOG.info(objectMapper.writeValueAsString(fields));
		} catch (JsonProcessingException ex) {
			LOG.info(
				"type=api_perf method={} path={} status={} elapsedMs={} queryCount={} queryTimeMs={}",
				request.getMethod(),
				request.getRequestURI(),
				status,
				elapsedMs,
				sqlMetrics.queryCount(),
				sqlMetrics.queryTimeMs()
			);
		}
	}

	static String extractMeetingId(String path) {
		if (path == null) {
			return null;
		}
		Matcher matcher = MEETING_PATH.matcher(path);
		if (!matcher.matches()) {
			return null;
		}
		String candidate = matcher.group(1);
		// 목록/통계 경로는 meetingId가 아니다
		return switch (candidate) {
			case "users", "status", "stats" -> null;
			default -> candidate;
		};
	}

	private record PerfFlags(boolean slowRequest, boolean slowQuery, boolean serverError) {
		boolean any() {
			return slowRequest || slowQuery || serverError;
		}
	}
}
