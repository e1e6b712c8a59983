package com.studyroom.studyroom_api.global.logging;

/**
 * 요청 스레드 단위로 쿼리 수/시간/실패 수를 누적한다.
 * WebSocket 프레임 처리처럼 start()가 호출되지 않은 스레드에서는 아무것도 하지 않는다.
 */
public final class RequestSqlMetricsContext {

	private static final ThreadLocal<MetricsAccumulator> HOLDER = new ThreadLocal<>();

	private RequestSqlMetricsContext() {
	}

	public static void start() {
		HOLDER.set(new MetricsAccumulator());
	}

	public static void record(int queryCount, long elapsedMs, boolean success) {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return;
		}
		accumulator.queryCount += Math.max(queryCount, 0);
		accumulator.queryTimeMs += Math.max(elapsedMs, 0L);
		if (!success) {
			// 락 대기 초과 등으로 실패한 조건부 UPDATE
			accumulator.failedQueryCount++;
		}
	}

	/**
	 * 누적값을 돌려주고 스레드에서 지운다.
	 */
	public static SqlMetrics finish() {
		MetricsAccumulator accumulator = HOLDER.get();
		HOLDER.remove();
		if (accumulator == null) {
			return new SqlMetrics(0, 0L, 0);
		}
		return new SqlMetrics(accumulator.queryCount, accumulator.queryTimeMs, accumulator.failedQueryCount);
	}

	public record SqlMetrics(
		int queryCount,
		long queryTimeMs,
		int failedQueryCount
	) {
	}

	private static final class MetricsAccumulator {
		private int queryCount;
		private long queryTimeMs;
		private int failedQueryCount;
	}
}
