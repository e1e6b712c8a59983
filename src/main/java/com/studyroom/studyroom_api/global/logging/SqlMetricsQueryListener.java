package com.studyroom.studyroom_api.global.logging;

import java.util.List;
import net.ttddyy.dsproxy.ExecutionInfo;
import net.ttddyy.dsproxy.QueryInfo;
import net.ttddyy.dsproxy.listener.QueryExecutionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SqlMetricsQueryListener implements QueryExecutionListener {

	private static final Logger LOG = LoggerFactory.getLogger("api.perf.sql");

	private final PerfLogProperties perfLogProperties;

	public SqlMetricsQueryListener(PerfLogProperties perfLogProperties) {
		this.perfLogProperties = perfLogProperties;
	}

	@Override
	public void beforeQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList) {
		// no-op
	}

	@Override
	public void afterQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList) {
		int queryCount = (queryInfoList == null) ? 0 : queryInfoList.size();
		long elapsedMs = (execInfo == null) ? 0L : execInfo.getElapsedTime();
		boolean success = execInfo == null || execInfo.isSuccess();
		RequestSqlMetricsContext.record(queryCount, elapsedMs, success);

		// 조건부 UPDATE(입장/퇴장)가 락 대기로 느려지는 경우를 따로 본다
		if (!success) {
			LOG.debug("type=sql_failure elapsedMs={} queries={}", elapsedMs, describe(queryInfoList));
		} else if (elapsedMs >= perfLogProperties.slowQuery().toMillis()) {
			LOG.debug("type=sql_slow elapsedMs={} queries={}", elapsedMs, describe(queryInfoList));
		}
	}

	private String describe(List<QueryInfo> queryInfoList) {
		if (queryInfoList == null || queryInfoList.isEmpty()) {
			return "[]";
		}
		return queryInfoList.stream().map(QueryInfo::getQuery).toList().toString();
	}
}
