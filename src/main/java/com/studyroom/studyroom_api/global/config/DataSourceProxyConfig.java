package com.studyroom.studyroom_api.global.config;

import com.studyroom.studyroom_api.global.logging.SqlMetricsQueryListener;
import javax.sql.DataSource;
import net.ttddyy.dsproxy.support.ProxyDataSource;
import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * perf-log 가 켜져 있을 때만 DataSource 를 감싸 요청별 쿼리 수/시간을 모은다.
 */
@Configuration
@ConditionalOnProperty(prefix = "perf-log", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataSourceProxyConfig {

	@Bean
	public static BeanPostProcessor meetingStoreDataSourceProxy(ObjectProvider<SqlMetricsQueryListener> listener) {
		return new BeanPostProcessor() {
			@Override
			public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
				if (!(bean instanceof DataSource dataSource) || bean instanceof ProxyDataSource) {
					return bean;
				}
				return ProxyDataSourceBuilder.create(dataSource)
					.name(beanName)
					.listener(listener.getObject())
					.build();
			}
		};
	}
}
