package com.studyroom.studyroom_api.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PresenceExecutorConfig {

    // 연결별 송신 대기열을 비우는 공용 스레드. 연결 하나는 동시에 한 스레드만 사용한다.
    @Bean(name = "presenceDeliveryExecutor")
    public ThreadPoolTaskExecutor presenceDeliveryExecutor(
            @Value("${websocket.delivery.core-pool-size:4}") int corePoolSize,
            @Value("${websocket.delivery.max-pool-size:16}") int maxPoolSize,
            @Value("${websocket.delivery.queue-capacity:10000}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("presence-");
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
