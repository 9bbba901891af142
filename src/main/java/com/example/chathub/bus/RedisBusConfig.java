package com.example.chathub.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class RedisBusConfig {
    private static final Logger log = LoggerFactory.getLogger(RedisBusConfig.class);

    static final String LISTENER_THREAD_PREFIX = "membership-bus-";

    /**
     * Owns the single subscriber connection. Lost subscriptions are re-established every
     * five seconds; the container releases the connection on shutdown.
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            @Qualifier("membershipBusExecutor") ThreadPoolTaskExecutor membershipBusExecutor) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(membershipBusExecutor);
        // blocking drivers park a thread on SUBSCRIBE; keep it off the dispatch thread
        container.setSubscriptionExecutor(new SimpleAsyncTaskExecutor("membership-bus-subscriber-"));
        container.setRecoveryInterval(5000L);
        container.setErrorHandler(t -> log.error("membership bus listener error: {}", t.toString(), t));
        return container;
    }

    /**
     * One listener thread, so membership events are stored and broadcast in bus order.
     */
    @Bean
    public ThreadPoolTaskExecutor membershipBusExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix(LISTENER_THREAD_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
