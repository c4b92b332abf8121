package com.example.realtime.config;

import com.example.realtime.event.ChangeEventSource;
import com.example.realtime.event.ChangeListener;
import com.example.realtime.event.PostgresChangeEventSource;
import com.example.realtime.event.ReconnectPolicy;
import com.example.realtime.websocket.RoomRegistry;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class RealtimeModuleConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public RoomRegistry roomRegistry() {
        return new RoomRegistry();
    }

    @Bean
    public ChangeEventSource changeEventSource(RealtimeProperties properties, DataSourceProperties dataSourceProperties) {
        RealtimeProperties.Listener listener = properties.getListener();
        boolean ownUrl = StringUtils.hasText(listener.getUrl());
        return new PostgresChangeEventSource(
                ownUrl ? listener.getUrl() : dataSourceProperties.determineUrl(),
                ownUrl ? listener.getUsername() : dataSourceProperties.determineUsername(),
                ownUrl ? listener.getPassword() : dataSourceProperties.determinePassword());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService changeListenerScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemon("change-listener-reconnect"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService changeListenerReceiver() {
        return Executors.newSingleThreadExecutor(namedDaemon("change-listener-receive"));
    }

    @Bean
    public ChangeListener changeListener(
            ChangeEventSource changeEventSource,
            ObjectMapper objectMapper,
            @Qualifier("changeListenerScheduler") ScheduledExecutorService scheduler,
            @Qualifier("changeListenerReceiver") ExecutorService receiver,
            RealtimeProperties properties) {
        RealtimeProperties.Listener listener = properties.getListener();
        ReconnectPolicy reconnectPolicy = new ReconnectPolicy(
                listener.getReconnectDelay(),
                listener.getReconnectMultiplier(),
                listener.getReconnectMaxDelay(),
                listener.getReconnectJitter());
        return new ChangeListener(
                changeEventSource,
                objectMapper,
                scheduler,
                receiver,
                reconnectPolicy,
                listener.getPollTimeout(),
                listener.getDisconnectTimeout());
    }

    @Bean
    public ThreadPoolTaskExecutor pushExecutor(RealtimeProperties properties) {
        int threads = Math.max(1, properties.getPush().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("push-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.max(1, properties.getShutdownTimeout().toSeconds()));
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor authExecutor(RealtimeProperties properties) {
        int threads = Math.max(1, properties.getAuth().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("handshake-");
        return executor;
    }

    private static ThreadFactory namedDaemon(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
