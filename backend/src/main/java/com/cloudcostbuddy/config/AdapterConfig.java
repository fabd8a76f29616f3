package com.cloudcostbuddy.config;

import com.cloudcostbuddy.adapters.ProviderCostReader;
import com.cloudcostbuddy.domain.model.CloudProvider;
import com.cloudcostbuddy.notification.LoggingNotificationDispatcher;
import com.cloudcostbuddy.notification.NotificationDispatcher;
import com.cloudcostbuddy.notification.WebhookNotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Wiring of provider readers, worker pools and notification delivery.
 */
@Configuration
@Slf4j
public class AdapterConfig {

    @Bean
    public Map<CloudProvider, ProviderCostReader> costReaders(ObjectProvider<ProviderCostReader> readers) {
        Map<CloudProvider, ProviderCostReader> byProvider = new EnumMap<>(CloudProvider.class);
        readers.orderedStream().forEach(reader -> {
            ProviderCostReader previous = byProvider.putIfAbsent(reader.getProvider(), reader);
            if (previous != null) {
                throw new IllegalStateException("Two cost readers registered for " + reader.getProvider()
                        + ": " + previous.getClass().getName() + " and " + reader.getClass().getName());
            }
        });
        if (byProvider.isEmpty()) {
            log.warn("No provider cost readers registered; every provider will report NO_READER");
        } else {
            log.info("Registered cost readers for {}", byProvider.keySet());
        }
        return Collections.unmodifiableMap(byProvider);
    }

    /**
     * Pool for provider reads. Sized so every provider of a few concurrent
     * rules can be read at once.
     */
    @Bean(name = "providerReadExecutor")
    public Executor providerReadExecutor(EngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getProviderReadThreads());
        executor.setMaxPoolSize(properties.getProviderReadThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ProviderRead-");
        executor.initialize();
        return executor;
    }

    /**
     * Pool for rule evaluation. The evaluator never has more rules in flight
     * than threads, so the queue only absorbs hand-over races.
     */
    @Bean(name = "alertEvaluationExecutor")
    public Executor alertEvaluationExecutor(EngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getEvaluationParallelism());
        executor.setMaxPoolSize(properties.getEvaluationParallelism());
        executor.setQueueCapacity(properties.getEvaluationParallelism());
        executor.setThreadNamePrefix("AlertEval-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, EngineProperties properties) {
        return builder
                .setConnectTimeout(properties.getNotification().getWebhookTimeout())
                .setReadTimeout(properties.getNotification().getWebhookTimeout())
                .build();
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(RestTemplate restTemplate, EngineProperties properties) {
        String webhookUrl = properties.getNotification().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("No notification webhook configured, alerts are written to the log");
            return new LoggingNotificationDispatcher();
        }
        log.info("Delivering alert notifications to {}", webhookUrl);
        return new WebhookNotificationDispatcher(restTemplate, webhookUrl);
    }
}
