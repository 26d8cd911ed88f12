package com.example.mediacatalog_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Outbound HTTP client and lane thread pool for webhook delivery.
 */
@Configuration
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookClientConfig {

    @Bean("webhookWebClient")
    public WebClient webhookWebClient(WebhookProperties props) {
        var to = Duration.ofSeconds(props.getAttemptTimeoutSeconds());
        int toSec = (int) Math.max(1, to.getSeconds());

        HttpClient http = HttpClient.create()
                .responseTimeout(to)
                .followRedirect(false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, props.getConnectTimeoutMs())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(toSec))
                        .addHandlerLast(new WriteTimeoutHandler(toSec))
                );

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean(name = "webhookLaneExecutor")
    public ThreadPoolTaskExecutor webhookLaneExecutor(WebhookProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, props.getLaneThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(props.getLaneQueueCapacity());
        executor.setThreadNamePrefix("webhook-lane-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
