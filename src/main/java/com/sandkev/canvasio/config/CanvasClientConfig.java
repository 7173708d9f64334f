package com.sandkev.canvasio.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.canvasio.CanvasClient;
import com.sandkev.canvasio.pagination.PaginationAggregator;
import com.sandkev.canvasio.quota.QuotaMonitor;
import com.sandkev.canvasio.scheduler.RequestScheduler;
import com.sandkev.canvasio.scheduler.SchedulerSettings;
import com.sandkev.canvasio.shared.http.CanvasTransport;
import com.sandkev.canvasio.shared.http.WebClientCanvasTransport;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(CanvasClientConfig.CanvasClientProperties.class)
@RequiredArgsConstructor
public class CanvasClientConfig {

    private final CanvasClientProperties props;

    @Bean("canvasWebClient")
    @Qualifier("canvasWebClient")
    public WebClient canvasWebClient() {
        HttpClient http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(props.timeoutMs()))
                .compress(true);
        var builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http));
        if (props.apiToken() != null && !props.apiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiToken());
        }
        return builder.build();
    }

    @Bean
    public CanvasTransport canvasTransport(@Qualifier("canvasWebClient") WebClient canvasWebClient) {
        return new WebClientCanvasTransport(canvasWebClient, props.resolvedBaseUrl());
    }

    @Bean
    public QuotaMonitor canvasQuotaMonitor() {
        return new QuotaMonitor(props.rateLimitBuffer(), props.checkStatusInterval());
    }

    @Bean(destroyMethod = "close")
    public RequestScheduler canvasRequestScheduler(CanvasTransport canvasTransport, QuotaMonitor canvasQuotaMonitor, ObjectMapper objectMapper) {
        return new RequestScheduler(canvasTransport, canvasQuotaMonitor, props.schedulerSettings(), objectMapper);
    }

    @Bean
    public PaginationAggregator canvasPaginationAggregator(RequestScheduler canvasRequestScheduler) {
        return new PaginationAggregator(canvasRequestScheduler);
    }

    @Bean
    public CanvasClient canvasClient(RequestScheduler canvasRequestScheduler,
                                     PaginationAggregator canvasPaginationAggregator,
                                     ObjectMapper objectMapper) {
        return new CanvasClient(canvasRequestScheduler, canvasPaginationAggregator, objectMapper, props.perPage());
    }

    @ConfigurationProperties("canvas.client")
    public record CanvasClientProperties(
            String subdomain,           // e.g. byui -> https://byui.instructure.com
            String baseUrl,             // overrides subdomain when set
            String apiToken,
            @DefaultValue("300") double rateLimitBuffer,
            @DefaultValue("30") int callLimit,
            @DefaultValue("PT0.05S") Duration minSendInterval,
            @DefaultValue("PT2S") Duration checkStatusInterval,
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("20") int maxQuotaRetries,
            @DefaultValue("100") int perPage,
            @DefaultValue("30000") int timeoutMs,
            @DefaultValue("/api/v1/users/self") String statusPath
    ) {

        public String resolvedBaseUrl() {
            if (baseUrl != null && !baseUrl.isBlank()) return baseUrl;
            if (subdomain == null || subdomain.isBlank()) {
                throw new IllegalStateException("canvas.client.subdomain or canvas.client.base-url must be set");
            }
            return "https://" + subdomain + ".instructure.com";
        }

        public SchedulerSettings schedulerSettings() {
            return new SchedulerSettings(callLimit, minSendInterval, maxAttempts, maxQuotaRetries, statusPath);
        }
    }
}
