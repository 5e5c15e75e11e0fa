package com.cleanbear.assignment.config;

import com.cleanbear.assignment.model.SystemRules;
import com.cleanbear.assignment.repository.KakaoDirectionsClient;
import com.cleanbear.assignment.service.DistanceProvider;
import com.cleanbear.assignment.service.KakaoDistanceProvider;
import com.cleanbear.assignment.service.StraightLineDistanceProvider;
import com.cleanbear.assignment.service.TravelTimeLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.LocalTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
public class AssignmentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentConfig.class);

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${http.connect-timeout-ms:3000}") long connectTimeoutMs,
                                     @Value("${http.read-timeout-ms:10000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    /**
     * Rules used when a request sends no {@code system_rules}, and the base for partial overrides.
     */
    @Bean
    public SystemRules defaultSystemRules(@Value("${assignment.work-start:09:00}") String workStart,
                                          @Value("${assignment.work-end:18:00}") String workEnd,
                                          @Value("${assignment.max-preassign-days:3}") int maxPreassignDays,
                                          @Value("${assignment.default-buffer-min:30}") int defaultBufferMin) {
        return new SystemRules(LocalTime.parse(workStart), LocalTime.parse(workEnd),
                maxPreassignDays, defaultBufferMin);
    }

    @Bean
    public DistanceProvider distanceProvider(KakaoDirectionsClient directionsClient,
                                             @Value("${kakao.retry-count:2}") int retryCount,
                                             @Value("${kakao.retry-backoff-ms:500}") long retryBackoffMs,
                                             @Value("${distance.cache-size:1000}") long cacheSize,
                                             @Value("${distance.cache-ttl-minutes:30}") long cacheTtlMinutes,
                                             @Value("${distance.average-speed-kmh:30}") double averageSpeedKmh) {
        if (directionsClient.isConfigured()) {
            logger.info("Using Kakao directions for travel times");
            return new KakaoDistanceProvider(directionsClient, retryCount, retryBackoffMs,
                    cacheSize, Duration.ofMinutes(cacheTtlMinutes));
        }
        logger.warn("kakao.api-key is not set; using straight-line travel times at {} km/h", averageSpeedKmh);
        return new StraightLineDistanceProvider(averageSpeedKmh);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService distanceExecutor(@Value("${distance.parallelism:8}") int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "distance-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, parallelism), threads);
    }

    @Bean
    public TravelTimeLookup travelTimeLookup(DistanceProvider distanceProvider,
                                             @Qualifier("distanceExecutor") ExecutorService distanceExecutor,
                                             @Value("${distance.timeout-ms:12000}") long timeoutMs) {
        return new TravelTimeLookup(distanceProvider, distanceExecutor, timeoutMs);
    }
}
