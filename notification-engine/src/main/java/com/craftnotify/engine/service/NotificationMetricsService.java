package com.craftnotify.engine.service;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.common.provider.DeliveryResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for notification delivery.
 * 
 * Tracks:
 * - delivery attempts per channel, split by success / failure
 * - provider call duration per channel
 * - notifications created, scheduled and blocked by preferences
 * 
 * ⚠️ PERFORMANCE: meters are created once in @PostConstruct and kept in maps
 * keyed by channel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationMetricsService {

    private final MeterRegistry meterRegistry;

    private final Map<NotificationChannel, Counter> deliverySuccessCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Counter> deliveryFailureCounters = new EnumMap<>(NotificationChannel.class);
    private final Map<NotificationChannel, Timer> deliveryTimers = new EnumMap<>(NotificationChannel.class);

    private Counter createdCounter;
    private Counter scheduledCounter;
    private Counter blockedCounter;

    @PostConstruct
    void init() {
        for (NotificationChannel channel : NotificationChannel.values()) {
            deliverySuccessCounters.put(channel, Counter.builder("notification.delivery.success")
                .description("Delivery attempts accepted by a provider")
                .tag("channel", channel.name())
                .register(meterRegistry));

            deliveryFailureCounters.put(channel, Counter.builder("notification.delivery.failure")
                .description("Delivery attempts that failed, including channels without an eligible provider")
                .tag("channel", channel.name())
                .register(meterRegistry));

            deliveryTimers.put(channel, Timer.builder("notification.delivery.duration")
                .description("Time spent in provider send calls")
                .tag("channel", channel.name())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        }

        createdCounter = Counter.builder("notification.created")
            .description("Notifications created through send")
            .register(meterRegistry);
        scheduledCounter = Counter.builder("notification.scheduled")
            .description("Notifications queued for later delivery")
            .register(meterRegistry);
        blockedCounter = Counter.builder("notification.blocked")
            .description("Notifications with no channel left after preference resolution")
            .register(meterRegistry);

        log.info("Initialized delivery metrics for {} channels", NotificationChannel.values().length);
    }

    public void recordDeliveryAttempt(NotificationChannel channel, DeliveryResult result) {
        if (result.isSuccess()) {
            deliverySuccessCounters.get(channel).increment();
        } else {
            deliveryFailureCounters.get(channel).increment();
        }
        deliveryTimers.get(channel).record(result.durationMs(), TimeUnit.MILLISECONDS);
    }

    public void recordCreated() {
        createdCounter.increment();
    }

    public void recordScheduled() {
        scheduledCounter.increment();
    }

    public void recordBlocked() {
        blockedCounter.increment();
    }
}
