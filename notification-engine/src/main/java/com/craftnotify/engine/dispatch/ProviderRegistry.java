package com.craftnotify.engine.dispatch;

import com.craftnotify.common.channel.NotificationChannel;
import com.craftnotify.engine.provider.NotificationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registered providers grouped by channel and sorted by priority.
 * 
 * Built once from the provider beans present at startup (which ones exist is
 * decided by configuration) and read-only afterwards, so concurrent reads
 * need no locking.
 */
@Component
@Slf4j
public class ProviderRegistry {

    private static final Comparator<NotificationProvider> BY_PRIORITY =
        Comparator.comparingInt(NotificationProvider::priority)
            .thenComparing(provider -> provider.name().name());

    private final Map<NotificationChannel, List<NotificationProvider>> providersByChannel;

    @Autowired
    public ProviderRegistry(ObjectProvider<NotificationProvider> providers) {
        this(providers.stream().collect(Collectors.toList()));
    }

    public ProviderRegistry(Collection<NotificationProvider> providers) {
        Map<NotificationChannel, List<NotificationProvider>> grouped = new EnumMap<>(NotificationChannel.class);
        for (NotificationProvider provider : providers) {
            grouped.computeIfAbsent(provider.channel(), channel -> new ArrayList<>()).add(provider);
        }
        Map<NotificationChannel, List<NotificationProvider>> sorted = new EnumMap<>(NotificationChannel.class);
        grouped.forEach((channel, list) -> {
            list.sort(BY_PRIORITY);
            sorted.put(channel, List.copyOf(list));
        });
        this.providersByChannel = Collections.unmodifiableMap(sorted);

        sorted.forEach((channel, list) -> log.info("Channel {} providers: {}", channel,
            list.stream().map(p -> p.name().toConfigValue() + "(" + p.priority() + ")").collect(Collectors.joining(", "))));
    }

    /**
     * Candidates for a channel, lowest priority value first. Empty if none is registered.
     */
    public List<NotificationProvider> providersFor(NotificationChannel channel) {
        return providersByChannel.getOrDefault(channel, List.of());
    }

    public Set<NotificationChannel> supportedChannels() {
        return providersByChannel.keySet();
    }
}
