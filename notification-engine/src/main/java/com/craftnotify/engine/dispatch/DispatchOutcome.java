package com.craftnotify.engine.dispatch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Attempts made for one notification, in the order they ran.
 * 
 * @param attempts One entry per channel that was started
 * @param interrupted True when the calling thread was interrupted and some channels were skipped
 */
public record DispatchOutcome(
    List<DeliveryAttempt> attempts,
    boolean interrupted
) {
    public DispatchOutcome {
        attempts = List.copyOf(attempts);
    }

    public static DispatchOutcome empty() {
        return new DispatchOutcome(List.of(), false);
    }

    public boolean anySuccess() {
        return attempts.stream().anyMatch(DeliveryAttempt::isSuccess);
    }

    /**
     * Failed attempts joined as "CHANNEL: error; CHANNEL: error", or null when nothing failed.
     */
    public String failureSummary() {
        String summary = attempts.stream()
            .filter(attempt -> !attempt.isSuccess())
            .map(attempt -> attempt.channel() + ": " + attempt.result().getErrorMessage())
            .collect(Collectors.joining("; "));
        return summary.isEmpty() ? null : summary;
    }
}
