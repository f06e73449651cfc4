package io.agentflow.scheduler;

import io.agentflow.config.EngineSettings;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cron evaluation strategy: the first fire time strictly after a given instant.
 */
public interface NextOccurrence {
    Optional<Instant> next(String expression, ZoneId zone, Instant after);

    /**
     * @throws io.agentflow.error.ValidationException when the expression cannot be evaluated
     */
    void validate(String expression);

    /**
     * Fire times in {@code (after, horizon]}, at most {@code limit} of them.
     */
    default List<Instant> upcoming(String expression, ZoneId zone, Instant after, Instant horizon, int limit) {
        List<Instant> out = new ArrayList<>();
        Instant cursor = after;
        while (out.size() < limit) {
            Optional<Instant> next = next(expression, zone, cursor);
            if (next.isEmpty() || next.get().isAfter(horizon) || !next.get().isAfter(cursor)) {
                break;
            }
            out.add(next.get());
            cursor = next.get();
        }
        return out;
    }

    static NextOccurrence forStrategy(String name) {
        if (EngineSettings.CRON_PLACEHOLDER.equalsIgnoreCase(name)) {
            return PlaceholderCronOccurrence.INSTANCE;
        }
        return QuartzCronOccurrence.INSTANCE;
    }
}
