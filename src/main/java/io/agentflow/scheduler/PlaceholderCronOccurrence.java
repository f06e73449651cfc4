package io.agentflow.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Checks only the field count and plans a single run one minute out per materialization.
 */
public final class PlaceholderCronOccurrence implements NextOccurrence {
    static final PlaceholderCronOccurrence INSTANCE = new PlaceholderCronOccurrence();
    private static final Duration DELAY = Duration.ofMinutes(1);

    @Override
    public Optional<Instant> next(String expression, ZoneId zone, Instant after) {
        return Optional.of(after.plus(DELAY));
    }

    @Override
    public void validate(String expression) {
        CronFields.split(expression);
    }

    @Override
    public List<Instant> upcoming(String expression, ZoneId zone, Instant after, Instant horizon, int limit) {
        Instant next = after.plus(DELAY);
        if (limit < 1 || next.isAfter(horizon)) {
            return List.of();
        }
        return List.of(next);
    }
}
