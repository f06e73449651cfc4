package io.agentflow.scheduler;

import io.agentflow.config.EngineSettings;
import io.agentflow.error.ValidationException;
import io.agentflow.model.NotificationPreferences;
import io.agentflow.model.ScheduleConfig;
import io.agentflow.model.ScheduleType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

final class CronOccurrenceTest {
    private static final Instant MONDAY_MORNING = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    void weekdayCronSkipsTheWeekend() {
        NextOccurrence cron = NextOccurrence.forStrategy(EngineSettings.CRON_QUARTZ);
        Instant fridayAfterRun = Instant.parse("2026-03-06T10:00:00Z");
        Assertions.assertEquals(Instant.parse("2026-03-09T09:30:00Z"),
                cron.next("30 9 * * 1-5", ZoneOffset.UTC, fridayAfterRun).orElseThrow());
    }

    @Test
    void sundayMayBeWrittenAsZeroOrSeven() {
        NextOccurrence cron = QuartzCronOccurrence.INSTANCE;
        Instant expected = Instant.parse("2026-03-08T00:00:00Z");
        Assertions.assertEquals(expected, cron.next("0 0 * * 0", ZoneOffset.UTC, MONDAY_MORNING).orElseThrow());
        Assertions.assertEquals(expected, cron.next("0 0 * * 7", ZoneOffset.UTC, MONDAY_MORNING).orElseThrow());
        Assertions.assertEquals("0 0 0 ? * 1,3/2", QuartzCronOccurrence.toQuartz("0 0 * * 0,2/2"));
    }

    @Test
    void fireTimesFollowTheScheduleTimezone() {
        Instant next = QuartzCronOccurrence.INSTANCE
                .next("0 9 * * *", ZoneId.of("America/New_York"), Instant.parse("2026-03-02T00:00:00Z"))
                .orElseThrow();
        Assertions.assertEquals(Instant.parse("2026-03-02T14:00:00Z"), next);
    }

    @Test
    void upcomingStopsAtHorizonAndLimit() {
        NextOccurrence cron = QuartzCronOccurrence.INSTANCE;
        Instant horizon = MONDAY_MORNING.plusSeconds(2 * 3600);
        List<Instant> all = cron.upcoming("*/30 * * * *", ZoneOffset.UTC, MONDAY_MORNING, horizon, 10);
        Assertions.assertEquals(List.of(
                Instant.parse("2026-03-02T10:30:00Z"),
                Instant.parse("2026-03-02T11:00:00Z"),
                Instant.parse("2026-03-02T11:30:00Z"),
                Instant.parse("2026-03-02T12:00:00Z")), all);
        Assertions.assertEquals(2, cron.upcoming("*/30 * * * *", ZoneOffset.UTC, MONDAY_MORNING, horizon, 2).size());
    }

    @Test
    void malformedExpressionsAreValidationErrors() {
        NextOccurrence cron = QuartzCronOccurrence.INSTANCE;
        ValidationException fields = Assertions.assertThrows(ValidationException.class, () -> cron.validate("0 9 * *"));
        Assertions.assertEquals("Invalid cron expression format", fields.getMessage());
        Assertions.assertThrows(ValidationException.class, () -> cron.validate("0 0 1 * 1"));
        Assertions.assertThrows(ValidationException.class, () -> cron.validate("61 * * * *"));
        Assertions.assertThrows(ValidationException.class, () -> cron.validate("0 0 * * 8"));
        Assertions.assertThrows(ValidationException.class, () -> cron.validate(" "));
    }

    @Test
    void placeholderPlansOneRunAMinuteOut() {
        NextOccurrence placeholder = NextOccurrence.forStrategy("PLACEHOLDER");
        placeholder.validate("anything goes here ok");
        Assertions.assertThrows(ValidationException.class, () -> placeholder.validate("too few"));
        Assertions.assertEquals(List.of(MONDAY_MORNING.plusSeconds(60)),
                placeholder.upcoming("* * * * *", ZoneOffset.UTC, MONDAY_MORNING, MONDAY_MORNING.plusSeconds(3600), 50));
        Assertions.assertTrue(placeholder.upcoming("* * * * *", ZoneOffset.UTC, MONDAY_MORNING, MONDAY_MORNING.plusSeconds(30), 50).isEmpty());
    }

    @Test
    void validatorEnforcesTriggerShape() {
        NextOccurrence cron = QuartzCronOccurrence.INSTANCE;
        ScheduleValidator.validate(ScheduleConfig.interval("echo", "dev-1", 5, 10), 5, cron);

        ValidationException tooFrequent = Assertions.assertThrows(ValidationException.class,
                () -> ScheduleValidator.validate(ScheduleConfig.interval("echo", "dev-1", 3, 10), 5, cron));
        Assertions.assertEquals("Minimum interval is 5 minutes to prevent abuse", tooFrequent.getMessage());

        ScheduleConfig mixed = new ScheduleConfig("echo", "dev-1", ScheduleType.INTERVAL, 10, "* * * * *", null,
                "UTC", true, 10, false, NotificationPreferences.defaults());
        Assertions.assertThrows(ValidationException.class, () -> ScheduleValidator.validate(mixed, 5, cron));

        ScheduleConfig webhookWithoutEndpoint = new ScheduleConfig("echo", "dev-1", ScheduleType.WEBHOOK_TRIGGER, null, null, " ",
                "UTC", true, 10, false, NotificationPreferences.defaults());
        Assertions.assertThrows(ValidationException.class, () -> ScheduleValidator.validate(webhookWithoutEndpoint, 5, cron));

        ScheduleConfig badZone = new ScheduleConfig("echo", "dev-1", ScheduleType.CRON, null, "0 9 * * *", null,
                "Mars/Olympus", true, 10, false, NotificationPreferences.defaults());
        Assertions.assertThrows(ValidationException.class, () -> ScheduleValidator.validate(badZone, 5, cron));

        Assertions.assertThrows(ValidationException.class,
                () -> ScheduleValidator.validate(ScheduleConfig.cron("echo", "dev-1", "0 9 * * *", 0), 5, cron));
        Assertions.assertThrows(ValidationException.class,
                () -> ScheduleValidator.validate(ScheduleConfig.cron("", "dev-1", "0 9 * * *", 1), 5, cron));
    }
}
