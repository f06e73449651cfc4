package io.agentflow.scheduler;

import io.agentflow.error.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Five-field (minute hour day-of-month month day-of-week) cron evaluated with Quartz. Day of week
 * uses 0-7 with Sunday as 0 or 7; the fields are translated to Quartz's seconds-first syntax.
 */
public final class QuartzCronOccurrence implements NextOccurrence {
    static final QuartzCronOccurrence INSTANCE = new QuartzCronOccurrence();
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    @Override
    public Optional<Instant> next(String expression, ZoneId zone, Instant after) {
        CronExpression cron = parse(expression);
        cron.setTimeZone(TimeZone.getTimeZone(zone == null ? ZoneId.of("UTC") : zone));
        Date next = cron.getNextValidTimeAfter(Date.from(after));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    static String toQuartz(String expression) {
        String[] f = CronFields.split(expression);
        String dayOfMonth = f[2];
        String dayOfWeek = f[4];
        if ("*".equals(dayOfWeek) || "?".equals(dayOfWeek)) {
            dayOfWeek = "?";
        } else if ("*".equals(dayOfMonth) || "?".equals(dayOfMonth)) {
            dayOfMonth = "?";
            dayOfWeek = shiftDaysOfWeek(dayOfWeek);
        } else {
            throw new ValidationException("Cron expressions restricting both day-of-month and day-of-week are not supported");
        }
        return "0 " + f[0] + " " + f[1] + " " + dayOfMonth + " " + f[3] + " " + dayOfWeek;
    }

    private static CronExpression parse(String expression) {
        String quartz = toQuartz(expression);
        try {
            return new CronExpression(quartz);
        } catch (ParseException e) {
            throw new ValidationException("Invalid cron expression: " + e.getMessage(), e);
        }
    }

    // Quartz numbers days 1-7 from Sunday; step values after '/' are left alone.
    private static String shiftDaysOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        String[] items = field.split(",", -1);
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            int slash = item.indexOf('/');
            String base = slash < 0 ? item : item.substring(0, slash);
            String step = slash < 0 ? "" : item.substring(slash);
            Matcher m = NUMBER.matcher(base);
            StringBuilder shifted = new StringBuilder();
            while (m.find()) {
                int day = Integer.parseInt(m.group());
                if (day > 7) {
                    throw new ValidationException("Invalid day of week: " + day);
                }
                m.appendReplacement(shifted, Integer.toString(day % 7 + 1));
            }
            m.appendTail(shifted);
            out.append(shifted).append(step);
        }
        return out.toString();
    }
}
