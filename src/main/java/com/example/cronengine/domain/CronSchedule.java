package com.example.cronengine.domain;

import com.example.cronengine.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 五段 cron 表达式：分 时 日 月 周。
 * <p>
 * 每段是逗号分隔的 {@code *}、{@code *}/n、n、a-b、a-b/n。
 * 不支持名字（JAN、MON）以及 {@code ?}、{@code L}、{@code #}。
 * 周的 0 和 7 都表示周日。触发时间由 Spring 的 {@link CronExpression}（六段，秒在前）计算，
 * 因此日和周同时限定时按 AND 组合。
 */
public final class CronSchedule {

    private static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};
    private static final int[] MIN = {0, 0, 1, 1, 0};
    private static final int[] MAX = {59, 23, 31, 12, 7};

    private static final Pattern PART = Pattern.compile("^(\\*|\\d{1,4}|\\d{1,4}-\\d{1,4})(?:/(\\d{1,4}))?$");

    private final String expression;
    private final CronExpression cron;

    private CronSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new InvalidScheduleException(String.valueOf(expression), "expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(expression, "expected 5 fields but found " + fields.length);
        }
        for (int i = 0; i < fields.length; i++) {
            validateField(expression, i, fields[i]);
        }
        String normalized = String.join(" ", fields);
        try {
            return new CronSchedule(normalized, CronExpression.parse("0 " + normalized));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e.getMessage());
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    private static void validateField(String expression, int index, String field) {
        String name = FIELD_NAMES[index];
        if (field.startsWith(",") || field.endsWith(",")) {
            throw new InvalidScheduleException(expression, "empty list element in " + name);
        }
        for (String part : field.split(",")) {
            Matcher m = PART.matcher(part);
            if (!m.matches()) {
                throw new InvalidScheduleException(expression, "unsupported " + name + " value '" + part + "'");
            }
            String base = m.group(1);
            if (!"*".equals(base)) {
                int dash = base.indexOf('-');
                if (dash < 0) {
                    if (m.group(2) != null) {
                        throw new InvalidScheduleException(expression, "step needs '*' or a range in " + name);
                    }
                    checkRange(expression, index, Integer.parseInt(base));
                } else {
                    int from = Integer.parseInt(base.substring(0, dash));
                    int to = Integer.parseInt(base.substring(dash + 1));
                    checkRange(expression, index, from);
                    checkRange(expression, index, to);
                    if (from > to) {
                        throw new InvalidScheduleException(expression, "inverted range " + base + " in " + name);
                    }
                }
            }
            if (m.group(2) != null) {
                int step = Integer.parseInt(m.group(2));
                if (step <= 0 || step > MAX[index]) {
                    throw new InvalidScheduleException(expression, "step " + step + " out of range in " + name);
                }
            }
        }
    }

    private static void checkRange(String expression, int index, int value) {
        if (value < MIN[index] || value > MAX[index]) {
            throw new InvalidScheduleException(expression, FIELD_NAMES[index] + " " + value
                    + " outside " + MIN[index] + "-" + MAX[index]);
        }
    }

    /** {@code after} 之后（不含）的第一次触发，按 {@code zone} 计算 */
    public Optional<Instant> next(Instant after, ZoneId zone) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    /** Spring {@code CronTrigger} 用的六段形式 */
    public String toSpringExpression() {
        return "0 " + expression;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
