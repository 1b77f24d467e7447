package com.example.cronengine.domain;

import com.example.cronengine.exception.InvalidScheduleException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleTest {

    private static final Instant MONDAY_10_15 = Instant.parse("2024-01-01T10:15:00Z");

    @ParameterizedTest
    @ValueSource(strings = {"0 0 * * *", "*/15 * * * *", "0 2 * * 0", "0 2 * * 7", "0,30 8-18/2 1-15 1,6,12 1-5"})
    void acceptsFiveFieldExpressions(String expr) {
        assertThat(CronSchedule.isValid(expr)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"* * *", "99 * * * *", "a b c d e", "5-1 * * * *", "*/0 * * * *",
            "5/10 * * * *", "1,,2 * * * *", "0 24 * * *", "0 0 0 * *", "0 0 * 13 *", "0 0 * * 8",
            "0 0 * * MON", "0 0 ? * *", "0 0 * * * *"})
    void rejectsMalformedExpressions(String expr) {
        assertThat(CronSchedule.isValid(expr)).isFalse();
    }

    @Test
    void rejectsEmptyExpression() {
        assertThatThrownBy(() -> CronSchedule.parse("  "))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("empty");
        assertThat(CronSchedule.isValid(null)).isFalse();
    }

    @Test
    void errorNamesTheOffendingField() {
        assertThatThrownBy(() -> CronSchedule.parse("99 * * * *"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageStartingWith("Invalid cron schedule '99 * * * *'")
                .hasMessageContaining("minute");
    }

    @Test
    void normalizesWhitespace() {
        CronSchedule s = CronSchedule.parse("  0   0 * *  * ");

        assertThat(s.getExpression()).isEqualTo("0 0 * * *");
        assertThat(s.toSpringExpression()).isEqualTo("0 0 0 * * *");
    }

    @Test
    void nextDailyMidnightInUtc() {
        assertThat(CronSchedule.parse("0 0 * * *").next(MONDAY_10_15, ZoneOffset.UTC))
                .contains(Instant.parse("2024-01-02T00:00:00Z"));
    }

    @Test
    void nextIsStrictlyAfterReference() {
        assertThat(CronSchedule.parse("*/15 * * * *").next(MONDAY_10_15, ZoneOffset.UTC))
                .contains(Instant.parse("2024-01-01T10:30:00Z"));
    }

    @Test
    void sundayIsZeroOrSeven() {
        Instant expected = Instant.parse("2024-01-07T02:00:00Z");

        assertThat(CronSchedule.parse("0 2 * * 0").next(MONDAY_10_15, ZoneOffset.UTC)).contains(expected);
        assertThat(CronSchedule.parse("0 2 * * 7").next(MONDAY_10_15, ZoneOffset.UTC)).contains(expected);
    }

    @Test
    void evaluatesInGivenZone() {
        assertThat(CronSchedule.parse("0 2 * * *").next(Instant.parse("2024-01-01T00:00:00Z"), ZoneId.of("Europe/Berlin")))
                .contains(Instant.parse("2024-01-01T01:00:00Z"));
    }
}
