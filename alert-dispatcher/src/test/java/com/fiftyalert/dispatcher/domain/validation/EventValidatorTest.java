package com.fiftyalert.dispatcher.domain.validation;

import com.fiftyalert.common.event.ScoringEvent;
import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class EventValidatorTest {

    // 2024-01-11 07:00 in New York, still 2024-01-11 in UTC
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-11T12:00:00Z"), ZoneOffset.UTC);

    private final EventValidator validator = new EventValidator(DispatchPolicy.defaults(), CLOCK);

    private static ScoringEvent event() {
        return ScoringEvent.builder()
                .date("2024-01-10")
                .player("A. Player")
                .team("LAL")
                .points(50)
                .opponent("BOS")
                .build();
    }

    @Test
    void shouldAcceptWellFormedEvent() {
        assertThat(validator.validate(event())).isEmpty();
    }

    @Test
    void shouldReportEveryViolationAtOnce() {
        // given
        var broken = event().toBuilder().player(" ").points(null).date(null).team(null).build();

        // when
        var violations = validator.validate(broken);

        // then
        assertThat(violations).containsExactly(
                "player is missing",
                "points is missing or not an integer",
                "date is missing",
                "team is missing");
    }

    @Nested
    class Points {

        @Test
        void shouldAcceptBoundaries() {
            assertThat(validator.validate(event().toBuilder().points(50).build())).isEmpty();
            assertThat(validator.validate(event().toBuilder().points(100).build())).isEmpty();
        }

        @Test
        void shouldRejectImpossibleTotal() {
            var violations = validator.validate(event().toBuilder().points(101).build());

            assertThat(violations).singleElement().asString().contains("impossible");
        }

        @Test
        void shouldRejectTotalBelowThreshold() {
            var violations = validator.validate(event().toBuilder().points(49).build());

            assertThat(violations).containsExactly("points 49 is below 50");
        }
    }

    @Nested
    class Dates {

        @Test
        void shouldRejectFutureDate() {
            var violations = validator.validate(event().toBuilder().date("2024-01-12").build());

            assertThat(violations).singleElement().asString().contains("in the future");
        }

        @Test
        void shouldAcceptToday() {
            assertThat(validator.validate(event().toBuilder().date("2024-01-11").build())).isEmpty();
        }

        @Test
        void shouldRejectDateBeforeSeasonStart() {
            var violations = validator.validate(event().toBuilder().date("2023-09-30").build());

            assertThat(violations).singleElement().asString().contains("before the season start 2023-10-01");
        }

        @Test
        void shouldRejectNonCalendarDate() {
            assertThat(validator.validate(event().toBuilder().date("2024-02-30").build()))
                    .containsExactly("date '2024-02-30' is not a yyyy-MM-dd calendar date");
            assertThat(validator.validate(event().toBuilder().date("01/10/2024").build()))
                    .containsExactly("date '01/10/2024' is not a yyyy-MM-dd calendar date");
        }

        @Test
        void shouldUseReferenceZoneForToday() {
            // 2024-01-11 02:00 UTC is still 2024-01-10 in New York
            var lateEvening = Clock.fixed(Instant.parse("2024-01-11T02:00:00Z"), ZoneOffset.UTC);
            var eastern = new EventValidator(DispatchPolicy.defaults(), lateEvening);

            assertThat(eastern.today()).isEqualTo(LocalDate.of(2024, 1, 10));
            assertThat(eastern.validate(event().toBuilder().date("2024-01-11").build()))
                    .singleElement().asString().contains("in the future");
        }

        @Test
        void shouldStartSeasonInCurrentYearFromOctober() {
            assertThat(validator.seasonStart(LocalDate.of(2024, 11, 2))).isEqualTo(LocalDate.of(2024, 10, 1));
            assertThat(validator.seasonStart(LocalDate.of(2024, 10, 1))).isEqualTo(LocalDate.of(2024, 10, 1));
            assertThat(validator.seasonStart(LocalDate.of(2024, 4, 20))).isEqualTo(LocalDate.of(2023, 10, 1));
        }
    }

    @Nested
    class Teams {

        @Test
        void shouldAcceptTwoToFourUppercaseLetters() {
            assertThat(validator.validate(event().toBuilder().team("NY").build())).isEmpty();
            assertThat(validator.validate(event().toBuilder().team("PHIL").build())).isEmpty();
        }

        @Test
        void shouldRejectMalformedCodes() {
            assertThat(validator.validate(event().toBuilder().team("lal").build())).hasSize(1);
            assertThat(validator.validate(event().toBuilder().team("L").build())).hasSize(1);
            assertThat(validator.validate(event().toBuilder().team("LAKERS").build())).hasSize(1);
            assertThat(validator.validate(event().toBuilder().team("L4L").build())).hasSize(1);
        }
    }
}
