package com.pulse.forecast.service.feature;

import com.pulse.forecast.config.ForecastProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class MarketCalendarTest {

    private final MarketCalendar calendar = new MarketCalendar(new ForecastProperties());

    @Test
    void cycleDateFollowsSydneyClock() {
        // 18:00 and 01:00 next day in Sydney (AEDT, UTC+11)
        assertThat(calendar.cycleDate(Instant.parse("2024-03-13T07:00:00Z"))).isEqualTo(LocalDate.of(2024, 3, 13));
        assertThat(calendar.cycleDate(Instant.parse("2024-03-13T14:00:00Z"))).isEqualTo(LocalDate.of(2024, 3, 14));
    }

    @Test
    void openingHourOnWednesday() {
        MarketCalendar.CalendarTerms terms = calendar.termsAt(Instant.parse("2024-03-12T23:30:00Z"));

        assertThat(terms.marketHours()).isTrue();
        assertThat(terms.openingHour()).isTrue();
        assertThat(terms.closingHour()).isFalse();
        assertThat(terms.dayOfWeek()).isEqualTo(3);
        assertThat(terms.monday()).isFalse();
        assertThat(terms.monthEnd()).isFalse();
    }

    @Test
    void weekendIsOutsideMarketHours() {
        MarketCalendar.CalendarTerms terms = calendar.termsAt(Instant.parse("2024-03-30T01:00:00Z"));

        assertThat(terms.marketHours()).isFalse();
        assertThat(terms.dayOfWeek()).isEqualTo(6);
        assertThat(terms.monthEnd()).isTrue();
        assertThat(terms.quarterEnd()).isTrue();
    }

    @Test
    void lastTradingHourIsClosingHour() {
        MarketCalendar.CalendarTerms terms = calendar.termsAt(Instant.parse("2024-03-15T04:10:00Z"));

        assertThat(terms.closingHour()).isTrue();
        assertThat(terms.friday()).isTrue();
        assertThat(terms.marketHours()).isTrue();
    }

    @Test
    void nextSessionStartSkipsClosedHoursAndWeekends() {
        // Wednesday 11:00, Wednesday 08:00, Friday 17:00 and Saturday 10:00 in Sydney
        Instant open = Instant.parse("2024-03-13T00:00:00Z");
        assertThat(calendar.nextSessionStart(open)).isEqualTo(open);
        assertThat(calendar.nextSessionStart(Instant.parse("2024-03-12T21:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-12T23:00:00Z"));
        assertThat(calendar.nextSessionStart(Instant.parse("2024-03-15T06:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-17T23:00:00Z"));
        assertThat(calendar.nextSessionStart(Instant.parse("2024-03-15T23:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-17T23:00:00Z"));
    }
}
