package com.pulse.forecast.service.feature;

import com.pulse.forecast.config.ForecastProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Calendar terms evaluated in the market's own time zone.
 */
@Component
@RequiredArgsConstructor
public class MarketCalendar {

    private final ForecastProperties forecastProperties;

    public LocalDate cycleDate(Instant instant) {
        return instant.atZone(forecastProperties.zone()).toLocalDate();
    }

    public CalendarTerms termsAt(Instant instant) {
        ZonedDateTime local = instant.atZone(forecastProperties.zone());
        int hour = local.getHour();
        int open = forecastProperties.getMarketOpenHour();
        int close = forecastProperties.getMarketCloseHour();
        DayOfWeek day = local.getDayOfWeek();
        boolean weekday = isWeekday(day);
        int dayOfMonth = local.getDayOfMonth();
        boolean quarterMonth = local.getMonthValue() % 3 == 0;
        return new CalendarTerms(
                weekday && hour >= open && hour < close,
                hour == open,
                hour == close - 1,
                day == DayOfWeek.MONDAY,
                day == DayOfWeek.FRIDAY,
                day.getValue(),
                dayOfMonth >= 25,
                quarterMonth && dayOfMonth >= 25);
    }

    /**
     * {@code instant} itself during a trading session, otherwise the open of the next weekday session.
     */
    public Instant nextSessionStart(Instant instant) {
        ZonedDateTime local = instant.atZone(forecastProperties.zone());
        int open = forecastProperties.getMarketOpenHour();
        if (isWeekday(local.getDayOfWeek()) && local.getHour() >= open
                && local.getHour() < forecastProperties.getMarketCloseHour()) {
            return instant;
        }
        LocalDate date = local.getHour() < open ? local.toLocalDate() : local.toLocalDate().plusDays(1);
        while (!isWeekday(date.getDayOfWeek())) {
            date = date.plusDays(1);
        }
        return date.atTime(LocalTime.of(open, 0)).atZone(forecastProperties.zone()).toInstant();
    }

    private static boolean isWeekday(DayOfWeek day) {
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public record CalendarTerms(
            boolean marketHours,
            boolean openingHour,
            boolean closingHour,
            boolean monday,
            boolean friday,
            int dayOfWeek,
            boolean monthEnd,
            boolean quarterEnd
    ) {}
}
