package com.pulse.forecast.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup when the store or the forecast settings cannot produce a consistent run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupConfigValidator implements ApplicationRunner {

    private final ForecastProperties forecastProperties;

    @Value("${spring.datasource.url:}")
    private String dbUrl;

    @Value("${spring.datasource.username:}")
    private String dbUser;

    @Value("${spring.datasource.password:}")
    private String dbPassword;

    @Override
    public void run(ApplicationArguments args) {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            String message = "Invalid configuration: " + String.join("; ", problems);
            log.error(message);
            throw new IllegalStateException(message);
        }
        if (forecastProperties.getPipeline().getSymbols().isEmpty()) {
            log.warn("forecast.pipeline.symbols is empty; phase runs need an explicit symbol list");
        }
        log.info("Forecast store configured url={} zone={}", dbUrl, forecastProperties.getMarketZone());
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (isBlank(dbUrl) || isBlank(dbUser) || isBlank(dbPassword)) {
            problems.add("store configuration missing, check SPRING_DATASOURCE_URL/USERNAME/PASSWORD");
        }
        try {
            forecastProperties.zone();
        } catch (DateTimeException ex) {
            problems.add("unknown market zone " + forecastProperties.getMarketZone());
        }
        if (forecastProperties.getMarketOpenHour() >= forecastProperties.getMarketCloseHour()) {
            problems.add("market open hour must precede close hour");
        }
        ForecastProperties.Actions actions = forecastProperties.getActions();
        if (actions.getStrongConfidence() < actions.getConfidence()
                || actions.getStrongMagnitudePct() < actions.getMagnitudePct()) {
            problems.add("strong action thresholds must not be below the plain ones");
        }
        return problems;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
