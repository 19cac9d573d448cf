package com.pulse.forecast.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "forecast.indicators")
@Data
@Validated
public class IndicatorProperties {

    @Min(2)
    private int rsiPeriod = 14;

    @Min(2)
    private int macdFastPeriod = 12;

    @Min(2)
    private int macdSlowPeriod = 26;

    @Min(2)
    private int macdSignalPeriod = 9;

    @Min(2)
    private int bollingerPeriod = 20;

    @Positive
    private double bollingerDeviation = 2.0;

    @Min(2)
    private int atrPeriod = 14;

    @Min(2)
    private int volumePeriod = 20;
}
