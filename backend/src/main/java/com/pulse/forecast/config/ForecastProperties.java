package com.pulse.forecast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "forecast")
@Data
@Validated
public class ForecastProperties {

    @NotBlank
    private String marketZone = "Australia/Sydney";

    @Min(0)
    @Max(23)
    private int marketOpenHour = 10;

    @Min(1)
    @Max(24)
    private int marketCloseHour = 16;

    /**
     * Realized returns inside +/- this percentage are labelled FLAT.
     */
    @DecimalMin("0.0")
    private double flatBandPct = 0.1;

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Valid
    private Signals signals = new Signals();

    @Valid
    private Actions actions = new Actions();

    @Valid
    private Training training = new Training();

    @Valid
    private Promotion promotion = new Promotion();

    @Valid
    private Guard guard = new Guard();

    @Valid
    private PriceLookup priceLookup = new PriceLookup();

    public ZoneId zone() {
        return ZoneId.of(marketZone);
    }

    @Data
    public static class Pipeline {
        private List<String> symbols = new ArrayList<>();
        @Positive
        private long symbolTimeoutSeconds = 120;
    }

    @Data
    public static class Signals {
        @Positive
        private long timeoutMs = 15000;
        @Positive
        private float circuitFailureRateThreshold = 50;
        @Positive
        private long circuitWaitOpenSeconds = 60;
        @Positive
        private int circuitSlidingWindowSize = 10;
        @Positive
        private int candleBars = 250;
        @NotBlank
        private String candleTimeframe = "1d";
    }

    /**
     * Decision table thresholds applied to the longest horizon.
     */
    @Data
    public static class Actions {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double strongConfidence = 0.8;
        @DecimalMin("0.0")
        private double strongMagnitudePct = 2.0;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidence = 0.6;
        @DecimalMin("0.0")
        private double magnitudePct = 0.5;
    }

    @Data
    public static class Training {
        @Min(10)
        private int minSamples = 50;
        @DecimalMin("0.05")
        @DecimalMax("0.5")
        private double holdoutFraction = 0.2;
        @DecimalMin("0.05")
        @DecimalMax("0.5")
        private double calibrationFraction = 0.2;
        @Min(1)
        private int trees = 60;
        @Min(1)
        private int maxDepth = 8;
        @Min(1)
        private int minSamplesLeaf = 3;
        @Min(1)
        private int sequenceEpochs = 30;
        @Positive
        private double sequenceLearningRate = 0.01;
        @Min(1)
        private int sequenceHiddenUnits = 16;
        @Min(1)
        private int sequenceBatchSize = 16;
        /**
         * Feature rows per symbol fed to the sequence family, the newest being the one scored.
         */
        @Min(1)
        private int sequenceWindow = 5;
        private long seed = 42L;
    }

    @Data
    public static class Promotion {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minAccuracy = 0.60;
        @Positive
        private double maxMae = 2.0;
        @Min(1)
        private int minEvaluationSamples = 10;
    }

    @Data
    public static class Guard {
        @Positive
        private double returnTolerance = 0.0001;
        @Positive
        private double maxAbsReturnPct = 50.0;
        /**
         * Win rates of exactly 0 or 100 percent are flagged from this many samples on.
         */
        @Min(1)
        private int winRateMinSamples = 30;
    }

    /**
     * A price found after the target instant is accepted up to {@code max(minToleranceMinutes,
     * horizon * toleranceFraction)} past the next session open, so a daily row never stands in for an
     * hourly exit while Friday's next-day exit still resolves on Monday.
     */
    @Data
    public static class PriceLookup {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double toleranceFraction = 0.5;
        @Positive
        private long minToleranceMinutes = 30;
        @NotBlank
        private String intradayTimeframe = "1h";
        @Positive
        private int intradayBars = 300;
    }
}
