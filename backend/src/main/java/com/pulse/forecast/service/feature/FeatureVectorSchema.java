package com.pulse.forecast.service.feature;

import com.pulse.forecast.model.FeatureRecord;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Ordered model inputs taken from a {@link FeatureRecord}. A model trained against one ordering
 * cannot score another, so the ordering's hash is stored with every model version.
 * Raw prices are left out; only scale-free terms feed the models.
 */
@Component
public class FeatureVectorSchema {

    public static final String FEATURE_VERSION = "v2";

    private final Map<String, ToDoubleFunction<FeatureRecord>> columns = buildColumns();
    private final List<String> names = List.copyOf(columns.keySet());
    private final String hash = sha256(FEATURE_VERSION + ":" + String.join(",", names));

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public String hash() {
        return hash;
    }

    public double[] vector(FeatureRecord record) {
        double[] values = new double[names.size()];
        int i = 0;
        for (ToDoubleFunction<FeatureRecord> column : columns.values()) {
            values[i++] = column.applyAsDouble(record);
        }
        return values;
    }

    private static Map<String, ToDoubleFunction<FeatureRecord>> buildColumns() {
        Map<String, ToDoubleFunction<FeatureRecord>> map = new LinkedHashMap<>();
        map.put("sentiment_score", FeatureRecord::getSentimentScore);
        map.put("sentiment_confidence", FeatureRecord::getSentimentConfidence);
        map.put("article_count", FeatureRecord::getArticleCount);
        map.put("social_score", FeatureRecord::getSocialScore);
        map.put("rsi", FeatureRecord::getRsi);
        map.put("macd_line", FeatureRecord::getMacdLine);
        map.put("macd_signal", FeatureRecord::getMacdSignal);
        map.put("macd_histogram", FeatureRecord::getMacdHistogram);
        map.put("sma20_ratio", FeatureRecord::getSma20Ratio);
        map.put("sma50_ratio", FeatureRecord::getSma50Ratio);
        map.put("sma200_ratio", FeatureRecord::getSma200Ratio);
        map.put("bollinger_width", FeatureRecord::getBollingerWidth);
        map.put("atr_pct", FeatureRecord::getAtrPct);
        map.put("volatility", FeatureRecord::getVolatility);
        map.put("volume_ratio", FeatureRecord::getVolumeRatio);
        map.put("price_change_1d", FeatureRecord::getPriceChange1d);
        map.put("price_change_5d", FeatureRecord::getPriceChange5d);
        map.put("daily_range", FeatureRecord::getDailyRange);
        map.put("index_change_pct", FeatureRecord::getIndexChangePct);
        map.put("vix", FeatureRecord::getVix);
        map.put("market_hours_flag", f -> flag(f.isMarketHours()));
        map.put("sector_performance", FeatureRecord::getSectorPerformance);
        map.put("market_breadth", FeatureRecord::getMarketBreadth);
        map.put("sentiment_momentum", FeatureRecord::getSentimentMomentum);
        map.put("sentiment_rsi", FeatureRecord::getSentimentRsi);
        map.put("volume_sentiment", FeatureRecord::getVolumeSentiment);
        map.put("confidence_volatility", FeatureRecord::getConfidenceVolatility);
        map.put("news_volume_impact", FeatureRecord::getNewsVolumeImpact);
        map.put("technical_sentiment_divergence", FeatureRecord::getTechnicalSentimentDivergence);
        map.put("opening_hour_flag", f -> flag(f.isOpeningHour()));
        map.put("closing_hour_flag", f -> flag(f.isClosingHour()));
        map.put("monday_flag", f -> flag(f.isMonday()));
        map.put("friday_flag", f -> flag(f.isFriday()));
        map.put("day_of_week", FeatureRecord::getDayOfWeek);
        map.put("month_end_flag", f -> flag(f.isMonthEnd()));
        map.put("quarter_end_flag", f -> flag(f.isQuarterEnd()));
        map.put("quality_score", FeatureRecord::getQualityScore);
        return map;
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
    }
}
