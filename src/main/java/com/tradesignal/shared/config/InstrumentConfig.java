package com.tradesignal.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 商品參數：pip 大小、point 價值、預設價格
 *
 * 未列出的幣種使用預設值（pip 0.0001、point 1.0）。
 * 幣種鍵一律轉大寫，查詢不分大小寫。
 */
@Getter
@ConfigurationProperties(prefix = "signal.instruments")
public class InstrumentConfig {

    private final double defaultPipSize;
    private final double defaultPointValue;
    private final Map<String, Double> pipSizes;
    private final Map<String, Double> pointValues;
    private final Map<String, Double> defaultPrices;

    public InstrumentConfig(
            @DefaultValue("0.0001") double defaultPipSize,
            @DefaultValue("1.0") double defaultPointValue,
            Map<String, Double> pipSizes,
            Map<String, Double> pointValues,
            Map<String, Double> defaultPrices
    ) {
        this.defaultPipSize = defaultPipSize;
        this.defaultPointValue = defaultPointValue;
        this.pipSizes = upperCaseKeys(pipSizes);
        this.pointValues = upperCaseKeys(pointValues);
        this.defaultPrices = upperCaseKeys(defaultPrices);
    }

    /**
     * 1 pip 對應的價格變動, e.g. USDJPY = 0.01
     */
    public double pipSizeFor(String asset) {
        return pipSizes.getOrDefault(key(asset), defaultPipSize);
    }

    /**
     * 1 point 對應的價格變動, e.g. SPX500 = 0.1
     */
    public double pointValueFor(String asset) {
        return pointValues.getOrDefault(key(asset), defaultPointValue);
    }

    public Optional<Double> defaultPriceFor(String asset) {
        return Optional.ofNullable(defaultPrices.get(key(asset)));
    }

    private static String key(String asset) {
        return asset == null ? "" : asset.toUpperCase(Locale.ROOT);
    }

    private static Map<String, Double> upperCaseKeys(Map<String, Double> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Double> copy = new HashMap<>();
        source.forEach((k, v) -> copy.put(key(k), v));
        return Map.copyOf(copy);
    }
}
