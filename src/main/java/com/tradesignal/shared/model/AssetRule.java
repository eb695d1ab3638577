package com.tradesignal.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 單一幣種的設定：別名 + 各週期的 LevelRule
 *
 * timeframeRules 保留設定檔中的順序，錯誤訊息列出可用週期時會照這個順序。
 */
public record AssetRule(
        String symbol,
        Set<String> aliases,
        Map<String, LevelRule> timeframeRules
) {
    public AssetRule {
        aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        timeframeRules = Collections.unmodifiableMap(new LinkedHashMap<>(timeframeRules));
    }

    public Optional<LevelRule> ruleFor(String timeframe) {
        return Optional.ofNullable(timeframeRules.get(timeframe));
    }

    public List<String> supportedTimeframes() {
        return List.copyOf(timeframeRules.keySet());
    }
}
