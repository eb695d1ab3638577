package com.tradesignal.shared.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 規則表：方向 / 週期 / 幣種三張別名索引 + 每個幣種的止盈止損規則
 *
 * 由 RuleTableLoader 一次建好，之後不可變，多執行緒可直接共用同一個實例。
 * 所有別名鍵一律大寫。重新載入設定時建立新的 RuleTable 再整個替換，不做原地修改。
 */
public final class RuleTable {

    private final Map<String, Direction> directionAliases;
    private final Map<String, String> timeframeAliases;
    private final Map<String, String> assetAliases;
    private final Map<String, AssetRule> assets;

    /** 幣種別名依長度由長到短排序，子字串比對時長別名優先 */
    private final List<String> assetAliasesLongestFirst;

    public RuleTable(Map<String, Direction> directionAliases,
                     Map<String, String> timeframeAliases,
                     Map<String, String> assetAliases,
                     Map<String, AssetRule> assets) {
        this.directionAliases = Collections.unmodifiableMap(new LinkedHashMap<>(directionAliases));
        this.timeframeAliases = Collections.unmodifiableMap(new LinkedHashMap<>(timeframeAliases));
        this.assetAliases = Collections.unmodifiableMap(new LinkedHashMap<>(assetAliases));
        this.assets = Collections.unmodifiableMap(new LinkedHashMap<>(assets));

        List<String> sorted = new ArrayList<>(assetAliases.keySet());
        sorted.sort(Comparator.comparingInt(String::length).reversed()
                .thenComparing(Comparator.naturalOrder()));
        this.assetAliasesLongestFirst = List.copyOf(sorted);
    }

    // ==================== 別名解析 ====================

    public Optional<Direction> resolveDirection(String token) {
        return Optional.ofNullable(directionAliases.get(token));
    }

    public Optional<String> resolveAsset(String token) {
        return Optional.ofNullable(assetAliases.get(token));
    }

    public Optional<String> resolveTimeframe(String token) {
        return Optional.ofNullable(timeframeAliases.get(token));
    }

    public List<String> assetAliasesLongestFirst() {
        return assetAliasesLongestFirst;
    }

    // ==================== 規則查詢 ====================

    public Optional<AssetRule> asset(String symbol) {
        return Optional.ofNullable(assets.get(symbol));
    }

    public Optional<LevelRule> ruleFor(String asset, String timeframe) {
        return asset(asset).flatMap(rule -> rule.ruleFor(timeframe));
    }

    public boolean supports(String asset, String timeframe) {
        return ruleFor(asset, timeframe).isPresent();
    }

    /** 所有已設定的幣種（設定檔順序） */
    public List<String> assetSymbols() {
        return List.copyOf(assets.keySet());
    }

    /** 指定幣種有設定的週期，幣種不存在時回傳空 list */
    public List<String> supportedTimeframes(String asset) {
        return asset(asset).map(AssetRule::supportedTimeframes).orElse(List.of());
    }

    /** 所有週期別名指向的標準週期（去重，保留順序） */
    public List<String> canonicalTimeframes() {
        return List.copyOf(new LinkedHashSet<>(timeframeAliases.values()));
    }

    /** 方向 → 別名集合（錯誤訊息提示用） */
    public Map<Direction, Set<String>> directionVocabulary() {
        Map<Direction, Set<String>> vocabulary = new EnumMap<>(Direction.class);
        directionAliases.forEach((alias, direction) ->
                vocabulary.computeIfAbsent(direction, d -> new LinkedHashSet<>()).add(alias));
        return Collections.unmodifiableMap(vocabulary);
    }
}
