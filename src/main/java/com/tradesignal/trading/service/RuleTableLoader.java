package com.tradesignal.trading.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.tradesignal.shared.exception.RuleConfigException;
import com.tradesignal.shared.model.AssetRule;
import com.tradesignal.shared.model.Direction;
import com.tradesignal.shared.model.LevelRule;
import com.tradesignal.shared.model.LevelUnit;
import com.tradesignal.shared.model.RuleTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 規則表載入器 / 驗證器
 *
 * 設定檔格式:
 * {
 *   "directions": { "LONG": ["BUY", "🟢"], "SHORT": ["SELL", "🔴"] },
 *   "timeframes": { "aliases": { "5M": "M5", "5": "M5", "H1": "H1" } },
 *   "assets": {
 *     "BTCUSD": {
 *       "aliases": ["BTC", "BITCOIN"],
 *       "M5": { "tp1": 1.0, "tp2": 2.0, "tp3": 3.5, "sl": 1.5, "unit": "%" }
 *     }
 *   }
 * }
 *
 * 一次建好三張別名索引（全部大寫），任何結構錯誤都在載入時拋出 RuleConfigException：
 * - 同一類別中同一個別名指向兩個不同的標準值
 * - 距離為負數或缺少 tp1/tp2/tp3/sl
 * - unit 無法辨識（省略時視為 %）
 * - 同一個 JSON 物件裡出現重複的 key（例如別名 "5" 寫了兩次）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleTableLoader {

    private static final String ALIASES_KEY = "aliases";
    private static final List<String> DISTANCE_KEYS = List.of("tp1", "tp2", "tp3", "sl");

    private final ObjectMapper objectMapper;

    /**
     * 從 Spring Resource 載入（classpath: / file: 皆可）
     */
    public RuleTable load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            RuleTable table = build(strictReader().readTree(in));
            log.info("規則表載入完成: {} → {} 個幣種 {}",
                    resource.getDescription(), table.assetSymbols().size(), table.assetSymbols());
            return table;
        } catch (JsonProcessingException e) {
            throw new RuleConfigException("規則表 JSON 格式錯誤: " + resource.getDescription()
                    + " - " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RuleConfigException("無法讀取規則表: " + resource.getDescription(), e);
        }
    }

    /**
     * 從 JSON 字串載入
     */
    public RuleTable loadFromString(String json) {
        try {
            return build(strictReader().readTree(json));
        } catch (JsonProcessingException e) {
            throw new RuleConfigException("規則表 JSON 格式錯誤: " + e.getMessage(), e);
        }
    }

    // 預設的 tree reader 遇到重複 key 會默默保留最後一個
    private ObjectReader strictReader() {
        return objectMapper.reader().with(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    }

    private RuleTable build(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new RuleConfigException("規則表必須是 JSON 物件");
        }

        Map<String, Direction> directionAliases = buildDirectionAliases(root.path("directions"));
        Map<String, String> timeframeAliases = buildTimeframeAliases(root.path("timeframes").path(ALIASES_KEY));

        JsonNode assetsNode = root.path("assets");
        if (!assetsNode.isObject() || assetsNode.isEmpty()) {
            throw new RuleConfigException("規則表缺少 assets 設定");
        }

        Map<String, String> assetAliases = new LinkedHashMap<>();
        Map<String, AssetRule> assets = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> it = assetsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String symbol = normalize(entry.getKey());
            AssetRule assetRule = buildAssetRule(symbol, entry.getValue(), timeframeAliases);

            if (assets.putIfAbsent(symbol, assetRule) != null) {
                throw new RuleConfigException("幣種重複定義: " + symbol);
            }
            registerAlias(assetAliases, symbol, symbol, "asset");
            for (String alias : assetRule.aliases()) {
                registerAlias(assetAliases, alias, symbol, "asset");
            }
        }

        return new RuleTable(directionAliases, timeframeAliases, assetAliases, assets);
    }

    // ==================== 方向 ====================

    private Map<String, Direction> buildDirectionAliases(JsonNode node) {
        if (!node.isObject()) {
            throw new RuleConfigException("規則表缺少 directions 設定");
        }

        Map<String, Direction> aliases = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Direction direction;
            try {
                direction = Direction.valueOf(normalize(entry.getKey()));
            } catch (IllegalArgumentException e) {
                throw new RuleConfigException("未知的方向: " + entry.getKey() + "（只支援 LONG / SHORT）", e);
            }
            registerAlias(aliases, direction.name(), direction, "direction");
            for (String alias : readStringArray(entry.getValue(), "directions." + entry.getKey())) {
                registerAlias(aliases, alias, direction, "direction");
            }
        }

        for (Direction direction : Direction.values()) {
            if (!aliases.containsValue(direction)) {
                throw new RuleConfigException("directions 缺少 " + direction);
            }
        }
        return aliases;
    }

    // ==================== 週期 ====================

    private Map<String, String> buildTimeframeAliases(JsonNode node) {
        Map<String, String> aliases = new LinkedHashMap<>();
        if (node.isMissingNode()) {
            return aliases;
        }
        if (!node.isObject()) {
            throw new RuleConfigException("timeframes.aliases 必須是物件");
        }

        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isTextual()) {
                throw new RuleConfigException("週期別名 " + entry.getKey() + " 必須對應到字串");
            }
            registerAlias(aliases, normalize(entry.getKey()), normalize(entry.getValue().asText()), "timeframe");
        }

        // 標準週期本身也是別名
        for (String canonical : new LinkedHashSet<>(aliases.values())) {
            registerAlias(aliases, canonical, canonical, "timeframe");
        }
        return aliases;
    }

    // ==================== 幣種 ====================

    private AssetRule buildAssetRule(String symbol, JsonNode node, Map<String, String> timeframeAliases) {
        if (!node.isObject()) {
            throw new RuleConfigException("幣種 " + symbol + " 的設定必須是物件");
        }

        Set<String> aliases = new LinkedHashSet<>();
        Map<String, LevelRule> rules = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (ALIASES_KEY.equals(entry.getKey())) {
                for (String alias : readStringArray(entry.getValue(), symbol + ".aliases")) {
                    aliases.add(normalize(alias));
                }
                continue;
            }

            String key = normalize(entry.getKey());
            String timeframe = timeframeAliases.get(key);
            if (timeframe == null) {
                // 只出現在幣種規則裡的週期，補成自己的別名
                timeframe = key;
                timeframeAliases.put(key, key);
            }
            LevelRule rule = buildLevelRule(symbol + "." + entry.getKey(), entry.getValue());
            if (rules.putIfAbsent(timeframe, rule) != null) {
                throw new RuleConfigException("幣種 " + symbol + " 的週期 " + timeframe + " 重複定義");
            }
        }
        return new AssetRule(symbol, aliases, rules);
    }

    private LevelRule buildLevelRule(String path, JsonNode node) {
        if (!node.isObject()) {
            throw new RuleConfigException(path + " 必須是物件");
        }

        double[] distances = new double[DISTANCE_KEYS.size()];
        for (int i = 0; i < DISTANCE_KEYS.size(); i++) {
            String key = DISTANCE_KEYS.get(i);
            JsonNode value = node.get(key);
            if (value == null || !value.isNumber()) {
                throw new RuleConfigException(path + " 缺少數值欄位 " + key);
            }
            distances[i] = value.asDouble();
            if (distances[i] < 0) {
                throw new RuleConfigException(path + "." + key + " 不可為負數: " + distances[i]);
            }
        }

        LevelUnit unit = LevelUnit.PERCENT;
        JsonNode unitNode = node.get("unit");
        if (unitNode != null && !unitNode.isNull()) {
            unit = LevelUnit.fromConfig(unitNode.asText())
                    .orElseThrow(() -> new RuleConfigException(
                            path + " 的 unit 無法辨識: " + unitNode.asText() + "（可用: %, pips, points）"));
        }

        return new LevelRule(distances[0], distances[1], distances[2], distances[3], unit);
    }

    // ==================== 共用 ====================

    private static <V> void registerAlias(Map<String, V> index, String alias, V canonical, String category) {
        String key = normalize(alias);
        V previous = index.putIfAbsent(key, canonical);
        if (previous != null && !previous.equals(canonical)) {
            throw new RuleConfigException(String.format(
                    "%s 別名 '%s' 重複: 同時指向 %s 與 %s", category, key, previous, canonical));
        }
    }

    private static List<String> readStringArray(JsonNode node, String path) {
        if (!node.isArray()) {
            throw new RuleConfigException(path + " 必須是字串陣列");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new RuleConfigException(path + " 含有非字串或空白的別名");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static String normalize(String token) {
        return token.trim().toUpperCase(Locale.ROOT);
    }
}
