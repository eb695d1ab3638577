package com.tradesignal.trading.service;

import com.tradesignal.shared.config.AppConstants;
import com.tradesignal.shared.model.Direction;
import com.tradesignal.shared.model.ErrorKind;
import com.tradesignal.shared.model.ParseResult;
import com.tradesignal.shared.model.ParsedSignal;
import com.tradesignal.shared.model.RuleTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 訊號解析器 - 把簡短的文字指令轉成 (方向, 幣種, 週期, 入場價)
 *
 * 支援格式:
 *   LONG BTCUSD M5
 *   BUY GOLD 5M
 *   SHORT ETH M1 @2450.50
 *   🟢 BTC 15
 *
 * 解析順序（順序會影響結果，不要調換）:
 * 1. trim + 轉大寫
 * 2. 方向: 只看前三個 token
 * 3. 幣種: token 完全比對 → 整段訊息子字串比對（長別名優先）
 * 4. 週期: 正規式候選 → token 完全比對 → 週期形狀的 token
 * 5. 檢查幣種是否有設定該週期
 * 6. 入場價: @ 後面的數字（可選）
 *
 * 純函式：只依賴輸入文字和規則表，沒有副作用。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalParserService {

    private static final int DIRECTION_TOKEN_WINDOW = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // 方向 token 清理: 保留字元和 🟢 🔴 兩個 emoji
    private static final Pattern DIRECTION_STRIP = Pattern.compile(
            "[^\\w\\x{1F7E2}\\x{1F534}]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern NON_WORD = Pattern.compile("[^\\w]", Pattern.UNICODE_CHARACTER_CLASS);

    // 週期候選: M5, 5M, 15MIN, 或純數字
    private static final Pattern TIMEFRAME_PATTERN = Pattern.compile(
            "\\b([MHD]\\d+|\\d+[MHD]|\\d+MIN?|\\d+)\\b");

    // 別名表沒有、但看得出是週期的 token（M99, H12...）
    private static final Pattern TIMEFRAME_SHAPE = Pattern.compile("[MHD]\\d+");

    // 入場價: @2450.50 / @ 65,000
    private static final Pattern PRICE_PATTERN = Pattern.compile("@\\s*([\\d.,]+)");

    private final RuleTableRegistry ruleTableRegistry;

    /**
     * 用目前生效的規則表解析
     */
    public ParseResult parse(String message) {
        return parse(message, ruleTableRegistry.current());
    }

    /**
     * 解析交易指令
     *
     * @param message 原始訊息文字
     * @param rules   規則表
     * @return 成功時帶 ParsedSignal，失敗時帶 SignalError
     */
    public ParseResult parse(String message, RuleTable rules) {
        if (message == null || message.isBlank()) {
            return ParseResult.failure(ErrorKind.NO_DIRECTION, noDirectionMessage(rules));
        }

        log.debug("開始解析訊號: {}", message);
        String normalized = message.strip().toUpperCase(Locale.ROOT);

        Optional<Direction> direction = extractDirection(normalized, rules);
        if (direction.isEmpty()) {
            log.debug("找不到方向: {}", message);
            return ParseResult.failure(ErrorKind.NO_DIRECTION, noDirectionMessage(rules));
        }

        Optional<String> asset = extractAsset(normalized, rules);
        if (asset.isEmpty()) {
            log.debug("找不到幣種: {}", message);
            return ParseResult.failure(ErrorKind.NO_ASSET,
                    "Asset not recognized. Available: " + String.join(", ", rules.assetSymbols()));
        }

        Optional<String> timeframe = extractTimeframe(normalized, rules);
        if (timeframe.isEmpty()) {
            log.debug("找不到週期: {}", message);
            return ParseResult.failure(ErrorKind.NO_TIMEFRAME,
                    "Timeframe not found. Use: " + String.join("/", rules.canonicalTimeframes()));
        }

        if (!rules.supports(asset.get(), timeframe.get())) {
            log.debug("{} 沒有設定週期 {}", asset.get(), timeframe.get());
            return ParseResult.failure(ErrorKind.UNSUPPORTED_TIMEFRAME, String.format(
                    "Timeframe %s not configured for %s. Available: %s",
                    timeframe.get(), asset.get(), String.join(", ", rules.supportedTimeframes(asset.get()))));
        }

        Double entryPrice = extractPrice(normalized).orElse(null);

        ParsedSignal signal = ParsedSignal.builder()
                .direction(direction.get())
                .asset(asset.get())
                .timeframe(timeframe.get())
                .entryPrice(entryPrice)
                .originalText(message)
                .parsedAt(LocalDateTime.now(AppConstants.ZONE_ID))
                .build();

        log.info("解析成功: {} {} {} 入場:{}", signal.getDirection(), signal.getAsset(),
                signal.getTimeframe(), entryPrice != null ? entryPrice : "未指定");
        return ParseResult.success(signal);
    }

    // ==================== 方向 ====================

    /**
     * 只掃描前三個 token，第一個命中的別名決定方向
     */
    Optional<Direction> extractDirection(String normalized, RuleTable rules) {
        String[] tokens = tokens(normalized);
        int window = Math.min(DIRECTION_TOKEN_WINDOW, tokens.length);
        for (int i = 0; i < window; i++) {
            String clean = DIRECTION_STRIP.matcher(tokens[i]).replaceAll("");
            Optional<Direction> direction = rules.resolveDirection(clean);
            if (direction.isPresent()) {
                return direction;
            }
        }
        return Optional.empty();
    }

    // ==================== 幣種 ====================

    Optional<String> extractAsset(String normalized, RuleTable rules) {
        Optional<String> byToken = matchAssetToken(normalized, rules);
        if (byToken.isPresent()) {
            return byToken;
        }
        return matchAssetSubstring(normalized, rules);
    }

    /**
     * 第一層: 逐個 token 完全比對（@ 也當分隔符, 避免 "BTC@65000" 黏在一起）
     */
    Optional<String> matchAssetToken(String normalized, RuleTable rules) {
        for (String token : tokens(normalized.replace('@', ' '))) {
            String clean = NON_WORD.matcher(token).replaceAll("");
            if (clean.isEmpty()) {
                continue;
            }
            Optional<String> asset = rules.resolveAsset(clean);
            if (asset.isPresent()) {
                return asset;
            }
        }
        return Optional.empty();
    }

    /**
     * 第二層: 在整段訊息裡找別名子字串，長的先比，短別名不會蓋掉長別名
     */
    Optional<String> matchAssetSubstring(String normalized, RuleTable rules) {
        for (String alias : rules.assetAliasesLongestFirst()) {
            if (normalized.contains(alias)) {
                return rules.resolveAsset(alias);
            }
        }
        return Optional.empty();
    }

    // ==================== 週期 ====================

    Optional<String> extractTimeframe(String normalized, RuleTable rules) {
        Optional<String> byPattern = matchTimeframePattern(normalized, rules);
        if (byPattern.isPresent()) {
            return byPattern;
        }
        Optional<String> byToken = matchTimeframeToken(normalized, rules);
        if (byToken.isPresent()) {
            return byToken;
        }
        return matchTimeframeShape(normalized);
    }

    /**
     * 第一層: 依出現順序檢查每個週期候選
     */
    Optional<String> matchTimeframePattern(String normalized, RuleTable rules) {
        Matcher matcher = TIMEFRAME_PATTERN.matcher(normalized);
        while (matcher.find()) {
            Optional<String> timeframe = rules.resolveTimeframe(matcher.group(1));
            if (timeframe.isPresent()) {
                return timeframe;
            }
        }
        return Optional.empty();
    }

    /**
     * 第二層: 清理後的 token 直接查別名表
     */
    Optional<String> matchTimeframeToken(String normalized, RuleTable rules) {
        for (String token : tokens(normalized)) {
            String clean = NON_WORD.matcher(token).replaceAll("");
            if (clean.isEmpty()) {
                continue;
            }
            Optional<String> timeframe = rules.resolveTimeframe(clean);
            if (timeframe.isPresent()) {
                return timeframe;
            }
        }
        return Optional.empty();
    }

    /**
     * 第三層: 別名表沒有，但 token 長得像週期 (M99)，原樣回傳,
     * 讓後面的檢查回報 UNSUPPORTED_TIMEFRAME 而不是 NO_TIMEFRAME
     */
    Optional<String> matchTimeframeShape(String normalized) {
        return Arrays.stream(tokens(normalized))
                .map(token -> NON_WORD.matcher(token).replaceAll(""))
                .filter(clean -> TIMEFRAME_SHAPE.matcher(clean).matches())
                .findFirst();
    }

    // ==================== 入場價 ====================

    /**
     * 訊息中 @ 後面的數字, 逗號視為千分位直接移除。
     * 數字格式錯誤（例如 "@1.2.3"）或超出 double 範圍視為沒有給價格，不算錯誤。
     */
    Optional<Double> extractPrice(String normalized) {
        Matcher matcher = PRICE_PATTERN.matcher(normalized);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String raw = matcher.group(1).replace(",", "");
        try {
            double price = Double.parseDouble(raw);
            if (!Double.isFinite(price)) {
                log.warn("入場價超出範圍，忽略: @{}", matcher.group(1));
                return Optional.empty();
            }
            return Optional.of(price);
        } catch (NumberFormatException e) {
            log.warn("入場價格式錯誤，忽略: @{}", matcher.group(1));
            return Optional.empty();
        }
    }

    // ==================== 共用 ====================

    private static String[] tokens(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }

    private static String noDirectionMessage(RuleTable rules) {
        Map<Direction, Set<String>> vocabulary = rules.directionVocabulary();
        String expected = vocabulary.entrySet().stream()
                .map(e -> e.getKey() + " (" + String.join("/", e.getValue()) + ")")
                .collect(Collectors.joining(" or "));
        return "Direction not found in the first " + DIRECTION_TOKEN_WINDOW + " words. Use: " + expected;
    }
}
