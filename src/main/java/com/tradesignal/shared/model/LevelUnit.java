package com.tradesignal.shared.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 止盈止損距離的單位
 *
 * 規則表中的 unit 字串在載入時就轉成這個 enum，
 * 計算器用 switch 窮舉，新增單位時編譯器會提示所有要改的地方。
 */
public enum LevelUnit {

    PERCENT("%"),   // 百分比（加密貨幣、黃金）
    PIPS("pips"),   // 點差（外匯）
    POINTS("points"); // 點數（指數）

    private final String symbol;

    LevelUnit(String symbol) {
        this.symbol = symbol;
    }

    /** 規則表裡使用的標準寫法 */
    public String getSymbol() {
        return symbol;
    }

    /**
     * 解析規則表中的 unit 字串（不分大小寫）
     *
     * @param raw 例如 "%", "pips", "points"
     * @return 對應的單位，無法辨識時回傳 empty
     */
    public static Optional<LevelUnit> fromConfig(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "%":
            case "percent":
                return Optional.of(PERCENT);
            case "pips":
            case "pip":
                return Optional.of(PIPS);
            case "points":
            case "point":
            case "pts":
                return Optional.of(POINTS);
            default:
                return Optional.empty();
        }
    }
}
