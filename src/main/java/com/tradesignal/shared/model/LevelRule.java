package com.tradesignal.shared.model;

import java.util.Objects;

/**
 * 單一 (幣種, 週期) 的止盈止損距離設定
 *
 * 距離的意義由 unit 決定：百分比、pips 或 points。
 */
public record LevelRule(
        double tp1Distance,
        double tp2Distance,
        double tp3Distance,
        double slDistance,
        LevelUnit unit
) {
    public LevelRule {
        Objects.requireNonNull(unit, "unit");
    }
}
