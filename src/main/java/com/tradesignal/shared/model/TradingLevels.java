package com.tradesignal.shared.model;

import lombok.Builder;
import lombok.Value;

/**
 * 計算完成的止盈止損價位
 *
 * LONG:  sl < entry < tp1 <= tp2 <= tp3
 * SHORT: tp3 <= tp2 <= tp1 < entry < sl
 * （距離非遞減時成立）
 */
@Value
@Builder
public class TradingLevels {

    Direction direction;
    String asset;
    String timeframe;
    double entry;

    double tp1;
    double tp2;
    double tp3;
    double sl;

    // 規則中的原始距離，顯示用
    double tp1Distance;
    double tp2Distance;
    double tp3Distance;
    double slDistance;
    LevelUnit unit;

    double riskRewardRatio;  // 平均止盈距離 / 止損距離, 四捨五入到小數兩位
}
