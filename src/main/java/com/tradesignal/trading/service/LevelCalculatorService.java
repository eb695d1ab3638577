package com.tradesignal.trading.service;

import com.tradesignal.shared.config.InstrumentConfig;
import com.tradesignal.shared.exception.SignalException;
import com.tradesignal.shared.model.Direction;
import com.tradesignal.shared.model.ErrorKind;
import com.tradesignal.shared.model.LevelRule;
import com.tradesignal.shared.model.LevelUnit;
import com.tradesignal.shared.model.RuleTable;
import com.tradesignal.shared.model.TradingLevels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 止盈止損計算器
 *
 * 依 (幣種, 週期) 取出 LevelRule，再依單位換算成絕對價位:
 * - PERCENT: entry × (1 ± d/100)
 * - PIPS:    entry ± d × pipSize   （預設 0.0001，JPY 報價 0.01）
 * - POINTS:  entry ± d × pointValue（預設 1.0）
 *
 * 符號規則（三種單位一致）:
 *   LONG:  TP = entry + Δ, SL = entry − Δsl
 *   SHORT: TP = entry − Δ, SL = entry + Δsl
 *
 * 風報比 = mean(tp1, tp2, tp3) / sl，四捨五入（HALF_UP，以 double 的十進位表示為準）到小數兩位；
 * sl 距離為 0 時定義為 0。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LevelCalculatorService {

    private static final int RISK_REWARD_SCALE = 2;

    private final RuleTableRegistry ruleTableRegistry;
    private final InstrumentConfig instrumentConfig;

    /**
     * 用目前生效的規則表計算
     */
    public TradingLevels calculate(Direction direction, String asset, String timeframe, double entryPrice) {
        return calculate(direction, asset, timeframe, entryPrice, ruleTableRegistry.current());
    }

    /**
     * 計算 TP1/TP2/TP3/SL
     *
     * @param entryPrice 入場價，必須為正數
     * @throws SignalException          規則表沒有 (asset, timeframe)，kind = UNKNOWN_RULE
     * @throws IllegalArgumentException 入場價不是正數
     */
    public TradingLevels calculate(Direction direction, String asset, String timeframe,
                                   double entryPrice, RuleTable rules) {
        Objects.requireNonNull(direction, "direction");
        if (!(entryPrice > 0) || Double.isInfinite(entryPrice)) {
            throw new IllegalArgumentException("入場價必須為正數: " + entryPrice);
        }

        // 計算器可單獨呼叫，不假設 parser 已驗證過
        LevelRule rule = rules.ruleFor(asset, timeframe)
                .orElseThrow(() -> new SignalException(ErrorKind.UNKNOWN_RULE, String.format(
                        "No level rule for %s %s. Configured timeframes: %s",
                        asset, timeframe, rules.supportedTimeframes(asset))));

        int sign = direction == Direction.LONG ? 1 : -1;

        double tp1 = level(rule.unit(), asset, entryPrice, sign, rule.tp1Distance());
        double tp2 = level(rule.unit(), asset, entryPrice, sign, rule.tp2Distance());
        double tp3 = level(rule.unit(), asset, entryPrice, sign, rule.tp3Distance());
        double sl = level(rule.unit(), asset, entryPrice, -sign, rule.slDistance());

        TradingLevels levels = TradingLevels.builder()
                .direction(direction)
                .asset(asset)
                .timeframe(timeframe)
                .entry(entryPrice)
                .tp1(tp1)
                .tp2(tp2)
                .tp3(tp3)
                .sl(sl)
                .tp1Distance(rule.tp1Distance())
                .tp2Distance(rule.tp2Distance())
                .tp3Distance(rule.tp3Distance())
                .slDistance(rule.slDistance())
                .unit(rule.unit())
                .riskRewardRatio(riskReward(rule))
                .build();

        log.debug("計算完成: {} {} {} @ {} → TP {}/{}/{} SL {} R:R {}",
                direction, asset, timeframe, entryPrice, tp1, tp2, tp3, sl, levels.getRiskRewardRatio());
        return levels;
    }

    /**
     * 平均止盈距離 / 止損距離，止損距離為 0 時回傳 0
     */
    static double riskReward(LevelRule rule) {
        if (rule.slDistance() <= 0) {
            return 0;
        }
        double averageTp = (rule.tp1Distance() + rule.tp2Distance() + rule.tp3Distance()) / 3;
        return BigDecimal.valueOf(averageTp / rule.slDistance())
                .setScale(RISK_REWARD_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * sign = +1 往獲利方向（LONG 的 TP），-1 往反方向
     */
    private double level(LevelUnit unit, String asset, double entry, int sign, double distance) {
        return switch (unit) {
            case PERCENT -> entry * (1 + sign * distance / 100);
            case PIPS -> entry + sign * (distance * instrumentConfig.pipSizeFor(asset));
            case POINTS -> entry + sign * (distance * instrumentConfig.pointValueFor(asset));
        };
    }
}
