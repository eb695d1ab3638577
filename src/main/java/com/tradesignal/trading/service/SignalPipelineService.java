package com.tradesignal.trading.service;

import com.tradesignal.shared.config.AppConstants;
import com.tradesignal.shared.exception.SignalException;
import com.tradesignal.shared.model.ErrorKind;
import com.tradesignal.shared.model.ParseResult;
import com.tradesignal.shared.model.ParsedSignal;
import com.tradesignal.shared.model.PipelineStats;
import com.tradesignal.shared.model.RuleTable;
import com.tradesignal.shared.model.SignalError;
import com.tradesignal.shared.model.SignalResult;
import com.tradesignal.shared.model.TradingLevels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 訊號處理流程: 解析 → 取入場價 → 計算價位 → SignalResult
 *
 * 解析 / 計算錯誤一律轉成失敗的 SignalResult 回傳，不往外拋，
 * 呼叫端一次處理多則訊息時，一則失敗不影響下一則。
 *
 * 統計計數用 AtomicLong，可多執行緒同時呼叫 process()。
 */
@Slf4j
@Service
public class SignalPipelineService {

    private final SignalParserService parserService;
    private final LevelCalculatorService calculatorService;
    private final PriceProvider priceProvider;
    private final RuleTableRegistry ruleTableRegistry;

    private final AtomicLong signalsProcessed = new AtomicLong();
    private final AtomicLong failedSignals = new AtomicLong();
    private final AtomicReference<LocalDateTime> lastSignalAt = new AtomicReference<>();

    public SignalPipelineService(SignalParserService parserService,
                                 LevelCalculatorService calculatorService,
                                 PriceProvider priceProvider,
                                 RuleTableRegistry ruleTableRegistry) {
        this.parserService = parserService;
        this.calculatorService = calculatorService;
        this.priceProvider = priceProvider;
        this.ruleTableRegistry = ruleTableRegistry;
    }

    /**
     * 處理一則原始訊息
     *
     * @param message 例如 "LONG BTCUSD M5" 或 "SELL GOLD H1 @2350"
     */
    public SignalResult process(String message) {
        // 同一則訊息的解析和計算必須用同一張表
        RuleTable rules = ruleTableRegistry.current();

        ParseResult parsed = parserService.parse(message, rules);
        if (!parsed.isSuccess()) {
            return failure(null, parsed.getError().orElseThrow());
        }
        ParsedSignal signal = parsed.getSignal().orElseThrow();

        Optional<PriceProvider.ResolvedPrice> price = priceProvider.resolve(signal);
        if (price.isEmpty()) {
            return failure(signal, new SignalError(ErrorKind.PRICE_UNAVAILABLE,
                    "No entry price for " + signal.getAsset() + ". Add one with @price, e.g. "
                            + signal.getDirection() + " " + signal.getAsset() + " " + signal.getTimeframe() + " @1234.5"));
        }

        TradingLevels levels;
        try {
            levels = calculatorService.calculate(signal.getDirection(), signal.getAsset(),
                    signal.getTimeframe(), price.get().price(), rules);
        } catch (SignalException e) {
            return failure(signal, new SignalError(e.getKind(), e.getMessage()));
        }

        LocalDateTime now = LocalDateTime.now(AppConstants.ZONE_ID);
        signalsProcessed.incrementAndGet();
        lastSignalAt.set(now);

        log.info("訊號產生: {} {} {} 入場:{} ({}) TP:{}/{}/{} SL:{} R:R 1:{}",
                levels.getDirection(), levels.getAsset(), levels.getTimeframe(), levels.getEntry(),
                price.get().source(), levels.getTp1(), levels.getTp2(), levels.getTp3(),
                levels.getSl(), levels.getRiskRewardRatio());

        return SignalResult.builder()
                .success(true)
                .signal(signal)
                .levels(levels)
                .priceSource(price.get().source())
                .processedAt(now)
                .build();
    }

    public PipelineStats getStats() {
        return new PipelineStats(signalsProcessed.get(), failedSignals.get(), lastSignalAt.get());
    }

    private SignalResult failure(ParsedSignal signal, SignalError error) {
        failedSignals.incrementAndGet();
        log.warn("訊號處理失敗 [{}]: {}", error.kind(), error.message());
        return SignalResult.builder()
                .success(false)
                .signal(signal)
                .error(error)
                .processedAt(LocalDateTime.now(AppConstants.ZONE_ID))
                .build();
    }
}
