package com.tradesignal.trading.service;

import com.tradesignal.shared.exception.SignalException;
import com.tradesignal.shared.model.Direction;
import com.tradesignal.shared.model.ErrorKind;
import com.tradesignal.shared.model.ParsedSignal;
import com.tradesignal.shared.model.PipelineStats;
import com.tradesignal.shared.model.RuleTable;
import com.tradesignal.shared.model.SignalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * SignalPipelineService 單元測試
 *
 * 覆蓋：
 * - 解析 → 取價 → 計算 完整流程
 * - 入場價來源（訊息 / 預設價格表 / 都沒有）
 * - 錯誤以 SignalResult 回傳，不往外拋
 * - 統計計數
 */
class SignalPipelineServiceTest {

    private RuleTableRegistry registry;
    private SignalParserService parser;
    private LevelCalculatorService calculator;
    private PriceProvider priceProvider;
    private SignalPipelineService pipeline;

    @BeforeEach
    void setUp() {
        registry = TestFixtures.registry();
        parser = new SignalParserService(registry);
        calculator = new LevelCalculatorService(registry, TestFixtures.instruments());
        priceProvider = new PriceProvider(TestFixtures.instruments());
        pipeline = new SignalPipelineService(parser, calculator, priceProvider, registry);
    }

    // ==================== 成功流程 ====================

    @Nested
    @DisplayName("成功流程")
    class Success {

        @Test
        @DisplayName("沒帶價格 → 使用預設價格表")
        void defaultPrice() {
            SignalResult result = pipeline.process("LONG BTCUSD M5");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getError()).isNull();
            assertThat(result.getPriceSource()).isEqualTo(SignalResult.PriceSource.DEFAULT_TABLE);
            assertThat(result.getSignal().getEntryPrice()).isNull();
            assertThat(result.getLevels().getEntry()).isEqualTo(65000.0);
            assertThat(result.getLevels().getTp1()).isCloseTo(65650.0, within(1e-6));
            assertThat(result.getLevels().getRiskRewardRatio()).isEqualTo(1.44);
            assertThat(result.getProcessedAt()).isNotNull();
        }

        @Test
        @DisplayName("訊息帶 @價格 → 優先使用")
        void messagePrice() {
            SignalResult result = pipeline.process("SELL GOLD H1 @2400");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPriceSource()).isEqualTo(SignalResult.PriceSource.MESSAGE);
            assertThat(result.getLevels().getDirection()).isEqualTo(Direction.SHORT);
            assertThat(result.getLevels().getAsset()).isEqualTo("XAUUSD");
            assertThat(result.getLevels().getEntry()).isEqualTo(2400.0);
            assertThat(result.getLevels().getSl()).isGreaterThan(2400.0);
        }

        @Test
        @DisplayName("@0 不是有效價格 → 退回預設價格表")
        void zeroPriceFallsBack() {
            SignalResult result = pipeline.process("LONG BTC M5 @0");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPriceSource()).isEqualTo(SignalResult.PriceSource.DEFAULT_TABLE);
            assertThat(result.getLevels().getEntry()).isEqualTo(65000.0);
        }

        @Test
        @DisplayName("@價格超出 double 範圍 → 退回預設價格表，不拋例外")
        void overflowingPriceFallsBack() {
            SignalResult result = pipeline.process("LONG BTCUSD M5 @" + "9".repeat(400));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPriceSource()).isEqualTo(SignalResult.PriceSource.DEFAULT_TABLE);
            assertThat(result.getLevels().getEntry()).isEqualTo(65000.0);
        }

        @Test
        @DisplayName("PriceProvider 不採用非有限的入場價")
        void nonFinitePriceRejected() {
            ParsedSignal signal = ParsedSignal.builder()
                    .direction(Direction.LONG)
                    .asset("EURUSD")
                    .timeframe("M15")
                    .entryPrice(Double.POSITIVE_INFINITY)
                    .build();

            assertThat(priceProvider.resolve(signal)).isEmpty();
        }
    }

    // ==================== 失敗流程 ====================

    @Nested
    @DisplayName("失敗流程")
    class Failure {

        @Test
        @DisplayName("解析失敗 → 沒有 signal / levels")
        void parseFailure() {
            SignalResult result = pipeline.process("LONG UNKNOWNCOIN M5");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError().kind()).isEqualTo(ErrorKind.NO_ASSET);
            assertThat(result.getSignal()).isNull();
            assertThat(result.getLevels()).isNull();
        }

        @Test
        @DisplayName("沒有價格可用 → PRICE_UNAVAILABLE，保留已解析的 signal")
        void priceUnavailable() {
            SignalResult result = pipeline.process("LONG EURUSD M15");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError().kind()).isEqualTo(ErrorKind.PRICE_UNAVAILABLE);
            assertThat(result.getError().message()).contains("EURUSD");
            assertThat(result.getSignal().getAsset()).isEqualTo("EURUSD");
            assertThat(result.getLevels()).isNull();
        }

        @Test
        @DisplayName("計算器拋出 SignalException → 轉成失敗結果")
        void calculatorErrorBecomesValue() {
            LevelCalculatorService failing = mock(LevelCalculatorService.class);
            when(failing.calculate(any(Direction.class), anyString(), anyString(), anyDouble(), any(RuleTable.class)))
                    .thenThrow(new SignalException(ErrorKind.UNKNOWN_RULE, "No level rule for BTCUSD M5"));
            SignalPipelineService service = new SignalPipelineService(parser, failing, priceProvider, registry);

            SignalResult result = service.process("LONG BTCUSD M5 @65000");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError().kind()).isEqualTo(ErrorKind.UNKNOWN_RULE);
            assertThat(result.getSignal()).isNotNull();
            verify(failing).calculate(eq(Direction.LONG), eq("BTCUSD"), eq("M5"), eq(65000.0), any(RuleTable.class));
        }
    }

    // ==================== 統計 ====================

    @Nested
    @DisplayName("統計")
    class Stats {

        @Test
        @DisplayName("初始為 0")
        void initialStats() {
            PipelineStats stats = pipeline.getStats();

            assertThat(stats.signalsProcessed()).isZero();
            assertThat(stats.failedSignals()).isZero();
            assertThat(stats.lastSignalAt()).isNull();
        }

        @Test
        @DisplayName("一則失敗不影響後續訊息")
        void batchContinuesAfterFailure() {
            List<SignalResult> results = new ArrayList<>();
            for (String msg : List.of("LONG BTCUSD M5", "hello world", "SHORT XAU M1")) {
                results.add(pipeline.process(msg));
            }

            assertThat(results).extracting(SignalResult::isSuccess).containsExactly(true, false, true);
            PipelineStats stats = pipeline.getStats();
            assertThat(stats.signalsProcessed()).isEqualTo(2);
            assertThat(stats.failedSignals()).isEqualTo(1);
            assertThat(stats.lastSignalAt()).isNotNull();
        }

        @Test
        @DisplayName("多執行緒同時處理，計數正確")
        void concurrentProcessing() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Callable<SignalResult>> tasks = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    String msg = i % 2 == 0 ? "LONG BTCUSD M5" : "SHORT GOLD H1 @2350";
                    tasks.add(() -> pipeline.process(msg));
                }
                for (Future<SignalResult> future : executor.invokeAll(tasks)) {
                    assertThat(future.get().isSuccess()).isTrue();
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(pipeline.getStats().signalsProcessed()).isEqualTo(200);
            assertThat(pipeline.getStats().failedSignals()).isZero();
        }
    }
}
