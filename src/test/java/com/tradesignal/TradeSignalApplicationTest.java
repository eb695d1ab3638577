package com.tradesignal;

import com.tradesignal.shared.config.AppConstants;
import com.tradesignal.shared.config.InstrumentConfig;
import com.tradesignal.shared.model.SignalResult;
import com.tradesignal.trading.service.SignalPipelineService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

/**
 * 以正式設定（application.yml + rules.json）啟動 context
 */
@SpringBootTest
class TradeSignalApplicationTest {

    @Autowired
    private SignalPipelineService pipeline;

    @Autowired
    private InstrumentConfig instrumentConfig;

    @Test
    @DisplayName("application.yml 的商品設定正確綁定")
    void instrumentsBound() {
        assertThat(instrumentConfig.pipSizeFor("USDJPY")).isEqualTo(0.01);
        assertThat(instrumentConfig.pointValueFor("SPX500")).isEqualTo(0.1);
        assertThat(instrumentConfig.defaultPriceFor("BTCUSD")).contains(65000.0);
    }

    @Test
    @DisplayName("app.timezone 寫入 AppConstants.ZONE_ID，時間戳使用該時區")
    void timezoneBound() {
        assertThat(AppConstants.ZONE_ID).isEqualTo(ZoneId.of("UTC"));
        assertThat(pipeline.process("LONG BTCUSD M5").getProcessedAt()).isNotNull();
    }

    @Test
    @DisplayName("LONG BTCUSD M5 走完整流程")
    void endToEnd() {
        SignalResult result = pipeline.process("LONG BTCUSD M5");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLevels().getTp1()).isCloseTo(65650.0, within(1e-6));
        assertThat(result.getLevels().getSl()).isCloseTo(64025.0, within(1e-6));
        assertThat(result.getLevels().getRiskRewardRatio()).isEqualTo(1.44);
    }

    @Test
    @DisplayName("外匯 pips 規則使用設定檔的 pip 大小")
    void forexPips() {
        SignalResult result = pipeline.process("SELL YEN H1 @150");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLevels().getTp1()).isCloseTo(149.75, within(1e-6));
    }
}
