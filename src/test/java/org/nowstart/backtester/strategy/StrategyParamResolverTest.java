package org.nowstart.backtester.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.strategy.StrategyParamResolver.ActiveStrategy;
import org.nowstart.backtester.strategy.rsi.RsiMeanReversionParams;
import org.nowstart.backtester.strategy.trendrsi.TrendFilteredRsiParams;
import org.nowstart.backtester.support.TestProperties;

class StrategyParamResolverTest {

    @Test
    void resolveActive_bindsConfiguredOverrides() {
        StrategyParamResolver resolver = new StrategyParamResolver(
                TestProperties.properties("RSI", Map.of("rsi-period", 7.0, "oversold", 25.0)),
                StrategyRegistryTest.registry()
        );

        ActiveStrategy active = resolver.resolveActive();

        assertThat(active.name()).isEqualTo("rsi");
        assertThat(active.params()).isEqualTo(new RsiMeanReversionParams(7, 25.0, 70.0, 50.0));
    }

    @Test
    void resolve_usesDefaultsWithoutOverrides() {
        StrategyParamResolver resolver = new StrategyParamResolver(
                TestProperties.properties("rsi", Map.of()),
                StrategyRegistryTest.registry()
        );

        assertThat(resolver.resolve("trend-rsi", null).params()).isEqualTo(TrendFilteredRsiParams.DEFAULTS);
    }

    @Test
    void resolveActive_throwsForInvalidConfiguration() {
        StrategyParamResolver unknownStrategy = new StrategyParamResolver(
                TestProperties.properties("v5", Map.of()),
                StrategyRegistryTest.registry()
        );
        StrategyParamResolver invalidParams = new StrategyParamResolver(
                TestProperties.properties("macd", Map.of("fastPeriod", 30.0)),
                StrategyRegistryTest.registry()
        );

        assertThatThrownBy(unknownStrategy::resolveActive)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("v5");
        assertThatThrownBy(invalidParams::resolveActive)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fastPeriod");
    }
}
