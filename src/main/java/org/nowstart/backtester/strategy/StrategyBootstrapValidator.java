package org.nowstart.backtester.strategy;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StrategyBootstrapValidator {

    private final StrategyParamResolver strategyParamResolver;

    @PostConstruct
    void validate() {
        strategyParamResolver.resolveActive();
    }
}
