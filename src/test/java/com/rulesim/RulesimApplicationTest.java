package com.rulesim;

import static org.assertj.core.api.Assertions.assertThat;

import com.rulesim.config.RulesimProperties;
import com.rulesim.observability.BacktestMetrics;
import com.rulesim.runner.BacktestRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class RulesimApplicationTest {

    @Autowired
    private RulesimProperties rulesimProperties;

    @Autowired
    private BacktestRunner backtestRunner;

    @Autowired
    private BacktestMetrics backtestMetrics;

    @Test
    void contextLoads() {
        assertThat(backtestRunner).isNotNull();
        assertThat(rulesimProperties.getRules().getTopNRules()).isEqualTo(20);
        assertThat(rulesimProperties.toSimulationConfig().getCosts().getSpread()).isEqualTo(0.0002);
        assertThat(backtestMetrics.getTradeCount()).isZero();
    }
}
