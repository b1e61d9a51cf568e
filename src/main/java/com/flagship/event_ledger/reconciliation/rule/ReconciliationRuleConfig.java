package com.flagship.event_ledger.reconciliation.rule;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ReconciliationRuleConfig {

    @Bean
    public ReconciliationRuleRegistry reconciliationRuleRegistry(NegativeBalanceRule negativeBalances,
                                                                 OrphanedBetRule orphanedBets,
                                                                 MismatchedSettlementRule mismatchedSettlements,
                                                                 StuckSettlementRule stuckSettlements) {
        return new ReconciliationRuleRegistry(
                List.of(negativeBalances, orphanedBets, mismatchedSettlements, stuckSettlements));
    }
}
