package com.flagship.event_ledger.ingestion.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.ingestion.RawEvent;
import com.flagship.event_ledger.wagering.SettlementOutcome;
import com.flagship.event_ledger.wagering.WageringService;
import org.springframework.stereotype.Component;

/**
 * Wallet funding, bets and settlements. The wallet defaults to the account that
 * submitted the chain transaction.
 */
@Component
public class WageringEventHandlers {

    private final WageringService wageringService;
    private final ObjectMapper objectMapper;

    public WageringEventHandlers(WageringService wageringService, ObjectMapper objectMapper) {
        this.wageringService = wageringService;
        this.objectMapper = objectMapper;
    }

    public void onDeposit(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        wageringService.deposit(wallet(payload, event), payload.decimal("amount"), event.getEventId());
    }

    public void onWithdrawal(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        wageringService.withdraw(wallet(payload, event), payload.decimal("amount"), event.getEventId());
    }

    public void onBetPlaced(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        wageringService.placeBet(payload.uuid("betId"), payload.uuid("listingId"), wallet(payload, event),
                payload.decimal("stake"), payload.decimal("odds"));
    }

    public void onSettlementRequested(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        SettlementOutcome outcome = payload.optionalEnum("outcome", SettlementOutcome.class)
                .orElseThrow(() -> new IllegalArgumentException("Payload of event " + event.getEventId() + " is missing outcome"));
        wageringService.requestSettlement(payload.uuid("betId"), outcome,
                payload.optionalDecimal("payout").orElse(null),
                payload.optionalText("txHash").isPresent());
    }

    public void onSettlementConfirmed(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        wageringService.confirmSettlement(payload.uuid("betId"), payload.optionalDecimal("payout").orElse(null));
    }

    public void onSettlementFailed(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        wageringService.failSettlement(payload.uuid("betId"),
                payload.optionalText("reason").orElse("settlement failed on chain"));
    }

    private String wallet(PayloadReader payload, RawEvent event) {
        return payload.optionalText("wallet").orElse(event.getContract());
    }
}
