package com.flagship.event_ledger.wagering;

import com.flagship.event_ledger.ledger.Account;
import com.flagship.event_ledger.ledger.AccountService;
import com.flagship.event_ledger.ledger.AccountType;
import com.flagship.event_ledger.ledger.LedgerService;
import com.flagship.event_ledger.ledger.TransactionRequest;
import com.flagship.event_ledger.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bets, settlements and wallet funding, each posted to the ledger atomically
 * with the state change that caused it.
 *
 * Key principles:
 * - Bet placement moves the stake from the wallet into escrow
 * - Settlement releases the stake from escrow; the house covers or absorbs the
 *   difference between stake and payout
 * - The bet row is locked for the duration of any settlement step, so concurrent
 *   deliveries for one bet serialize
 * - Confirming an already completed settlement is a no-op returning its ledger transaction
 *
 * All methods join the caller's transaction (the event processor's unit of work).
 */
@Service
@Slf4j
public class WageringService {

    private final BetRepository betRepository;
    private final SettlementRepository settlementRepository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public WageringService(BetRepository betRepository,
                           SettlementRepository settlementRepository,
                           AccountService accountService,
                           LedgerService ledgerService,
                           PipelineMetrics metrics,
                           Clock clock) {
        this.betRepository = betRepository;
        this.settlementRepository = settlementRepository;
        this.accountService = accountService;
        this.ledgerService = ledgerService;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Transactional
    public UUID deposit(String walletAddress, BigDecimal amount, String reference) {
        UUID wallet = accountService.ensureWallet(walletAddress);
        UUID cash = accountService.ensureAccount(Account.PLATFORM_CASH, AccountType.ASSET);
        UUID txId = ledgerService.postTransaction(TransactionRequest.transfer(
            "Deposit " + reference, cash, wallet, amount));
        log.info("Deposit posted: wallet={}, amount={}, ledgerTxId={}", walletAddress, amount, txId);
        return txId;
    }

    @Transactional
    public UUID withdraw(String walletAddress, BigDecimal amount, String reference) {
        UUID wallet = accountService.ensureWallet(walletAddress);
        UUID cash = accountService.ensureAccount(Account.PLATFORM_CASH, AccountType.ASSET);
        UUID txId = ledgerService.postTransaction(TransactionRequest.transfer(
            "Withdrawal " + reference, wallet, cash, amount));
        log.info("Withdrawal posted: wallet={}, amount={}, ledgerTxId={}", walletAddress, amount, txId);
        return txId;
    }

    /**
     * Records a bet and moves its stake into escrow. A bet id seen before is a no-op.
     * The listing is not checked: bets on unknown listings are reported by reconciliation.
     */
    @Transactional
    public Bet placeBet(UUID betId, UUID listingId, String walletAddress, BigDecimal stake, BigDecimal odds) {
        Optional<Bet> existing = betRepository.findById(betId);
        if (existing.isPresent()) {
            log.info("Bet {} already recorded, skipping", betId);
            return existing.get();
        }

        UUID wallet = accountService.ensureWallet(walletAddress);
        UUID escrow = accountService.ensureAccount(Account.WAGER_ESCROW, AccountType.LIABILITY);
        Bet bet = Bet.place(betId, listingId, wallet, stake, odds, clock.instant());
        betRepository.insert(bet);
        ledgerService.postTransaction(TransactionRequest.transfer(
            "Bet stake " + betId, wallet, escrow, stake));

        log.info("Bet placed: betId={}, listingId={}, stake={}, odds={}", betId, listingId, stake, odds);
        return bet;
    }

    /**
     * Opens (or reopens, after a failure) the settlement of an OPEN bet.
     *
     * @param payout     null means the payout implied by the outcome
     * @param submitted  true when the settlement transaction is already on chain
     * @throws IllegalStateException if the bet is closed or its settlement completed
     */
    @Transactional
    public Settlement requestSettlement(UUID betId, SettlementOutcome outcome, BigDecimal payout, boolean submitted) {
        Bet bet = lockBet(betId);
        Instant now = clock.instant();
        BigDecimal amount = payout != null ? payout : outcome.defaultPayout(bet.getStake(), bet.getOdds());

        Optional<Settlement> existing = settlementRepository.findByBetId(betId);
        Settlement settlement;
        if (existing.isEmpty()) {
            requireOpen(bet);
            settlement = Settlement.request(betId, outcome, amount, now);
            if (submitted) {
                settlement = settlement.startProcessing(now);
            }
            settlementRepository.insert(settlement);
        } else {
            Settlement current = existing.get();
            if (current.getStatus() == SettlementStatus.COMPLETED) {
                throw new IllegalStateException("Bet " + betId + " is already settled");
            }
            if (current.getStatus() != SettlementStatus.FAILED) {
                if (submitted && current.getStatus() == SettlementStatus.PENDING) {
                    Settlement processing = current.startProcessing(now);
                    settlementRepository.update(processing);
                    return processing;
                }
                log.info("Settlement for bet {} already {}, keeping it", betId, current.getStatus());
                return current;
            }
            requireOpen(bet);
            settlement = current.reopen(outcome, amount, now);
            if (submitted) {
                settlement = settlement.startProcessing(now);
            }
            settlementRepository.update(settlement);
        }

        log.info("Settlement requested: betId={}, outcome={}, payout={}, status={}",
                betId, outcome, amount, settlement.getStatus());
        return settlement;
    }

    /**
     * Completes the settlement of a bet and posts its ledger transaction.
     *
     * @param recordedPayout payout reported by the chain; null means the settlement's payout
     * @return id of the ledger transaction (the existing one when already completed)
     * @throws IllegalStateException if there is no settlement or it failed
     */
    @Transactional
    public UUID confirmSettlement(UUID betId, BigDecimal recordedPayout) {
        Bet bet = lockBet(betId);
        Settlement settlement = settlementRepository.findByBetId(betId)
            .orElseThrow(() -> new IllegalStateException("No settlement requested for bet " + betId));

        if (settlement.getStatus() == SettlementStatus.COMPLETED) {
            log.info("Settlement for bet {} already completed: ledgerTxId={}",
                    betId, settlement.getLedgerTransactionId());
            return settlement.getLedgerTransactionId();
        }
        if (settlement.getStatus() == SettlementStatus.FAILED) {
            throw new IllegalStateException("Settlement for bet " + betId + " has failed and must be re-requested");
        }

        Instant now = clock.instant();
        BigDecimal paid = recordedPayout != null ? recordedPayout : settlement.getPayout();
        UUID ledgerTxId = ledgerService.postTransaction(settlementPostings(bet, paid));

        betRepository.update(bet.settle(settlement.getOutcome(), paid, now));
        settlementRepository.update(settlement.complete(ledgerTxId, now));
        metrics.recordSettlement(settlement.getOutcome().name());

        if (paid.compareTo(settlement.getPayout()) != 0) {
            log.warn("Settlement for bet {} paid {} but requested {}", betId, paid, settlement.getPayout());
        }
        log.info("Settlement completed: betId={}, outcome={}, payout={}, ledgerTxId={}",
                betId, settlement.getOutcome(), paid, ledgerTxId);
        return ledgerTxId;
    }

    /**
     * Marks a pending settlement failed. Failing an already failed settlement is a no-op.
     *
     * @throws IllegalStateException if there is no settlement or it completed
     */
    @Transactional
    public void failSettlement(UUID betId, String reason) {
        lockBet(betId);
        Settlement settlement = settlementRepository.findByBetId(betId)
            .orElseThrow(() -> new IllegalStateException("No settlement requested for bet " + betId));
        if (settlement.getStatus() == SettlementStatus.FAILED) {
            log.info("Settlement for bet {} already failed", betId);
            return;
        }
        settlementRepository.update(settlement.fail(reason, clock.instant()));
        metrics.recordSettlement("failed");
        log.warn("Settlement failed: betId={}, reason={}", betId, reason);
    }

    /**
     * Voids every OPEN bet on a listing, returning the stakes to their wallets.
     *
     * @return number of bets voided
     */
    @Transactional
    public int voidOpenBets(UUID listingId) {
        List<UUID> open = betRepository.findOpenBetIdsByListing(listingId);
        for (UUID betId : open) {
            requestSettlement(betId, SettlementOutcome.VOID, null, false);
            confirmSettlement(betId, null);
        }
        if (!open.isEmpty()) {
            log.info("Voided {} open bets on listing {}", open.size(), listingId);
        }
        return open.size();
    }

    @Transactional(readOnly = true)
    public Optional<Bet> findBet(UUID betId) {
        return betRepository.findById(betId);
    }

    @Transactional(readOnly = true)
    public Optional<Settlement> findSettlement(UUID betId) {
        return settlementRepository.findByBetId(betId);
    }

    private TransactionRequest settlementPostings(Bet bet, BigDecimal payout) {
        UUID escrow = accountService.ensureAccount(Account.WAGER_ESCROW, AccountType.LIABILITY);
        UUID house = accountService.ensureAccount(Account.HOUSE, AccountType.EQUITY);
        String description = "Settlement of bet " + bet.getId();

        List<TransactionRequest.Posting> debits = new ArrayList<>();
        List<TransactionRequest.Posting> credits = new ArrayList<>();
        debits.add(TransactionRequest.Posting.of(escrow, bet.getStake(), description + ": release stake"));
        if (payout.signum() > 0) {
            credits.add(TransactionRequest.Posting.of(bet.getAccountId(), payout, description + ": payout"));
        }

        BigDecimal houseResult = payout.subtract(bet.getStake());
        if (houseResult.signum() > 0) {
            debits.add(TransactionRequest.Posting.of(house, houseResult, description + ": house pays winnings"));
        } else if (houseResult.signum() < 0) {
            credits.add(TransactionRequest.Posting.of(house, houseResult.negate(), description + ": house keeps stake"));
        }
        return new TransactionRequest(description, debits, credits);
    }

    private Bet lockBet(UUID betId) {
        return betRepository.findByIdForUpdate(betId).orElseThrow(() -> new BetNotFoundException(betId));
    }

    private void requireOpen(Bet bet) {
        if (!bet.isOpen()) {
            throw new IllegalStateException("Bet " + bet.getId() + " is " + bet.getStatus() + " and cannot be settled");
        }
    }
}
