package lab.utxo.orchestration;

import lab.utxo.adapter.SafeCredentials;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.recipient.AddressRecipient;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.SafeTransactionKind;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.domain.utxo.UtxoQuery;
import lab.utxo.orchestration.fee.FeeResolution;
import lab.utxo.orchestration.fee.FeeResolver;
import lab.utxo.orchestration.selection.RecipientPlan;
import lab.utxo.orchestration.selection.RecipientPlanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Drives one withdrawal through fee resolution, planning and submission.
 * <p>
 * When the fee is quoted in the withdrawn asset a single transaction pays both the
 * destination and the fee collector. Otherwise a fee transaction in the chain asset is
 * sent first and the main transaction references its hash. All transactions are planned
 * before the first one is sent, so funding problems never leave a half-sent withdrawal.
 * A main transaction that fails after its fee transaction went out is not compensated.
 */
@Component
@Slf4j
public class WithdrawalOrchestrator {

    static final String MEMO = "withdrawal-memo";
    static final String FEE_MEMO = "withdrawal-fee-memo";

    enum Phase {
        RESOLVE_FEE,
        SINGLE_PHASE,
        TWO_PHASE,
        ASSEMBLED,
        SENT
    }

    private record PlannedTransaction(SafeTransactionKind kind, RecipientPlan plan, String memo) {}

    private final FeeResolver feeResolver;
    private final RecipientPlanner planner;
    private final SafeTransactionAssembler assembler;
    private final SafeLedgerClient ledgerClient;
    private final SafeCredentials credentials;
    private final String feeCollector;

    public WithdrawalOrchestrator(
            FeeResolver feeResolver,
            RecipientPlanner planner,
            SafeTransactionAssembler assembler,
            SafeLedgerClient ledgerClient,
            SafeCredentials credentials,
            @Value("${custody.safe.fee-collector}") String feeCollector
    ) {
        this.feeResolver = feeResolver;
        this.planner = planner;
        this.assembler = assembler;
        this.ledgerClient = ledgerClient;
        this.credentials = credentials;
        this.feeCollector = feeCollector;
    }

    public WithdrawalOutcome withdraw(WithdrawalRequest request) {
        return withdraw(request, WithdrawalJournal.NOOP);
    }

    public WithdrawalOutcome withdraw(WithdrawalRequest request, WithdrawalJournal journal) {
        credentials.ensureConfigured();
        validate(request);

        Phase phase = Phase.RESOLVE_FEE;
        FeeResolution resolution = null;
        List<PlannedTransaction> planned = List.of();
        WithdrawalOutcome outcome = null;

        while (phase != Phase.SENT) {
            Phase next;
            switch (phase) {
                case RESOLVE_FEE -> {
                    resolution = feeResolver.resolve(request.assetId(), request.destination());
                    journal.onFeeResolved(resolution);
                    next = resolution.isTwoPhase() ? Phase.TWO_PHASE : Phase.SINGLE_PHASE;
                }
                case SINGLE_PHASE -> {
                    planned = planSinglePhase(request, resolution.fee());
                    next = Phase.ASSEMBLED;
                }
                case TWO_PHASE -> {
                    planned = planTwoPhase(request, resolution.fee());
                    next = Phase.ASSEMBLED;
                }
                case ASSEMBLED -> {
                    outcome = send(request, resolution, planned, journal);
                    next = Phase.SENT;
                }
                default -> throw new IllegalStateException("unexpected withdrawal phase " + phase);
            }
            log.info("event=withdrawal_orchestrator.transition assetId={} from={} to={}", request.assetId(), phase, next);
            phase = next;
        }
        return outcome;
    }

    private List<PlannedTransaction> planSinglePhase(WithdrawalRequest request, Fee fee) {
        BigDecimal adjusted = request.amount().subtract(fee.amount());
        if (adjusted.signum() < 0) {
            throw new AmountTooSmallException(request.amount(), fee.amount());
        }
        List<UnspentOutput> outputs = ledgerClient.listUnspentOutputs(UtxoQuery.unspent(request.assetId()));
        RecipientPlan plan = planner.plan(primary(request, adjusted), feeRecipient(fee), outputs);
        return List.of(new PlannedTransaction(SafeTransactionKind.MAIN, plan, MEMO));
    }

    private List<PlannedTransaction> planTwoPhase(WithdrawalRequest request, Fee fee) {
        List<UnspentOutput> assetOutputs = ledgerClient.listUnspentOutputs(UtxoQuery.unspent(request.assetId()));
        List<UnspentOutput> feeOutputs = ledgerClient.listUnspentOutputs(UtxoQuery.unspent(fee.assetId()));

        BigDecimal assetTotal = total(assetOutputs);
        BigDecimal feeTotal = total(feeOutputs);
        if (assetTotal.compareTo(request.amount()) < 0 || feeTotal.compareTo(fee.amount()) < 0) {
            log.warn("event=withdrawal_orchestrator.precheck_failed assetId={} assetTotal={} amount={} feeAssetId={} feeTotal={} fee={}",
                    request.assetId(), assetTotal.toPlainString(), request.amount().toPlainString(),
                    fee.assetId(), feeTotal.toPlainString(), fee.amount().toPlainString());
            throw new InsufficientBalanceIncludingFeesException("insufficient balance including fees: "
                    + request.assetId() + " available=" + assetTotal.toPlainString() + " required=" + request.amount().toPlainString()
                    + ", " + fee.assetId() + " available=" + feeTotal.toPlainString() + " required=" + fee.amount().toPlainString());
        }

        RecipientPlan feePlan = planner.plan(feeRecipient(fee), null, feeOutputs);
        RecipientPlan mainPlan = planner.plan(primary(request, request.amount()), null, assetOutputs);
        return List.of(
                new PlannedTransaction(SafeTransactionKind.FEE, feePlan, FEE_MEMO),
                new PlannedTransaction(SafeTransactionKind.MAIN, mainPlan, MEMO)
        );
    }

    // Fee transaction (if any) goes first; the main transaction references its hash.
    private WithdrawalOutcome send(
            WithdrawalRequest request,
            FeeResolution resolution,
            List<PlannedTransaction> planned,
            WithdrawalJournal journal
    ) {
        SubmittedTransaction feeTransaction = null;
        SubmittedTransaction mainTransaction = null;
        for (PlannedTransaction tx : planned) {
            if (tx.kind() == SafeTransactionKind.FEE) {
                feeTransaction = assembler.assemble(tx.plan(), tx.memo(), null);
                journal.onTransactionSubmitted(SafeTransactionKind.FEE, feeTransaction, tx.memo());
                continue;
            }
            String feeReference = feeTransaction == null ? null : feeTransaction.transactionHash();
            try {
                mainTransaction = assembler.assemble(tx.plan(), tx.memo(), feeReference);
            } catch (RuntimeException e) {
                if (feeTransaction != null) {
                    log.error("event=withdrawal_orchestrator.fee_unreconciled assetId={} destination={} feeTransactionHash={} error={}",
                            request.assetId(), request.destination(), feeTransaction.transactionHash(), e.getMessage());
                }
                throw e;
            }
            journal.onTransactionSubmitted(SafeTransactionKind.MAIN, mainTransaction, tx.memo());
        }
        if (mainTransaction == null) {
            throw new IllegalStateException("no main transaction planned for " + request.assetId());
        }
        return new WithdrawalOutcome(resolution.flow(), resolution.fee(), feeTransaction, mainTransaction);
    }

    private static Recipient primary(WithdrawalRequest request, BigDecimal amount) {
        return new AddressRecipient(request.destination(), request.tag(), amount);
    }

    private GroupRecipient feeRecipient(Fee fee) {
        return GroupRecipient.single(feeCollector, fee.amount());
    }

    private static BigDecimal total(List<UnspentOutput> outputs) {
        return outputs.stream().map(UnspentOutput::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void validate(WithdrawalRequest request) {
        if (request.assetId() == null || request.assetId().isBlank()) {
            throw new InvalidRequestException("assetId is required");
        }
        if (request.destination() == null || request.destination().isBlank()) {
            throw new InvalidRequestException("destination is required");
        }
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw new InvalidRequestException("amount must be greater than zero");
        }
    }
}
