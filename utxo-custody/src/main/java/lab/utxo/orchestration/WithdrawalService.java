package lab.utxo.orchestration;

import lab.utxo.adapter.SafeCredentials;
import lab.utxo.domain.transaction.SafeTransactionKind;
import lab.utxo.domain.transaction.SafeTransactionRecord;
import lab.utxo.domain.transaction.SafeTransactionRecordRepository;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.withdrawal.Withdrawal;
import lab.utxo.domain.withdrawal.WithdrawalRepository;
import lab.utxo.orchestration.fee.FeeResolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private static final int MAX_AMOUNT_SCALE = 8;

    private final WithdrawalRepository withdrawalRepository;
    private final SafeTransactionRecordRepository transactionRecordRepository;
    private final WithdrawalOrchestrator orchestrator;
    private final SafeCredentials credentials;
    private final TransactionTemplate transactionTemplate;
    private final ConcurrentHashMap<String, KeyLock> idempotencyLocks = new ConcurrentHashMap<>();

    // An entry lives only while some caller holds or waits for its key.
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    // Entry point for withdrawal creation with idempotency protection.
    // Same Idempotency-Key + same body returns the stored Withdrawal without touching the ledger again.
    public Withdrawal createOrGet(String idempotencyKey, CreateWithdrawalRequest req) {
        WithdrawalRequest request = toWithdrawalRequest(idempotencyKey, req);
        log.info(
                "event=withdrawal_service.create_or_get.start idempotencyKey={} assetId={} amount={} destination={}",
                idempotencyKey,
                request.assetId(),
                request.amount(),
                request.destination()
        );
        KeyLock keyLock = acquire(idempotencyKey);
        try {
            Withdrawal existing = transactionTemplate.execute(status ->
                    withdrawalRepository.findByIdempotencyKey(idempotencyKey)
                            .map(found -> validateIdempotentRequest(found, request))
                            .orElse(null)
            );
            if (existing != null) {
                return existing;
            }

            credentials.ensureConfigured();
            Withdrawal saved = withdrawalRepository.save(Withdrawal.requested(
                    idempotencyKey,
                    request.assetId(),
                    request.destination(),
                    request.tag(),
                    request.amount()
            ));
            log.info("event=withdrawal_service.create.persisted withdrawalId={} status={}", saved.getId(), saved.getStatus());

            Withdrawal result = execute(saved, request);
            log.info(
                    "event=withdrawal_service.create_or_get.done idempotencyKey={} withdrawalId={} status={} transactionHash={}",
                    idempotencyKey,
                    result.getId(),
                    result.getStatus(),
                    result.getTransactionHash()
            );
            return result;
        } finally {
            release(idempotencyKey, keyLock);
        }
    }

    private KeyLock acquire(String idempotencyKey) {
        KeyLock keyLock = idempotencyLocks.compute(idempotencyKey, (key, current) -> {
            KeyLock held = current == null ? new KeyLock() : current;
            held.users++;
            return held;
        });
        keyLock.lock.lock();
        return keyLock;
    }

    private void release(String idempotencyKey, KeyLock keyLock) {
        keyLock.lock.unlock();
        idempotencyLocks.computeIfPresent(idempotencyKey, (key, current) -> --current.users == 0 ? null : current);
    }

    int activeIdempotencyLocks() {
        return idempotencyLocks.size();
    }

    // Runs the ledger flow outside a DB transaction; each step is saved as it completes
    // so a failure still leaves the fee transaction on record.
    private Withdrawal execute(Withdrawal withdrawal, WithdrawalRequest request) {
        PersistingJournal journal = new PersistingJournal(withdrawal);
        try {
            WithdrawalOutcome outcome = orchestrator.withdraw(request, journal);
            log.info(
                    "event=withdrawal_service.sent withdrawalId={} flow={} transactionHash={} feeTransactionHash={}",
                    withdrawal.getId(),
                    outcome.flow(),
                    outcome.transactionId(),
                    outcome.feeTransaction() == null ? null : outcome.feeTransaction().transactionHash()
            );
            return journal.current;
        } catch (RuntimeException e) {
            Withdrawal failed = journal.current;
            failed.markFailed(e.getMessage());
            withdrawalRepository.save(failed);
            log.warn(
                    "event=withdrawal_service.failed withdrawalId={} status={} error={}",
                    failed.getId(),
                    failed.getStatus(),
                    e.getClass().getSimpleName()
            );
            throw e;
        }
    }

    // Enforce idempotency semantics strictly: same key can only replay the same logical request.
    private Withdrawal validateIdempotentRequest(Withdrawal existing, WithdrawalRequest request) {
        boolean matches = existing.getAssetId().equals(request.assetId())
                && existing.getDestination().equals(request.destination())
                && Objects.equals(existing.getTag(), request.tag())
                && existing.getAmount().compareTo(request.amount()) == 0;

        if (!matches) {
            log.warn(
                    "event=withdrawal_service.idempotency.conflict existingWithdrawalId={} idempotencyKey={}",
                    existing.getId(),
                    existing.getIdempotencyKey()
            );
            throw new IdempotencyConflictException("same Idempotency-Key cannot be used with a different request body");
        }

        log.info("event=withdrawal_service.idempotency.hit withdrawalId={} idempotencyKey={}", existing.getId(), existing.getIdempotencyKey());
        return existing;
    }

    @Transactional(readOnly = true)
    public Withdrawal get(UUID id) {
        return withdrawalRepository.findById(id)
                .orElseThrow(() -> new WithdrawalNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<SafeTransactionRecord> getTransactions(UUID withdrawalId) {
        get(withdrawalId);
        return transactionRecordRepository.findByWithdrawalIdOrderBySequenceNoAsc(withdrawalId);
    }

    private WithdrawalRequest toWithdrawalRequest(String idempotencyKey, CreateWithdrawalRequest req) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new InvalidRequestException("Idempotency-Key must not be blank");
        }
        if (req == null) {
            throw new InvalidRequestException("request body is required");
        }
        if (req.assetId() == null || req.assetId().isBlank()) {
            throw new InvalidRequestException("assetId is required");
        }
        if (req.destination() == null || req.destination().isBlank()) {
            throw new InvalidRequestException("destination is required");
        }
        BigDecimal amount = req.amount();
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException("amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new InvalidRequestException("amount supports at most " + MAX_AMOUNT_SCALE + " fractional digits");
        }
        String tag = req.tag() == null || req.tag().isBlank() ? null : req.tag().trim();
        return new WithdrawalRequest(req.assetId().trim(), amount, req.destination().trim(), tag);
    }

    private class PersistingJournal implements WithdrawalJournal {

        private Withdrawal current;
        private int sequenceNo;

        PersistingJournal(Withdrawal withdrawal) {
            this.current = withdrawal;
        }

        @Override
        public void onFeeResolved(FeeResolution resolution) {
            current.recordFee(resolution.fee().assetId(), resolution.fee().amount(), resolution.flow());
            current = withdrawalRepository.save(current);
        }

        @Override
        public void onTransactionSubmitted(SafeTransactionKind kind, SubmittedTransaction tx, String memo) {
            transactionRecordRepository.save(SafeTransactionRecord.submitted(current.getId(), ++sequenceNo, kind, tx, memo));
            if (kind == SafeTransactionKind.FEE) {
                current.recordFeeTransaction(tx.transactionHash());
            } else {
                current.recordSent(tx.transactionHash());
            }
            current = withdrawalRepository.save(current);
            log.info(
                    "event=withdrawal_service.transaction.recorded withdrawalId={} sequenceNo={} kind={} transactionHash={}",
                    current.getId(),
                    sequenceNo,
                    kind,
                    tx.transactionHash()
            );
        }
    }
}
