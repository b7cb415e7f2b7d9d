package lab.utxo.orchestration;

import lab.utxo.domain.transaction.SafeTransactionRecord;
import lab.utxo.domain.withdrawal.Withdrawal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/withdrawals")
@Slf4j
public class WithdrawalController {

    private final WithdrawalService withdrawalService;

    // Idempotency-Key is required so client retries never submit a second withdrawal.
    @PostMapping
    public ResponseEntity<Withdrawal> create(
            @RequestHeader("Idempotency-Key") String idempotencyKey,
            @RequestBody CreateWithdrawalRequest req
    ) {
        log.info(
                "event=withdrawal.create.request assetId={} amount={} destination={} idempotencyKeyPresent={}",
                req.assetId(),
                req.amount(),
                req.destination(),
                idempotencyKey != null && !idempotencyKey.isBlank()
        );
        Withdrawal w = withdrawalService.createOrGet(idempotencyKey, req);
        log.info(
                "event=withdrawal.create.response withdrawalId={} status={} transactionHash={}",
                w.getId(),
                w.getStatus(),
                w.getTransactionHash()
        );
        return ResponseEntity.ok(w);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Withdrawal> get(@PathVariable UUID id) {
        log.info("event=withdrawal.get.request withdrawalId={}", id);
        Withdrawal withdrawal = withdrawalService.get(id);
        log.info("event=withdrawal.get.response withdrawalId={} status={}", withdrawal.getId(), withdrawal.getStatus());
        return ResponseEntity.ok(withdrawal);
    }

    // Fee and main transactions in submission order.
    @GetMapping("/{id}/transactions")
    public ResponseEntity<List<SafeTransactionRecord>> getTransactions(@PathVariable UUID id) {
        log.info("event=withdrawal.transactions.request withdrawalId={}", id);
        List<SafeTransactionRecord> records = withdrawalService.getTransactions(id);
        log.info("event=withdrawal.transactions.response withdrawalId={} count={}", id, records.size());
        return ResponseEntity.ok(records);
    }
}
