package lab.utxo.orchestration;

public class IdempotencyConflictException extends WithdrawalException {

    public IdempotencyConflictException(String message) {
        super("IDEMPOTENCY_CONFLICT", message);
    }
}
