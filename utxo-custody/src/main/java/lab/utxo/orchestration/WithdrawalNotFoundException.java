package lab.utxo.orchestration;

import java.util.UUID;

public class WithdrawalNotFoundException extends WithdrawalException {

    public WithdrawalNotFoundException(UUID id) {
        super("WITHDRAWAL_NOT_FOUND", "withdrawal not found: " + id);
    }
}
