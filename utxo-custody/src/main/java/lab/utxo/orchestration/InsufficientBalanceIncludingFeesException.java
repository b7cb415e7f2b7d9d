package lab.utxo.orchestration;

public class InsufficientBalanceIncludingFeesException extends WithdrawalException {

    public InsufficientBalanceIncludingFeesException(String message) {
        super("INSUFFICIENT_BALANCE_INCLUDING_FEES", message);
    }
}
