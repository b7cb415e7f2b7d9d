package lab.utxo.orchestration;

import java.math.BigDecimal;

public class AmountTooSmallException extends WithdrawalException {

    public AmountTooSmallException(BigDecimal amount, BigDecimal fee) {
        super("AMOUNT_TOO_SMALL", "withdrawal amount " + amount.toPlainString()
                + " does not cover the fee " + fee.toPlainString());
    }
}
