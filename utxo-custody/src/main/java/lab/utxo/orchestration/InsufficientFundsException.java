package lab.utxo.orchestration;

import java.math.BigDecimal;

public class InsufficientFundsException extends WithdrawalException {

    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(BigDecimal available, BigDecimal required) {
        super("INSUFFICIENT_FUNDS", "insufficient funds: available=" + available.toPlainString()
                + ", required=" + required.toPlainString());
        this.available = available;
        this.required = required;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequired() {
        return required;
    }
}
