package lab.utxo.orchestration.selection;

import java.math.BigDecimal;

/**
 * Raised by {@link UtxoSelector} when the candidate outputs cannot cover the requested total.
 * Not meant for callers outside selection; {@link RecipientPlanner} reports it as insufficient funds.
 */
public class InsufficientOutputsException extends RuntimeException {

    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientOutputsException(BigDecimal available, BigDecimal required) {
        super("insufficient total input outputs");
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
