package lab.utxo.orchestration;

/**
 * Base type for withdrawal failures that are the caller's problem rather than the ledger's.
 * Each subtype carries a stable code that is returned in the error body.
 */
public abstract class WithdrawalException extends RuntimeException {

    private final String code;

    protected WithdrawalException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
