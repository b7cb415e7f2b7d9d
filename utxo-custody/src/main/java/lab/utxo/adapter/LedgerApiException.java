package lab.utxo.adapter;

public class LedgerApiException extends RuntimeException {

    private final int code;

    public LedgerApiException(String message) {
        this(0, message);
    }

    public LedgerApiException(int code, String message) {
        super(message);
        this.code = code;
    }

    public LedgerApiException(String message, Throwable cause) {
        super(message, cause);
        this.code = 0;
    }

    // Ledger-side error code, 0 when the failure did not come with one.
    public int getCode() {
        return code;
    }
}
