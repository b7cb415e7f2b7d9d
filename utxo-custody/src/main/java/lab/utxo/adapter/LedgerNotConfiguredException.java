package lab.utxo.adapter;

public class LedgerNotConfiguredException extends RuntimeException {
    public LedgerNotConfiguredException(String message) {
        super(message);
    }
}
