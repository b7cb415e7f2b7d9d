package lab.utxo.orchestration;

public class InvalidRequestException extends WithdrawalException {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }
}
