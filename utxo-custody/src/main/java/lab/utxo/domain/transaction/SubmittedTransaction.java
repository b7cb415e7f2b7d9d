package lab.utxo.domain.transaction;

public record SubmittedTransaction(
        String requestId,
        String transactionHash,
        String state
) {
}
