package lab.utxo.domain.utxo;

import java.math.BigDecimal;
import java.util.List;

/**
 * Snapshot of one spendable output as listed by the ledger.
 * The snapshot may already be stale when it is used; the ledger rejects spends of outputs
 * that another transaction consumed in the meantime.
 * {@code sequence} orders outputs in the ledger and is the paging cursor for listings.
 */
public record UnspentOutput(
        String outputId,
        String transactionHash,
        int outputIndex,
        String assetId,
        BigDecimal amount,
        List<String> receivers,
        int receiversThreshold,
        String state,
        long sequence
) {
    public static final String STATE_UNSPENT = "unspent";
    public static final String STATE_SPENT = "spent";

    public UnspentOutput {
        receivers = receivers == null ? List.of() : List.copyOf(receivers);
    }
}
