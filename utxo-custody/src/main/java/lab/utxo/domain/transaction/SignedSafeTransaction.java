package lab.utxo.domain.transaction;

import java.util.List;

// Encoded raw transaction plus one signature per input, in input order.
public record SignedSafeTransaction(
        String raw,
        List<String> signatures
) {

    public SignedSafeTransaction {
        signatures = List.copyOf(signatures);
    }
}
