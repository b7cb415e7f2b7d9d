package lab.utxo.domain.transaction;

import java.util.List;

// Ledger answer to a verification request: one view per input, needed for signing.
public record VerifiedTransaction(
        String requestId,
        List<String> views
) {

    public VerifiedTransaction {
        views = List.copyOf(views);
    }
}
