package lab.utxo.domain.transaction;

import java.util.List;

/**
 * Unsigned transaction as produced by the codec.
 * Amounts are kept as plain decimal strings so the encoded form is stable.
 */
public record SafeTransaction(
        int version,
        String assetId,
        List<Input> inputs,
        List<Output> outputs,
        List<String> references,
        String extra
) {

    public SafeTransaction {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public record Input(
            String transactionHash,
            int outputIndex
    ) {}

    // Script outputs carry ghost keys and a mask; withdrawal outputs carry a destination instead.
    public record Output(
            String type,
            String amount,
            List<String> keys,
            String mask,
            int threshold,
            String destination,
            String tag
    ) {
        public static final String TYPE_SCRIPT = "script";
        public static final String TYPE_WITHDRAWAL = "withdrawal";
    }
}
