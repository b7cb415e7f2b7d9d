package lab.utxo.domain.transaction;

import java.util.List;

public record GhostKey(
        String mask,
        List<String> keys
) {

    public GhostKey {
        keys = List.copyOf(keys);
    }
}
