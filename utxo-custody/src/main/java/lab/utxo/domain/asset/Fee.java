package lab.utxo.domain.asset;

import java.math.BigDecimal;

public record Fee(
        String assetId,
        BigDecimal amount
) {
}
