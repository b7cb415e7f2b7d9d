package lab.utxo.orchestration;

import java.math.BigDecimal;

public record CreateWithdrawalRequest(
        String assetId,
        BigDecimal amount,
        String destination,
        String tag
) {}
