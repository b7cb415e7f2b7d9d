package lab.utxo.orchestration;

import java.math.BigDecimal;

public record WithdrawalRequest(
        String assetId,
        BigDecimal amount,
        String destination,
        String tag
) {}
