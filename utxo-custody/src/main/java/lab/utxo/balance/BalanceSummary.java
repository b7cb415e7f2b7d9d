package lab.utxo.balance;

import java.math.BigDecimal;
import java.util.List;

// Totals are exact; rounding happens only when they are rendered.
public record BalanceSummary(
        List<AssetBalance> balances,
        BigDecimal totalUsd,
        BigDecimal totalBtc
) {
    public BalanceSummary {
        balances = List.copyOf(balances);
    }
}
