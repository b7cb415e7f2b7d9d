package lab.utxo.balance;

// Display values: balance and BTC at 8 decimals, USD at 2.
public record AssetBalance(
        String assetId,
        String symbol,
        String balance,
        String balanceUsd,
        String balanceBtc
) {}
