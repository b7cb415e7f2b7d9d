package lab.utxo.domain.asset;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;

public record SafeAsset(
        String assetId,
        String chainId,
        String symbol,
        String name,
        BigDecimal priceUsd,
        BigDecimal priceBtc
) {

    // A chain asset pays its own network fees.
    @JsonIgnore
    public boolean isChainAsset() {
        return assetId.equals(chainId);
    }
}
