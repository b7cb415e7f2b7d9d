package lab.utxo.orchestration.fee;

import lab.utxo.adapter.LedgerApiException;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.withdrawal.FeeFlow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class FeeResolver {

    private final SafeLedgerClient ledgerClient;

    // A quote in the withdrawn asset wins over one in the chain asset.
    public FeeResolution resolve(String assetId, String destination) {
        SafeAsset asset = ledgerClient.fetchAsset(assetId);
        if (asset.chainId() == null || asset.chainId().isBlank()) {
            throw new LedgerApiException("Ledger returned asset " + assetId + " without a chain id");
        }
        SafeAsset chainAsset = asset.isChainAsset() ? asset : ledgerClient.fetchAsset(asset.chainId());

        List<Fee> quotes = ledgerClient.fetchFees(assetId, destination);
        Fee fee = findQuote(quotes, asset.assetId())
                .or(() -> findQuote(quotes, chainAsset.assetId()))
                .orElseThrow(() -> {
                    log.warn("event=fee_resolver.no_quote assetId={} chainAssetId={} quotes={}",
                            assetId, chainAsset.assetId(), quotes.size());
                    return new NoFeeQuoteException(assetId, chainAsset.assetId());
                });

        FeeFlow flow = fee.assetId().equals(asset.assetId()) ? FeeFlow.SAME_ASSET_FEE : FeeFlow.CHAIN_ASSET_FEE;
        log.info("event=fee_resolver.resolved assetId={} feeAssetId={} fee={} flow={}",
                assetId, fee.assetId(), fee.amount().toPlainString(), flow);
        return new FeeResolution(asset, chainAsset, fee, flow);
    }

    private static Optional<Fee> findQuote(List<Fee> quotes, String assetId) {
        return quotes.stream().filter(q -> assetId.equals(q.assetId())).findFirst();
    }
}
