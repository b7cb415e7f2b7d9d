package lab.utxo.orchestration.fee;

import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.withdrawal.FeeFlow;

public record FeeResolution(
        SafeAsset asset,
        SafeAsset chainAsset,
        Fee fee,
        FeeFlow flow
) {
    public boolean isTwoPhase() {
        return flow == FeeFlow.CHAIN_ASSET_FEE;
    }
}
