package lab.utxo.orchestration.fee;

import lab.utxo.orchestration.WithdrawalException;

public class NoFeeQuoteException extends WithdrawalException {

    public NoFeeQuoteException(String assetId, String chainAssetId) {
        super("NO_FEE_QUOTE", "no fee quote in " + assetId + " or its chain asset " + chainAssetId);
    }
}
