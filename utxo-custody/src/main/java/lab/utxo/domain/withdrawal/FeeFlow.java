package lab.utxo.domain.withdrawal;

public enum FeeFlow {
    // fee is paid in the withdrawn asset, inside the withdrawal transaction
    SAME_ASSET_FEE,
    // fee is paid in the chain asset by a separate transaction submitted first
    CHAIN_ASSET_FEE
}
