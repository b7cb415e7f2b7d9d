package lab.utxo.orchestration;

import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.withdrawal.FeeFlow;

// feeTransaction is only present for CHAIN_ASSET_FEE withdrawals.
public record WithdrawalOutcome(
        FeeFlow flow,
        Fee fee,
        SubmittedTransaction feeTransaction,
        SubmittedTransaction transaction
) {
    public String transactionId() {
        return transaction.transactionHash();
    }
}
