package lab.utxo.domain.withdrawal;

public enum WithdrawalStatus {
    W0_REQUESTED,
    W1_FEE_RESOLVED,
    W2_FEE_TX_SENT,
    W3_SENT,
    W8_FAILED,
    W9_FEE_UNRECONCILED // fee transaction went out, main transaction did not
}
