package lab.utxo.domain.transaction;

public enum SafeTransactionKind {
    FEE,
    MAIN
}
