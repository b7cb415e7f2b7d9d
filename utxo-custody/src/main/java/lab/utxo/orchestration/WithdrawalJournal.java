package lab.utxo.orchestration;

import lab.utxo.domain.transaction.SafeTransactionKind;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.orchestration.fee.FeeResolution;

/**
 * Receives progress of a withdrawal while it runs, so a caller can persist each step
 * as soon as it happens rather than only after the whole flow returns.
 */
public interface WithdrawalJournal {

    WithdrawalJournal NOOP = new WithdrawalJournal() {};

    default void onFeeResolved(FeeResolution resolution) {
    }

    default void onTransactionSubmitted(SafeTransactionKind kind, SubmittedTransaction tx, String memo) {
    }
}
