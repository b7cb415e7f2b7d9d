package lab.utxo.adapter;

import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.transaction.VerifiedTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.domain.utxo.UtxoQuery;

import java.util.List;

/**
 * Remote ledger operations used by the withdrawal flow.
 * Implementations throw {@link LedgerApiException} for any rejected or failed call.
 */
public interface SafeLedgerClient {

    List<UnspentOutput> listUnspentOutputs(UtxoQuery query);

    SafeAsset fetchAsset(String assetId);

    List<Fee> fetchFees(String assetId, String destination);

    // Returns one ghost key per recipient, in the given order.
    List<GhostKey> deriveGhostKeys(List<GroupRecipient> recipients, String requestId, String spendPrivateKey);

    VerifiedTransaction verifyTransaction(String raw, String requestId);

    SubmittedTransaction submitTransaction(String signedRaw, String requestId);

    SubmittedTransaction fetchTransaction(String transactionHash);

    String createDepositEntry(List<String> members, int threshold, String chainId);

    // Cheap authenticated call used once at startup to reject bad credentials.
    void verifyCredentials();
}
