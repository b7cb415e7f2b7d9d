package lab.utxo.adapter;

import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SafeTransaction;
import lab.utxo.domain.utxo.UnspentOutput;

import java.util.List;

public interface SafeTransactionCodec {

    /**
     * Builds an unsigned transaction.
     *
     * @param ghosts one entry per recipient; null for address recipients
     * @param references hashes of transactions this one depends on, may be empty
     */
    SafeTransaction build(
            List<UnspentOutput> inputs,
            List<Recipient> recipients,
            List<GhostKey> ghosts,
            byte[] extra,
            List<String> references);

    String encode(SafeTransaction tx);

    String sign(SafeTransaction tx, List<String> views, String spendPrivateKey);
}
