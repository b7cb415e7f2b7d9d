package lab.utxo.sim.fakeledger;

import lab.utxo.adapter.EcdsaSafeTransactionCodec;
import lab.utxo.adapter.LedgerApiException;
import lab.utxo.adapter.SafeCredentials;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SafeTransaction;
import lab.utxo.domain.transaction.SignedSafeTransaction;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.transaction.VerifiedTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.domain.utxo.UtxoQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory ledger used in mock mode and in tests.
 * <p>
 * It keeps the checks a real ledger makes on the decision logic: spent or unknown inputs
 * are rejected, inputs must balance outputs, references must point at submitted
 * transactions and every input signature must come from the spend key. Script outputs
 * addressed to the application come back as new unspent outputs, so change is spendable.
 */
@Component
@ConditionalOnProperty(prefix = "custody.safe", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class FakeSafeLedger implements SafeLedgerClient {

    public enum NextOutcome {
        SUCCESS,
        FAIL_SYSTEM
    }

    private record PendingTransaction(String raw, List<String> views) {}

    private final EcdsaSafeTransactionCodec codec;
    private final SafeCredentials credentials;
    private final SecureRandom random = new SecureRandom();

    private final Map<String, SafeAsset> assets = new LinkedHashMap<>();
    private final Map<String, List<Fee>> fees = new LinkedHashMap<>();
    // keyed by transactionHash:outputIndex
    private final Map<String, UnspentOutput> outputs = new LinkedHashMap<>();
    private final Map<String, List<String>> membersByMask = new LinkedHashMap<>();
    private final Map<String, PendingTransaction> pending = new LinkedHashMap<>();
    private final Map<String, SubmittedTransaction> submittedByRequest = new LinkedHashMap<>();
    private final Map<String, SubmittedTransaction> submittedByHash = new LinkedHashMap<>();
    private final Map<String, String> rawByHash = new LinkedHashMap<>();
    private final List<NextOutcome> scriptedOutcomes = new ArrayList<>();
    private long sequence;

    public FakeSafeLedger(EcdsaSafeTransactionCodec codec, SafeCredentials credentials) {
        this.codec = codec;
        this.credentials = credentials;
    }

    public synchronized void putAsset(SafeAsset asset) {
        assets.put(asset.assetId(), asset);
    }

    public synchronized void putFees(String assetId, List<Fee> quotes) {
        fees.put(assetId, List.copyOf(quotes));
    }

    public synchronized UnspentOutput seedOutput(String assetId, BigDecimal amount, List<String> receivers, int threshold) {
        String hash = randomHex(32);
        UnspentOutput output = new UnspentOutput(
                UUID.randomUUID().toString(), hash, 0, assetId, amount, receivers, threshold, UnspentOutput.STATE_UNSPENT,
                ++sequence);
        outputs.put(key(hash, 0), output);
        return output;
    }

    // Applies to the next submission only; later ones succeed again.
    public synchronized void setNextOutcome(NextOutcome outcome) {
        scriptedOutcomes.add(outcome);
    }

    public synchronized List<SubmittedTransaction> submittedTransactions() {
        return List.copyOf(submittedByRequest.values());
    }

    public synchronized SafeTransaction submittedTransaction(String transactionHash) {
        fetchTransaction(transactionHash);
        return codec.decode(rawByHash.get(transactionHash));
    }

    @Override
    public synchronized List<UnspentOutput> listUnspentOutputs(UtxoQuery query) {
        return outputs.values().stream()
                .filter(o -> query.state() == null || query.state().equals(o.state()))
                .filter(o -> query.assetId() == null || query.assetId().equals(o.assetId()))
                .toList();
    }

    @Override
    public synchronized SafeAsset fetchAsset(String assetId) {
        SafeAsset asset = assets.get(assetId);
        if (asset == null) {
            throw new LedgerApiException(404, "asset not found: " + assetId);
        }
        return asset;
    }

    @Override
    public synchronized List<Fee> fetchFees(String assetId, String destination) {
        fetchAsset(assetId);
        return fees.getOrDefault(assetId, List.of());
    }

    @Override
    public synchronized List<GhostKey> deriveGhostKeys(List<GroupRecipient> recipients, String requestId, String spendPrivateKey) {
        List<GhostKey> ghosts = new ArrayList<>(recipients.size());
        for (GroupRecipient recipient : recipients) {
            String mask = randomHex(32);
            List<String> keys = recipient.members().stream().map(m -> randomHex(32)).toList();
            membersByMask.put(mask, recipient.members());
            ghosts.add(new GhostKey(mask, keys));
        }
        return ghosts;
    }

    @Override
    public synchronized VerifiedTransaction verifyTransaction(String raw, String requestId) {
        SafeTransaction tx = codec.decode(raw);

        BigDecimal inputTotal = BigDecimal.ZERO;
        for (SafeTransaction.Input input : tx.inputs()) {
            UnspentOutput spent = requireUnspent(input);
            if (!spent.assetId().equals(tx.assetId())) {
                throw new LedgerApiException(10002, "input asset does not match transaction asset");
            }
            inputTotal = inputTotal.add(spent.amount());
        }
        BigDecimal outputTotal = tx.outputs().stream()
                .map(o -> new BigDecimal(o.amount()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (inputTotal.compareTo(outputTotal) != 0) {
            throw new LedgerApiException(10002, "inputs " + inputTotal.toPlainString()
                    + " do not match outputs " + outputTotal.toPlainString());
        }
        for (String reference : tx.references()) {
            if (!submittedByHash.containsKey(reference)) {
                throw new LedgerApiException(10002, "unknown reference " + reference);
            }
        }

        List<String> views = tx.inputs().stream().map(i -> randomHex(32)).toList();
        pending.put(requestId, new PendingTransaction(raw, views));
        return new VerifiedTransaction(requestId, views);
    }

    @Override
    public synchronized SubmittedTransaction submitTransaction(String signedRaw, String requestId) {
        SubmittedTransaction previous = submittedByRequest.get(requestId);
        if (previous != null) {
            return previous;
        }
        if (!scriptedOutcomes.isEmpty() && scriptedOutcomes.remove(0) == NextOutcome.FAIL_SYSTEM) {
            log.warn("event=fake_ledger.submit.scripted_failure requestId={}", requestId);
            throw new LedgerApiException(500, "simulated ledger failure for request " + requestId);
        }

        PendingTransaction verified = pending.get(requestId);
        if (verified == null) {
            throw new LedgerApiException(404, "no verified transaction for request " + requestId);
        }
        SignedSafeTransaction signed = codec.decodeSigned(signedRaw);
        if (!verified.raw().equals(signed.raw())) {
            throw new LedgerApiException(10002, "signed transaction differs from the verified one");
        }
        if (signed.signatures().size() != verified.views().size()) {
            throw new LedgerApiException(10002, "expected one signature per input");
        }
        String expected = Credentials.create(credentials.spendPrivateKey()).getAddress();
        for (int i = 0; i < verified.views().size(); i++) {
            String signer = codec.recoverSignerAddress(signed.raw(), verified.views().get(i), signed.signatures().get(i));
            if (!expected.equalsIgnoreCase(signer)) {
                throw new LedgerApiException(403, "input " + i + " signed by an unexpected key");
            }
        }

        SafeTransaction tx = codec.decode(signed.raw());
        for (SafeTransaction.Input input : tx.inputs()) {
            UnspentOutput spent = requireUnspent(input);
            outputs.put(key(input.transactionHash(), input.outputIndex()), markSpent(spent));
        }

        String hash = codec.transactionHash(signed.raw());
        for (int i = 0; i < tx.outputs().size(); i++) {
            SafeTransaction.Output output = tx.outputs().get(i);
            List<String> members = output.mask() == null ? null : membersByMask.get(output.mask());
            if (SafeTransaction.Output.TYPE_SCRIPT.equals(output.type()) && members != null && members.contains(credentials.appId())) {
                outputs.put(key(hash, i), new UnspentOutput(UUID.randomUUID().toString(), hash, i, tx.assetId(),
                        new BigDecimal(output.amount()), members, output.threshold(), UnspentOutput.STATE_UNSPENT, ++sequence));
            }
        }

        pending.remove(requestId);
        SubmittedTransaction submitted = new SubmittedTransaction(requestId, hash, UnspentOutput.STATE_SPENT);
        submittedByRequest.put(requestId, submitted);
        submittedByHash.put(hash, submitted);
        rawByHash.put(hash, signed.raw());
        log.info("event=fake_ledger.submitted requestId={} transactionHash={} inputs={} outputs={}",
                requestId, hash, tx.inputs().size(), tx.outputs().size());
        return submitted;
    }

    @Override
    public synchronized SubmittedTransaction fetchTransaction(String transactionHash) {
        SubmittedTransaction tx = submittedByHash.get(transactionHash);
        if (tx == null) {
            throw new LedgerApiException(404, "transaction not found: " + transactionHash);
        }
        return tx;
    }

    @Override
    public String createDepositEntry(List<String> members, int threshold, String chainId) {
        fetchAsset(chainId);
        String seed = chainId + ":" + threshold + ":" + String.join(",", members);
        return Numeric.toHexString(Hash.sha3(seed.getBytes(StandardCharsets.UTF_8))).substring(0, 42);
    }

    @Override
    public void verifyCredentials() {
        log.info("event=fake_ledger.credentials_accepted appId={}", credentials.appId());
    }

    private UnspentOutput requireUnspent(SafeTransaction.Input input) {
        UnspentOutput output = outputs.get(key(input.transactionHash(), input.outputIndex()));
        if (output == null || !UnspentOutput.STATE_UNSPENT.equals(output.state())) {
            throw new LedgerApiException(10002, "input " + input.transactionHash() + ":" + input.outputIndex()
                    + " is unknown or already spent");
        }
        return output;
    }

    private static UnspentOutput markSpent(UnspentOutput o) {
        return new UnspentOutput(o.outputId(), o.transactionHash(), o.outputIndex(), o.assetId(), o.amount(),
                o.receivers(), o.receiversThreshold(), UnspentOutput.STATE_SPENT, o.sequence());
    }

    private static String key(String transactionHash, int outputIndex) {
        return transactionHash + ":" + outputIndex;
    }

    private String randomHex(int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return Numeric.toHexStringNoPrefix(buf);
    }
}
