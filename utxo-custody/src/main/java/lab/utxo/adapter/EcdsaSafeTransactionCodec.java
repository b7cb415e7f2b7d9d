package lab.utxo.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.utxo.domain.recipient.AddressRecipient;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SafeTransaction;
import lab.utxo.domain.transaction.SignedSafeTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.SignatureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes transactions as hex of their canonical JSON form and signs them with secp256k1.
 * Each input is signed over keccak256(raw || view), using the view the ledger returned for it.
 */
@Component
public class EcdsaSafeTransactionCodec implements SafeTransactionCodec {

    static final int TX_VERSION = 5;
    private static final int MAX_EXTRA_BYTES = 512;
    private static final int SIGNATURE_LENGTH = 65;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public SafeTransaction build(
            List<UnspentOutput> inputs,
            List<Recipient> recipients,
            List<GhostKey> ghosts,
            byte[] extra,
            List<String> references
    ) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalStateException("transaction requires at least one input");
        }
        String assetId = inputs.get(0).assetId();
        for (UnspentOutput input : inputs) {
            if (!assetId.equals(input.assetId())) {
                throw new IllegalStateException("inputs mix assets: " + assetId + " and " + input.assetId());
            }
        }
        if (recipients.size() != ghosts.size()) {
            throw new IllegalStateException("ghost list not aligned with recipients: recipients="
                    + recipients.size() + ", ghosts=" + ghosts.size());
        }
        byte[] memo = extra == null ? new byte[0] : extra;
        if (memo.length > MAX_EXTRA_BYTES) {
            throw new IllegalStateException("extra exceeds " + MAX_EXTRA_BYTES + " bytes");
        }

        List<SafeTransaction.Input> txInputs = inputs.stream()
                .map(o -> new SafeTransaction.Input(o.transactionHash(), o.outputIndex()))
                .toList();

        List<SafeTransaction.Output> txOutputs = new ArrayList<>();
        for (int i = 0; i < recipients.size(); i++) {
            txOutputs.add(toOutput(i, recipients.get(i), ghosts.get(i)));
        }

        return new SafeTransaction(
                TX_VERSION,
                assetId,
                txInputs,
                txOutputs,
                references,
                Numeric.toHexStringNoPrefix(memo)
        );
    }

    @Override
    public String encode(SafeTransaction tx) {
        return Numeric.toHexStringNoPrefix(serialize(tx));
    }

    @Override
    public String sign(SafeTransaction tx, List<String> views, String spendPrivateKey) {
        if (views.size() != tx.inputs().size()) {
            throw new IllegalStateException("expected one view per input: inputs="
                    + tx.inputs().size() + ", views=" + views.size());
        }
        byte[] raw = serialize(tx);
        ECKeyPair keyPair = keyPair(spendPrivateKey);

        List<String> signatures = views.stream()
                .map(view -> signView(raw, view, keyPair))
                .toList();

        return Numeric.toHexStringNoPrefix(serialize(
                new SignedSafeTransaction(Numeric.toHexStringNoPrefix(raw), signatures)));
    }

    public SafeTransaction decode(String raw) {
        return deserialize(raw, SafeTransaction.class);
    }

    public SignedSafeTransaction decodeSigned(String signedRaw) {
        return deserialize(signedRaw, SignedSafeTransaction.class);
    }

    // Returns the 0x-prefixed address of the key that produced the signature.
    public String recoverSignerAddress(String raw, String view, String signature) {
        byte[] sig = Numeric.hexStringToByteArray(signature);
        if (sig.length != SIGNATURE_LENGTH) {
            throw new IllegalStateException("signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        Sign.SignatureData data = new Sign.SignatureData(
                sig[64],
                Arrays.copyOfRange(sig, 0, 32),
                Arrays.copyOfRange(sig, 32, 64)
        );
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(viewDigest(Numeric.hexStringToByteArray(raw), view), data);
            return Numeric.prependHexPrefix(Keys.getAddress(publicKey));
        } catch (SignatureException e) {
            throw new IllegalStateException("unrecoverable signature", e);
        }
    }

    public String transactionHash(String raw) {
        return Numeric.toHexStringNoPrefix(Hash.sha3(Numeric.hexStringToByteArray(raw)));
    }

    private SafeTransaction.Output toOutput(int index, Recipient recipient, GhostKey ghost) {
        String amount = plain(recipient.amount());
        if (recipient instanceof AddressRecipient address) {
            if (ghost != null) {
                throw new IllegalStateException("address recipient at index " + index + " must not carry a ghost key");
            }
            return new SafeTransaction.Output(
                    SafeTransaction.Output.TYPE_WITHDRAWAL, amount, List.of(), null, 0, address.destination(), address.tag());
        }
        GroupRecipient group = (GroupRecipient) recipient;
        if (ghost == null) {
            throw new IllegalStateException("group recipient at index " + index + " has no ghost key");
        }
        if (ghost.keys().size() != group.members().size()) {
            throw new IllegalStateException("ghost key count mismatch at index " + index);
        }
        return new SafeTransaction.Output(
                SafeTransaction.Output.TYPE_SCRIPT, amount, ghost.keys(), ghost.mask(), group.threshold(), null, null);
    }

    private static ECKeyPair keyPair(String spendPrivateKey) {
        try {
            return Credentials.create(spendPrivateKey).getEcKeyPair();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("custody.safe.spend-private-key is not a valid hex private key", e);
        }
    }

    private static String signView(byte[] raw, String view, ECKeyPair keyPair) {
        Sign.SignatureData data = Sign.signMessage(viewDigest(raw, view), keyPair, false);
        byte[] sig = new byte[SIGNATURE_LENGTH];
        System.arraycopy(data.getR(), 0, sig, 0, 32);
        System.arraycopy(data.getS(), 0, sig, 32, 32);
        sig[64] = data.getV()[0];
        return Numeric.toHexStringNoPrefix(sig);
    }

    private static byte[] viewDigest(byte[] raw, String view) {
        byte[] viewBytes = Numeric.hexStringToByteArray(view);
        byte[] message = Arrays.copyOf(raw, raw.length + viewBytes.length);
        System.arraycopy(viewBytes, 0, message, raw.length, viewBytes.length);
        return Hash.sha3(message);
    }

    private static String plain(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    private byte[] serialize(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T deserialize(String hex, Class<T> type) {
        try {
            return objectMapper.readValue(Numeric.hexStringToByteArray(hex), type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
