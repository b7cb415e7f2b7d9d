package lab.utxo.adapter;

import lab.utxo.domain.recipient.AddressRecipient;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SafeTransaction;
import lab.utxo.domain.transaction.SignedSafeTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static lab.utxo.SafeFixtures.APP_ID;
import static lab.utxo.SafeFixtures.FEE_COLLECTOR;
import static lab.utxo.SafeFixtures.SPEND_KEY;
import static lab.utxo.SafeFixtures.output;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EcdsaSafeTransactionCodecTest {

    private static final String VIEW_1 = "11".repeat(32);
    private static final String VIEW_2 = "22".repeat(32);

    private final EcdsaSafeTransactionCodec codec = new EcdsaSafeTransactionCodec();

    private final List<UnspentOutput> inputs = List.of(output("X", "70"), output("X", "50"));
    private final List<Recipient> recipients = List.of(
            new AddressRecipient("dest", "tag-1", new BigDecimal("98.00")),
            GroupRecipient.single(FEE_COLLECTOR, new BigDecimal("2")),
            new GroupRecipient(List.of(APP_ID, "cosigner"), 2, new BigDecimal("20"))
    );
    private final List<GhostKey> ghosts = Arrays.asList(
            null,
            new GhostKey("mask-fee", List.of("key-fee")),
            new GhostKey("mask-change", List.of("key-a", "key-b"))
    );

    private SafeTransaction buildSample() {
        return codec.build(inputs, recipients, ghosts, "withdrawal-memo".getBytes(StandardCharsets.UTF_8), List.of("fee-hash"));
    }

    @Test
    void buildMapsRecipientsToOutputs() {
        SafeTransaction tx = buildSample();

        assertThat(tx.version()).isEqualTo(EcdsaSafeTransactionCodec.TX_VERSION);
        assertThat(tx.assetId()).isEqualTo("X");
        assertThat(tx.inputs()).extracting(SafeTransaction.Input::transactionHash)
                .containsExactly(inputs.get(0).transactionHash(), inputs.get(1).transactionHash());
        assertThat(tx.outputs()).extracting(SafeTransaction.Output::type).containsExactly("withdrawal", "script", "script");
        assertThat(tx.outputs()).extracting(SafeTransaction.Output::amount).containsExactly("98", "2", "20");
        assertThat(tx.outputs().get(0).destination()).isEqualTo("dest");
        assertThat(tx.outputs().get(0).tag()).isEqualTo("tag-1");
        assertThat(tx.outputs().get(2).keys()).containsExactly("key-a", "key-b");
        assertThat(tx.outputs().get(2).threshold()).isEqualTo(2);
        assertThat(tx.references()).containsExactly("fee-hash");
        assertThat(new String(org.web3j.utils.Numeric.hexStringToByteArray(tx.extra()), StandardCharsets.UTF_8))
                .isEqualTo("withdrawal-memo");
    }

    @Test
    void encodedFormDecodesToSameTransaction() {
        SafeTransaction tx = buildSample();

        assertThat(codec.decode(codec.encode(tx))).isEqualTo(tx);
    }

    @Test
    void eachSignatureRecoversToSpendKeyAddress() {
        SafeTransaction tx = buildSample();
        String raw = codec.encode(tx);

        SignedSafeTransaction signed = codec.decodeSigned(codec.sign(tx, List.of(VIEW_1, VIEW_2), SPEND_KEY));

        String expected = Credentials.create(SPEND_KEY).getAddress();
        assertThat(signed.raw()).isEqualTo(raw);
        assertThat(signed.signatures()).hasSize(2);
        assertThat(codec.recoverSignerAddress(raw, VIEW_1, signed.signatures().get(0))).isEqualToIgnoringCase(expected);
        assertThat(codec.recoverSignerAddress(raw, VIEW_2, signed.signatures().get(1))).isEqualToIgnoringCase(expected);
        assertThat(codec.recoverSignerAddress(raw, VIEW_2, signed.signatures().get(0))).isNotEqualToIgnoringCase(expected);
    }

    @Test
    void signRequiresOneViewPerInput() {
        SafeTransaction tx = buildSample();

        assertThatThrownBy(() -> codec.sign(tx, List.of(VIEW_1), SPEND_KEY))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void addressRecipientMustNotCarryGhost() {
        List<GhostKey> shifted = List.of(
                new GhostKey("m0", List.of("k0")),
                new GhostKey("m1", List.of("k1")),
                new GhostKey("m2", List.of("k2a", "k2b"))
        );

        assertThatThrownBy(() -> codec.build(inputs, recipients, shifted, new byte[0], List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("index 0");
    }

    @Test
    void inputsMustShareOneAsset() {
        List<UnspentOutput> mixed = List.of(output("X", "1"), output("Y", "1"));

        assertThatThrownBy(() -> codec.build(mixed, recipients, ghosts, new byte[0], List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mix assets");
    }

    @Test
    void malformedSpendKeyIsConfigurationFault() {
        SafeTransaction tx = buildSample();

        assertThatThrownBy(() -> codec.sign(tx, List.of(VIEW_1, VIEW_2), "not-a-hex-key"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spend-private-key")
                .hasMessageNotContaining("not-a-hex-key");
    }

    @Test
    void oversizedExtraIsRejected() {
        assertThatThrownBy(() -> codec.build(inputs, recipients, ghosts, new byte[513], List.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}
