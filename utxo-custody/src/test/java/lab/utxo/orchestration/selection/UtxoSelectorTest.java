package lab.utxo.orchestration.selection;

import lab.utxo.domain.recipient.AddressRecipient;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.utxo.UnspentOutput;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static lab.utxo.SafeFixtures.FEE_COLLECTOR;
import static lab.utxo.SafeFixtures.output;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtxoSelectorTest {

    private final UtxoSelector selector = new UtxoSelector();

    @Test
    void picksLargestOutputsFirstAndReturnsOvershootAsChange() {
        List<UnspentOutput> outputs = List.of(output("X", "50"), output("X", "70"));
        List<Recipient> recipients = List.of(
                new AddressRecipient("dest", null, new BigDecimal("98")),
                GroupRecipient.single(FEE_COLLECTOR, new BigDecimal("2"))
        );

        UtxoSelection selection = selector.select(outputs, recipients);

        assertThat(selection.usedInputs()).extracting(UnspentOutput::amount)
                .containsExactly(new BigDecimal("70"), new BigDecimal("50"));
        assertThat(selection.total()).isEqualByComparingTo("120");
        assertThat(selection.change()).isEqualByComparingTo("20");
        assertThat(selection.hasChange()).isTrue();
    }

    @Test
    void stopsAsSoonAsRequestedTotalIsCovered() {
        List<UnspentOutput> outputs = List.of(output("X", "10"), output("X", "70"), output("X", "50"));

        UtxoSelection selection = selector.select(outputs, List.of(new AddressRecipient("dest", null, new BigDecimal("60"))));

        assertThat(selection.usedInputs()).hasSize(1);
        assertThat(selection.usedInputs().get(0).amount()).isEqualByComparingTo("70");
        assertThat(selection.change()).isEqualByComparingTo("10");
    }

    @Test
    void exactCoverLeavesNoChange() {
        UtxoSelection selection = selector.select(
                List.of(output("X", "0.6"), output("X", "0.4")),
                List.of(new AddressRecipient("dest", null, new BigDecimal("1.0")))
        );

        assertThat(selection.change()).isEqualByComparingTo("0");
        assertThat(selection.hasChange()).isFalse();
    }

    @Test
    void insufficientOutputsReportTotals() {
        List<UnspentOutput> outputs = List.of(output("X", "1"), output("X", "2.5"));

        assertThatThrownBy(() -> selector.select(outputs, List.of(new AddressRecipient("dest", null, new BigDecimal("5")))))
                .isInstanceOfSatisfying(InsufficientOutputsException.class, e -> {
                    assertThat(e.getAvailable()).isEqualByComparingTo("3.5");
                    assertThat(e.getRequired()).isEqualByComparingTo("5");
                });
    }

    @Test
    void noOutputsIsInsufficient() {
        assertThatThrownBy(() -> selector.select(List.of(), List.of(new AddressRecipient("dest", null, BigDecimal.ONE))))
                .isInstanceOfSatisfying(InsufficientOutputsException.class,
                        e -> assertThat(e.getAvailable()).isEqualByComparingTo("0"));
    }

    @Test
    void doesNotReorderCallerList() {
        List<UnspentOutput> outputs = List.of(output("X", "1"), output("X", "9"));

        selector.select(outputs, List.of(new AddressRecipient("dest", null, new BigDecimal("2"))));

        assertThat(outputs.get(0).amount()).isEqualByComparingTo("1");
    }
}
