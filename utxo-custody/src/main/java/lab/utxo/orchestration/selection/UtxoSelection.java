package lab.utxo.orchestration.selection;

import lab.utxo.domain.utxo.UnspentOutput;

import java.math.BigDecimal;
import java.util.List;

// usedInputs is ordered largest first.
public record UtxoSelection(
        List<UnspentOutput> usedInputs,
        BigDecimal total,
        BigDecimal change
) {
    public UtxoSelection {
        usedInputs = List.copyOf(usedInputs);
    }

    public boolean hasChange() {
        return change.signum() > 0;
    }
}
