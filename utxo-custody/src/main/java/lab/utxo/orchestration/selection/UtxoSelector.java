package lab.utxo.orchestration.selection;

import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.utxo.UnspentOutput;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy largest-first selection. Always consumes at least one output so the
 * resulting transaction has an input even for a zero total.
 */
@Component
public class UtxoSelector {

    public UtxoSelection select(List<UnspentOutput> outputs, List<? extends Recipient> recipients) {
        BigDecimal required = sum(recipients.stream().map(Recipient::amount).toList());

        List<UnspentOutput> candidates = new ArrayList<>(outputs);
        candidates.sort(Comparator.comparing(UnspentOutput::amount).reversed());

        List<UnspentOutput> used = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (UnspentOutput candidate : candidates) {
            used.add(candidate);
            total = total.add(candidate.amount());
            if (total.compareTo(required) >= 0) {
                return new UtxoSelection(used, total, total.subtract(required));
            }
        }
        throw new InsufficientOutputsException(total, required);
    }

    static BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
