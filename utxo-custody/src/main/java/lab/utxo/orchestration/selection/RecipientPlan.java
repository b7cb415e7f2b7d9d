package lab.utxo.orchestration.selection;

import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.utxo.UnspentOutput;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything needed to assemble one transaction.
 * {@code ghosts} holds one entry per group recipient, in recipient order.
 */
public record RecipientPlan(
        List<UnspentOutput> inputs,
        List<Recipient> recipients,
        List<GhostKey> ghosts,
        BigDecimal change
) {
    public RecipientPlan {
        inputs = List.copyOf(inputs);
        recipients = List.copyOf(recipients);
        ghosts = List.copyOf(ghosts);
    }
}
