package lab.utxo.orchestration.selection;

import lab.utxo.adapter.LedgerApiException;
import lab.utxo.adapter.SafeCredentials;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.orchestration.InsufficientFundsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class RecipientPlanner {

    private final UtxoSelector selector;
    private final SafeLedgerClient ledgerClient;
    private final SafeCredentials credentials;

    /**
     * Orders the recipients as primary, extra (when given) and change (when positive),
     * selects inputs from {@code outputs} and derives ghost keys for the group recipients.
     *
     * @param extra optional second recipient, usually the fee collector; may be null
     * @throws InsufficientFundsException when the outputs cannot cover the recipients
     */
    public RecipientPlan plan(Recipient primary, Recipient extra, List<UnspentOutput> outputs) {
        List<Recipient> recipients = new ArrayList<>();
        recipients.add(primary);
        if (extra != null) {
            recipients.add(extra);
        }

        UtxoSelection selection;
        try {
            selection = selector.select(outputs, recipients);
        } catch (InsufficientOutputsException e) {
            log.warn("event=recipient_planner.insufficient available={} required={} outputs={}",
                    e.getAvailable().toPlainString(), e.getRequired().toPlainString(), outputs.size());
            throw new InsufficientFundsException(e.getAvailable(), e.getRequired());
        }

        if (selection.hasChange()) {
            UnspentOutput owner = selection.usedInputs().get(0);
            requireValidOwners(owner);
            recipients.add(new GroupRecipient(owner.receivers(), owner.receiversThreshold(), selection.change()));
        }

        List<GroupRecipient> groups = recipients.stream()
                .filter(GroupRecipient.class::isInstance)
                .map(GroupRecipient.class::cast)
                .toList();
        List<GhostKey> ghosts = groups.isEmpty()
                ? List.of()
                : ledgerClient.deriveGhostKeys(groups, UUID.randomUUID().toString(), credentials.spendPrivateKey());
        if (ghosts.size() != groups.size()) {
            throw new IllegalStateException("ghost keys not aligned with group recipients: groups="
                    + groups.size() + ", ghosts=" + ghosts.size());
        }

        log.info("event=recipient_planner.planned inputs={} recipients={} change={}",
                selection.usedInputs().size(), recipients.size(), selection.change().toPlainString());
        return new RecipientPlan(selection.usedInputs(), recipients, ghosts, selection.change());
    }

    // Change returns to the owners the ledger reported; a malformed owner set is a ledger fault.
    private static void requireValidOwners(UnspentOutput owner) {
        int members = owner.receivers().size();
        if (members == 0 || owner.receiversThreshold() < 1 || owner.receiversThreshold() > members) {
            throw new LedgerApiException("output " + owner.outputId() + " has invalid receivers: members="
                    + members + ", threshold=" + owner.receiversThreshold());
        }
    }
}
