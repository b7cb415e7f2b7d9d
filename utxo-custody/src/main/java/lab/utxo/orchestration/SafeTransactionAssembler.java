package lab.utxo.orchestration;

import lab.utxo.adapter.SafeCredentials;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.adapter.SafeTransactionCodec;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.recipient.Recipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SafeTransaction;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.transaction.VerifiedTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.orchestration.selection.RecipientPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Turns a planned transaction into a submitted one: build, encode, verify, sign, submit.
 * Steps run once each; any failure propagates and nothing is resubmitted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SafeTransactionAssembler {

    private final SafeTransactionCodec codec;
    private final SafeLedgerClient ledgerClient;
    private final SafeCredentials credentials;

    public SubmittedTransaction assemble(RecipientPlan plan, String memo, String feeReference) {
        return assemble(plan.inputs(), plan.recipients(), plan.ghosts(), memo, feeReference);
    }

    public SubmittedTransaction assemble(
            List<UnspentOutput> inputs,
            List<Recipient> recipients,
            List<GhostKey> ghosts,
            String memo,
            String feeReference
    ) {
        List<String> references = feeReference == null ? List.of() : List.of(feeReference);
        SafeTransaction tx = codec.build(
                inputs,
                recipients,
                alignGhosts(recipients, ghosts),
                memo.getBytes(StandardCharsets.UTF_8),
                references
        );
        String raw = codec.encode(tx);

        // One request id per submission attempt, shared by verify and submit.
        String requestId = UUID.randomUUID().toString();
        VerifiedTransaction verified = ledgerClient.verifyTransaction(raw, requestId);
        log.info("event=assembler.verified requestId={} inputs={} outputs={} views={}",
                requestId, tx.inputs().size(), tx.outputs().size(), verified.views().size());

        String signedRaw = codec.sign(tx, verified.views(), credentials.spendPrivateKey());
        SubmittedTransaction submitted = ledgerClient.submitTransaction(signedRaw, requestId);
        log.info("event=assembler.submitted requestId={} transactionHash={} state={} memo={} feeReference={}",
                requestId, submitted.transactionHash(), submitted.state(), memo, feeReference);
        return submitted;
    }

    // Address recipients get no ghost; every group recipient takes the next ghost in order.
    static List<GhostKey> alignGhosts(List<Recipient> recipients, List<GhostKey> ghosts) {
        Iterator<GhostKey> next = ghosts.iterator();
        List<GhostKey> aligned = new ArrayList<>(recipients.size());
        for (Recipient recipient : recipients) {
            if (recipient instanceof GroupRecipient) {
                if (!next.hasNext()) {
                    throw new IllegalStateException("missing ghost key for group recipient at index " + aligned.size());
                }
                aligned.add(next.next());
            } else {
                aligned.add(null);
            }
        }
        if (next.hasNext()) {
            throw new IllegalStateException("more ghost keys than group recipients");
        }
        return aligned;
    }
}
