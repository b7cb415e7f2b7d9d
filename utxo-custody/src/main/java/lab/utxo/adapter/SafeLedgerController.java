package lab.utxo.adapter;

import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.domain.utxo.UtxoQuery;
import lab.utxo.orchestration.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-mostly views onto the application's ledger account.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/safe")
@Slf4j
public class SafeLedgerController {

    private final SafeLedgerClient ledgerClient;
    private final SafeCredentials credentials;

    @GetMapping("/outputs")
    public List<UnspentOutput> outputs(@RequestParam(required = false) String assetId) {
        credentials.ensureConfigured();
        UtxoQuery query = assetId == null || assetId.isBlank() ? UtxoQuery.allUnspent() : UtxoQuery.unspent(assetId);
        List<UnspentOutput> outputs = ledgerClient.listUnspentOutputs(query);
        log.info("event=safe.outputs.response assetId={} count={}", assetId, outputs.size());
        return outputs;
    }

    @GetMapping("/transactions/{hash}")
    public SubmittedTransaction transaction(@PathVariable String hash) {
        credentials.ensureConfigured();
        return ledgerClient.fetchTransaction(hash);
    }

    // Deposit address owned by the application alone (threshold 1).
    @PostMapping("/deposit-entries")
    public DepositEntryResponse createDepositEntry(@RequestBody DepositEntryRequest req) {
        credentials.ensureConfigured();
        if (req == null || req.chainId() == null || req.chainId().isBlank()) {
            throw new InvalidRequestException("chainId is required");
        }
        String destination = ledgerClient.createDepositEntry(List.of(credentials.appId()), 1, req.chainId());
        log.info("event=safe.deposit_entry.created chainId={}", req.chainId());
        return new DepositEntryResponse(req.chainId(), destination);
    }

    public record DepositEntryRequest(String chainId) {}

    public record DepositEntryResponse(String chainId, String destination) {}
}
