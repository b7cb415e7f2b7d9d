package lab.utxo.sim;

import lab.utxo.adapter.SafeCredentials;
import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.sim.fakeledger.FakeSafeLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/sim")
@ConditionalOnProperty(prefix = "custody.safe", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class SimController {

    private final FakeSafeLedger fakeLedger;
    private final SafeCredentials credentials;

    @PostMapping("/assets")
    public SafeAsset putAsset(@RequestBody SafeAsset asset) {
        fakeLedger.putAsset(asset);
        log.info("event=sim.asset.put assetId={} chainId={}", asset.assetId(), asset.chainId());
        return asset;
    }

    @PostMapping("/fees")
    public FeeQuotes putFees(@RequestBody FeeQuotes quotes) {
        fakeLedger.putFees(quotes.assetId(), quotes.fees());
        log.info("event=sim.fees.put assetId={} quotes={}", quotes.assetId(), quotes.fees().size());
        return quotes;
    }

    // Receivers default to the application itself so the output is spendable by withdrawals.
    @PostMapping("/outputs")
    public UnspentOutput seedOutput(@RequestBody SeedOutputRequest req) {
        List<String> receivers = req.receivers() == null || req.receivers().isEmpty()
                ? List.of(credentials.appId())
                : req.receivers();
        int threshold = req.threshold() == null ? 1 : req.threshold();
        UnspentOutput output = fakeLedger.seedOutput(req.assetId(), req.amount(), receivers, threshold);
        log.info("event=sim.output.seeded assetId={} amount={}", output.assetId(), output.amount());
        return output;
    }

    // Script the next submission outcome so failure scenarios are reproducible.
    @PostMapping("/next-outcome/{outcome}")
    public void setNextOutcome(@PathVariable FakeSafeLedger.NextOutcome outcome) {
        fakeLedger.setNextOutcome(outcome);
    }

    public record FeeQuotes(String assetId, List<Fee> fees) {}

    public record SeedOutputRequest(String assetId, BigDecimal amount, List<String> receivers, Integer threshold) {}
}
