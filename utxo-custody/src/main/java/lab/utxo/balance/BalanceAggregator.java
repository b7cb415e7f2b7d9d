package lab.utxo.balance;

import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.utxo.UnspentOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Sums unspent outputs per asset and prices each asset in USD and BTC.
 * Asset lookups run in parallel on the balance executor; totals are summed after all of them finish.
 */
@Component
@Slf4j
public class BalanceAggregator {

    private final SafeLedgerClient ledgerClient;
    private final ExecutorService executor;

    public BalanceAggregator(
            SafeLedgerClient ledgerClient,
            @Qualifier("balanceLookupExecutor") ExecutorService executor
    ) {
        this.ledgerClient = ledgerClient;
        this.executor = executor;
    }

    private record Priced(SafeAsset asset, BigDecimal amount, BigDecimal usd, BigDecimal btc) {}

    public BalanceSummary aggregate(List<UnspentOutput> outputs) {
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        for (UnspentOutput output : outputs) {
            amounts.merge(output.assetId(), output.amount(), BigDecimal::add);
        }

        List<CompletableFuture<Priced>> lookups = new ArrayList<>(amounts.size());
        amounts.forEach((assetId, amount) -> lookups.add(
                CompletableFuture.supplyAsync(() -> price(ledgerClient.fetchAsset(assetId), amount), executor)));

        List<Priced> priced = new ArrayList<>(lookups.size());
        for (CompletableFuture<Priced> lookup : lookups) {
            priced.add(join(lookup));
        }

        BigDecimal totalUsd = BigDecimal.ZERO;
        BigDecimal totalBtc = BigDecimal.ZERO;
        List<AssetBalance> balances = new ArrayList<>(priced.size());
        for (Priced p : priced) {
            totalUsd = totalUsd.add(p.usd());
            totalBtc = totalBtc.add(p.btc());
            balances.add(new AssetBalance(
                    p.asset().assetId(),
                    p.asset().symbol(),
                    p.amount().setScale(8, RoundingMode.HALF_UP).toPlainString(),
                    p.usd().setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    p.btc().setScale(8, RoundingMode.HALF_UP).toPlainString()
            ));
        }
        log.info("event=balance_aggregator.aggregated outputs={} assets={} totalUsd={}",
                outputs.size(), balances.size(), totalUsd.setScale(2, RoundingMode.HALF_UP).toPlainString());
        return new BalanceSummary(balances, totalUsd, totalBtc);
    }

    private static Priced price(SafeAsset asset, BigDecimal amount) {
        return new Priced(asset, amount, amount.multiply(orZero(asset.priceUsd())), amount.multiply(orZero(asset.priceBtc())));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    // Surfaces the lookup's own exception instead of the CompletionException wrapper.
    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
