package lab.utxo.balance;

import lab.utxo.adapter.SafeCredentials;
import lab.utxo.adapter.SafeLedgerClient;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.domain.utxo.UtxoQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BalanceService {

    private final SafeLedgerClient ledgerClient;
    private final SafeCredentials credentials;
    private final BalanceAggregator aggregator;

    public BalanceSummary getBalances() {
        credentials.ensureConfigured();
        List<UnspentOutput> outputs = ledgerClient.listUnspentOutputs(UtxoQuery.allUnspent());
        return aggregator.aggregate(outputs);
    }
}
