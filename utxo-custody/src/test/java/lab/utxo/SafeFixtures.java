package lab.utxo;

import lab.utxo.adapter.SafeCredentials;
import lab.utxo.domain.utxo.UnspentOutput;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public final class SafeFixtures {

    public static final String APP_ID = "3f2a0a44-8f0c-4d6b-9a51-2f7d3f1e9c01";
    public static final String SPEND_KEY = "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    public static final String FEE_COLLECTOR = "674d6776-d600-4346-af46-58e77d8df185";

    private SafeFixtures() {
    }

    public static SafeCredentials credentials() {
        return new SafeCredentials(APP_ID, "session", "server-public", "session-private", "oauth-secret", SPEND_KEY);
    }

    public static UnspentOutput output(String assetId, String amount) {
        return output(assetId, amount, List.of(APP_ID), 1);
    }

    public static UnspentOutput output(String assetId, String amount, List<String> receivers, int threshold) {
        return new UnspentOutput(
                UUID.randomUUID().toString(),
                UUID.randomUUID().toString().replace("-", ""),
                0,
                assetId,
                new BigDecimal(amount),
                receivers,
                threshold,
                UnspentOutput.STATE_UNSPENT,
                0L
        );
    }
}
