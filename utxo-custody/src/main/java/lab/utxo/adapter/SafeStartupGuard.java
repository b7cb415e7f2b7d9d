package lab.utxo.adapter;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SafeStartupGuard {

    private final SafeCredentials credentials;
    private final SafeLedgerClient ledgerClient;

    @Value("${custody.safe.mode:mock}")
    private String mode;

    // Incomplete credentials only disable withdrawals; wrong ones stop the service.
    @PostConstruct
    void validate() {
        if (!credentials.isConfigured()) {
            log.warn("event=safe_startup.credentials_incomplete mode={} withdrawals=disabled", mode);
            return;
        }
        try {
            ledgerClient.verifyCredentials();
        } catch (LedgerApiException e) {
            throw new IllegalStateException("Safe credentials were rejected by the ledger (mode=" + mode + ")", e);
        }
        log.info("event=safe_startup.credentials_verified mode={} appId={}", mode, credentials.appId());
    }
}
