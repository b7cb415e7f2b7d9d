package lab.utxo.adapter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Credentials of the application's ledger account.
 * Every ledger-touching operation calls {@link #ensureConfigured()} first so an incomplete
 * setup is refused before any remote call is made.
 */
@Component
@Slf4j
public class SafeCredentials {

    private final String appId;
    private final String sessionId;
    private final String serverPublicKey;
    private final String sessionPrivateKey;
    private final String oauthSecret;
    private final String spendPrivateKey;

    public SafeCredentials(
            @Value("${custody.safe.app-id:}") String appId,
            @Value("${custody.safe.session-id:}") String sessionId,
            @Value("${custody.safe.server-public-key:}") String serverPublicKey,
            @Value("${custody.safe.session-private-key:}") String sessionPrivateKey,
            @Value("${custody.safe.oauth-secret:}") String oauthSecret,
            @Value("${custody.safe.spend-private-key:}") String spendPrivateKey
    ) {
        this.appId = trim(appId);
        this.sessionId = trim(sessionId);
        this.serverPublicKey = trim(serverPublicKey);
        this.sessionPrivateKey = trim(sessionPrivateKey);
        this.oauthSecret = trim(oauthSecret);
        this.spendPrivateKey = trim(spendPrivateKey);
    }

    public boolean isConfigured() {
        return Stream.of(appId, sessionId, serverPublicKey, sessionPrivateKey, oauthSecret, spendPrivateKey)
                .noneMatch(String::isBlank);
    }

    public void ensureConfigured() {
        if (!isConfigured()) {
            log.warn("event=safe_credentials.unconfigured_use");
            throw new LedgerNotConfiguredException(
                    "Safe ledger integration is not configured. Set all custody.safe credential properties.");
        }
    }

    public String appId() {
        return appId;
    }

    public String spendPrivateKey() {
        return spendPrivateKey;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
