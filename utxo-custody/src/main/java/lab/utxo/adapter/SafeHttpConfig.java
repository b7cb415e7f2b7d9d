package lab.utxo.adapter;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "custody.safe", name = "mode", havingValue = "http")
public class SafeHttpConfig {

    @Bean
    public OkHttpClient safeHttpClient(
            @Value("${custody.safe.http.timeout-ms:10000}") long timeoutMs,
            @Value("${custody.safe.http.proxy.enabled:false}") boolean proxyEnabled,
            @Value("${custody.safe.http.proxy.host:}") String proxyHost,
            @Value("${custody.safe.http.proxy.port:8080}") int proxyPort,
            @Value("${custody.safe.http.proxy.username:}") String proxyUsername,
            @Value("${custody.safe.http.proxy.password:}") String proxyPassword) {
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(timeoutMs));
        if (!proxyEnabled) {
            return clientBuilder.build();
        }

        if (proxyHost == null || proxyHost.isBlank()) {
            throw new IllegalStateException("custody.safe.http.proxy.host must be configured when custody.safe.http.proxy.enabled=true");
        }

        Proxy proxy = new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort));
        clientBuilder.proxy(proxy);

        if (proxyUsername != null && !proxyUsername.isBlank()) {
            clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                String credential = okhttp3.Credentials.basic(proxyUsername, proxyPassword == null ? "" : proxyPassword);
                Request request = response.request();
                return request.newBuilder()
                        .header("Proxy-Authorization", credential)
                        .build();
            });
        }

        return clientBuilder.build();
    }
}
