package lab.utxo.adapter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lab.utxo.domain.asset.Fee;
import lab.utxo.domain.asset.SafeAsset;
import lab.utxo.domain.recipient.GroupRecipient;
import lab.utxo.domain.transaction.GhostKey;
import lab.utxo.domain.transaction.SubmittedTransaction;
import lab.utxo.domain.transaction.VerifiedTransaction;
import lab.utxo.domain.utxo.UnspentOutput;
import lab.utxo.domain.utxo.UtxoQuery;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
@ConditionalOnProperty(prefix = "custody.safe", name = "mode", havingValue = "http")
@Slf4j
public class HttpSafeLedgerClient implements SafeLedgerClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String accessToken;
    private final int outputsPageLimit;

    public HttpSafeLedgerClient(
            OkHttpClient httpClient,
            ObjectMapper objectMapper,
            @Value("${custody.safe.http.base-url}") String baseUrl,
            @Value("${custody.safe.http.access-token:}") String accessToken,
            @Value("${custody.safe.http.outputs-limit:500}") int outputsPageLimit
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.baseUrl = HttpUrl.get(baseUrl);
        this.accessToken = accessToken == null ? "" : accessToken.trim();
        this.outputsPageLimit = outputsPageLimit;
    }

    // Pages in ascending sequence order until a page comes back short.
    @Override
    public List<UnspentOutput> listUnspentOutputs(UtxoQuery query) {
        List<UnspentOutput> outputs = new ArrayList<>();
        Long offset = null;
        int pages = 0;
        while (true) {
            List<UnspentOutput> page = read(get(outputsPage(query, offset)), new TypeReference<>() {});
            outputs.addAll(page);
            pages++;
            if (page.size() < outputsPageLimit) {
                break;
            }
            long next = page.get(page.size() - 1).sequence() + 1;
            if (offset != null && next <= offset) {
                throw new LedgerApiException("Ledger API output paging did not advance past sequence " + offset);
            }
            offset = next;
        }
        log.debug("event=safe_http.outputs.listed assetId={} outputs={} pages={}", query.assetId(), outputs.size(), pages);
        return outputs;
    }

    private HttpUrl outputsPage(UtxoQuery query, Long offset) {
        HttpUrl.Builder url = path("safe/outputs")
                .addQueryParameter("state", query.state())
                .addQueryParameter("order", "ASC")
                .addQueryParameter("limit", String.valueOf(outputsPageLimit));
        if (query.assetId() != null) {
            url.addQueryParameter("asset", query.assetId());
        }
        if (offset != null) {
            url.addQueryParameter("offset", String.valueOf(offset));
        }
        return url.build();
    }

    @Override
    public SafeAsset fetchAsset(String assetId) {
        return read(get(path("safe/assets").addPathSegment(assetId).build()), new TypeReference<>() {});
    }

    @Override
    public List<Fee> fetchFees(String assetId, String destination) {
        HttpUrl url = path("safe/assets").addPathSegment(assetId).addPathSegment("fees")
                .addQueryParameter("destination", destination)
                .build();
        return read(get(url), new TypeReference<>() {});
    }

    // Hints are derived from the spend key so they cannot be predicted from the request id alone.
    @Override
    public List<GhostKey> deriveGhostKeys(List<GroupRecipient> recipients, String requestId, String spendPrivateKey) {
        List<Map<String, Object>> body = new ArrayList<>();
        for (int i = 0; i < recipients.size(); i++) {
            GroupRecipient recipient = recipients.get(i);
            byte[] seed = Hash.sha3((spendPrivateKey + ":" + requestId + ":" + i).getBytes(StandardCharsets.UTF_8));
            body.add(Map.of(
                    "receivers", recipient.members(),
                    "index", i,
                    "hint", UUID.nameUUIDFromBytes(seed).toString()
            ));
        }
        List<GhostKey> keys = read(post(path("safe/keys").build(), body), new TypeReference<>() {});
        if (keys.size() != recipients.size()) {
            throw new LedgerApiException("ghost key count mismatch: requested=" + recipients.size() + ", returned=" + keys.size());
        }
        return keys;
    }

    @Override
    public VerifiedTransaction verifyTransaction(String raw, String requestId) {
        List<VerifiedTransaction> verified = read(
                post(path("safe/transaction/requests").build(), List.of(Map.of("request_id", requestId, "raw", raw))),
                new TypeReference<>() {});
        return single(verified, "transaction request " + requestId);
    }

    @Override
    public SubmittedTransaction submitTransaction(String signedRaw, String requestId) {
        List<SubmittedTransaction> sent = read(
                post(path("safe/transactions").build(), List.of(Map.of("request_id", requestId, "raw", signedRaw))),
                new TypeReference<>() {});
        return single(sent, "transaction " + requestId);
    }

    @Override
    public SubmittedTransaction fetchTransaction(String transactionHash) {
        return read(get(path("safe/transactions").addPathSegment(transactionHash).build()), new TypeReference<>() {});
    }

    @Override
    public String createDepositEntry(List<String> members, int threshold, String chainId) {
        List<JsonNode> entries = read(
                post(path("safe/deposit/entries").build(), Map.of("members", members, "threshold", threshold, "chain_id", chainId)),
                new TypeReference<>() {});
        JsonNode first = single(entries, "deposit entry for chain " + chainId);
        return first.path("destination").asText();
    }

    @Override
    public void verifyCredentials() {
        JsonNode me = read(get(path("me").build()), new TypeReference<>() {});
        log.info("event=safe_http.credentials.verified userId={}", me.path("user_id").asText());
    }

    private HttpUrl.Builder path(String segments) {
        return baseUrl.newBuilder().addPathSegments(segments);
    }

    private Request get(HttpUrl url) {
        return authorized(new Request.Builder().url(url).get());
    }

    private Request post(HttpUrl url, Object body) {
        try {
            return authorized(new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode request body for " + url.encodedPath(), e);
        }
    }

    private Request authorized(Request.Builder builder) {
        if (!accessToken.isEmpty()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder.build();
    }

    // Unwraps the {data} / {error} envelope; any error becomes a LedgerApiException.
    private <T> T read(Request request, TypeReference<T> type) {
        String path = request.url().encodedPath();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            JsonNode root = text.isBlank() ? objectMapper.nullNode() : objectMapper.readTree(text);

            JsonNode error = root.get("error");
            if (error != null && !error.isNull()) {
                log.warn("event=safe_http.error path={} status={} code={}", path, response.code(), error.path("code").asInt());
                throw new LedgerApiException(
                        error.path("code").asInt(),
                        "Ledger API error for " + path + ": " + error.path("description").asText(error.toString()));
            }
            if (!response.isSuccessful()) {
                throw new LedgerApiException(response.code(), "Ledger API returned HTTP " + response.code() + " for " + path);
            }
            JsonNode data = root.get("data");
            if (data == null || data.isNull()) {
                throw new LedgerApiException("Ledger API response for " + path + " has no data");
            }
            return objectMapper.convertValue(data, type);
        } catch (IOException e) {
            throw new LedgerApiException("Failed to call ledger API " + path, e);
        }
    }

    private static <T> T single(List<T> items, String what) {
        if (items == null || items.isEmpty()) {
            throw new LedgerApiException("Ledger API returned no result for " + what);
        }
        return items.get(0);
    }
}
