package in.lhbflow.infrastructure.terminal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Terminal client speaking the JSON-over-HTTP gateway of the data terminal.
 *
 * Endpoints (relative to the base URL):
 * <ul>
 *   <li>{@code get_access_token}: exchanges the account secret (sent as {@code refresh_token}
 *       header) for an access token</li>
 *   <li>{@code data_pool}, {@code cmd_history_quotation}, {@code basic_data_service}: queries,
 *       authenticated with the {@code access_token} header</li>
 * </ul>
 *
 * Query bodies are returned untouched as {@link RawResponse.Bytes}; decoding is the
 * normalizer's job because the gateway does not always send UTF-8.
 */
public class HttpTerminalClient implements TerminalClient {
    private static final Logger log = LoggerFactory.getLogger(HttpTerminalClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;

    private volatile String accessToken;

    public HttpTerminalClient(String baseUrl) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    public HttpTerminalClient(String baseUrl, HttpClient httpClient) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
    }

    @Override
    public int login(String userId, String secret) {
        log.info("[HttpTerminalClient] Requesting access token for user {}", userId);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/get_access_token"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("refresh_token", secret)
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new TerminalException(null, "Login failed: HTTP " + response.statusCode());
            }

            JsonNode body = objectMapper.readTree(response.body());
            int code = body.path("errorcode").asInt(Integer.MIN_VALUE);
            if (code == Integer.MIN_VALUE) {
                throw new TerminalException(null, "Login reply carries no errorcode");
            }

            if (!TerminalStatus.isLoginAccepted(code)) {
                accessToken = null;
                return code;
            }
            String token = body.path("data").path("access_token").asText(null);
            if (token == null || token.isEmpty()) {
                accessToken = null;
                throw new TerminalException(null, "Login accepted with code " + code + " but no access token returned");
            }
            accessToken = token;
            return code;

        } catch (IOException e) {
            throw new TerminalException(null, "Login request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalException(null, "Login interrupted", e);
        }
    }

    @Override
    public void logout() {
        // The gateway has no logout endpoint; dropping the token ends the session on our side.
        accessToken = null;
        log.info("[HttpTerminalClient] Access token discarded");
    }

    @Override
    public RawResponse invoke(TerminalOperation operation, List<String> params) {
        String token = accessToken;
        if (token == null) {
            throw TerminalException.notLoggedIn(operation);
        }
        if (params == null || params.size() != operation.arity()) {
            throw new IllegalArgumentException(operation + " expects " + operation.arity() + " params, got "
                + (params == null ? 0 : params.size()));
        }

        try {
            String body = objectMapper.writeValueAsString(buildBody(operation, params));
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + operation.endpoint()))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("access_token", token)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

            long start = System.currentTimeMillis();
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            log.debug("[HttpTerminalClient] {} -> HTTP {} ({} bytes, {}ms)", operation, response.statusCode(),
                response.body() == null ? 0 : response.body().length, System.currentTimeMillis() - start);

            if (response.statusCode() / 100 != 2) {
                throw new TerminalException(operation, "HTTP " + response.statusCode());
            }
            return RawResponse.bytes(response.body());

        } catch (IOException e) {
            throw new TerminalException(operation, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalException(operation, "Request interrupted", e);
        }
    }

    @Override
    public String getName() {
        return "HTTP";
    }

    boolean hasAccessToken() {
        return accessToken != null;
    }

    /**
     * Map positional parameters onto the gateway's JSON body.
     */
    ObjectNode buildBody(TerminalOperation operation, List<String> params) {
        ObjectNode body = objectMapper.createObjectNode();
        switch (operation) {
            case INSTRUMENT_LIST, DATA_POOL -> {
                body.put("reportname", params.get(0));
                ObjectNode functionPara = body.putObject("functionpara");
                if (!params.get(1).isEmpty()) {
                    functionPara.put("date", params.get(1));
                }
                functionPara.put("filter", params.get(2));
                body.put("outputpara", params.get(3));
            }
            case HISTORY_QUOTES -> {
                body.put("codes", params.get(0));
                body.put("indicators", params.get(1));
                ObjectNode functionPara = body.putObject("functionpara");
                for (String pair : params.get(2).split(";")) {
                    int colon = pair.indexOf(':');
                    if (colon > 0) {
                        functionPara.put(pair.substring(0, colon).trim(), pair.substring(colon + 1).trim());
                    }
                }
                body.put("startdate", params.get(3));
                body.put("enddate", params.get(4));
            }
            case BASIC_DATA -> {
                body.put("codes", params.get(0));
                ArrayNode indiPara = body.putArray("indipara");
                for (String indicator : params.get(1).split(",")) {
                    ObjectNode entry = indiPara.addObject();
                    entry.put("indicator", indicator.trim());
                    entry.putArray("indiparams").add(params.get(2));
                }
            }
        }
        return body;
    }
}
