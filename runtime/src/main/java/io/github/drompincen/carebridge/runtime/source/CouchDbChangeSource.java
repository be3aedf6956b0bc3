package io.github.drompincen.carebridge.runtime.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.protocol.sync.ChangeBatch;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads the CouchDB {@code _changes} feed in normal (non-continuous) mode with documents inlined.
 */
@Component
public class CouchDbChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(CouchDbChangeSource.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String database;
    private final String authorization;
    private final Duration timeout;

    @Autowired
    public CouchDbChangeSource(ObjectMapper objectMapper,
                               @Value("${carebridge.couchdb.url:http://localhost:5984}") String baseUrl,
                               @Value("${carebridge.couchdb.database:healthbridge}") String database,
                               @Value("${carebridge.couchdb.username:}") String username,
                               @Value("${carebridge.couchdb.password:}") String password,
                               @Value("${carebridge.couchdb.timeout-ms:30000}") long timeoutMs) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build(),
                objectMapper, baseUrl, database, username, password, timeoutMs);
    }

    CouchDbChangeSource(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String database,
                        String username, String password, long timeoutMs) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.database = database;
        this.authorization = username == null || username.isBlank() ? null
                : "Basic " + Base64.getEncoder().encodeToString(
                        (username + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public ChangeBatch fetchChanges(String cursor, int maxBatchSize) {
        String since = cursor == null || cursor.isBlank() ? BEGINNING : cursor;
        URI uri = URI.create(baseUrl + "/" + database + "/_changes?include_docs=true&feed=normal"
                + "&since=" + URLEncoder.encode(since, StandardCharsets.UTF_8)
                + "&limit=" + maxBatchSize);

        JsonNode body = get(uri);
        JsonNode results = body.path("results");
        if (!results.isArray()) {
            throw new ChangeSourceException("Malformed _changes response: no results array");
        }

        List<ChangeRecord> changes = new ArrayList<>();
        for (JsonNode entry : results) {
            ChangeRecord change = toChangeRecord(entry);
            if (change != null) {
                changes.add(change);
            }
        }

        String newCursor = body.hasNonNull("last_seq") ? sequenceText(body.get("last_seq")) : since;
        boolean hasMore = body.has("pending")
                ? body.get("pending").asLong() > 0
                : results.size() >= maxBatchSize;

        log.debug("Fetched {} changes since {} (next={}, hasMore={})", changes.size(), since, newCursor, hasMore);
        return new ChangeBatch(changes, newCursor, hasMore);
    }

    @Override
    public OptionalLong documentCount() {
        JsonNode info = get(URI.create(baseUrl + "/" + database));
        return info.has("doc_count") ? OptionalLong.of(info.get("doc_count").asLong()) : OptionalLong.empty();
    }

    private ChangeRecord toChangeRecord(JsonNode entry) {
        String id = entry.path("id").asText(null);
        boolean deleted = entry.path("deleted").asBoolean(false);
        JsonNode doc = entry.get("doc");
        if (id == null || (!deleted && (doc == null || doc.isNull()))) {
            log.debug("Ignoring change entry without document: {}", id);
            return null;
        }
        if (doc == null || doc.isNull()) {
            doc = objectMapper.createObjectNode();
        }
        String revision = doc.hasNonNull("_rev") ? doc.get("_rev").asText()
                : entry.path("changes").path(0).path("rev").asText(null);
        return new ChangeRecord(id, revision, sequenceText(entry.get("seq")), deleted, doc);
    }

    private static String sequenceText(JsonNode seq) {
        if (seq == null || seq.isNull()) return null;
        return seq.isTextual() ? seq.asText() : seq.toString();
    }

    private JsonNode get(URI uri) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ChangeSourceException("Request to " + uri.getPath() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChangeSourceException("Interrupted while calling " + uri.getPath(), e);
        }

        if (response.statusCode() != 200) {
            throw new ChangeSourceException("CouchDB returned HTTP " + response.statusCode()
                    + " for " + uri.getPath());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ChangeSourceException("Unreadable response from " + uri.getPath(), e);
        }
    }
}
