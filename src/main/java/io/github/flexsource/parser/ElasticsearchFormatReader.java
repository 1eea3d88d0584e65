package io.github.flexsource.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.Partition;
import io.github.flexsource.frame.TabularDataset;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Implementation of {@link FormatReader} that reads the documents of an Elasticsearch index over
 * its REST API.
 *
 * <p>
 * The columns are the properties of the index mapping, nested object properties joined with
 * {@code .}. Documents are fetched lazily with the scroll API, one batch at a time; the document
 * {@code _id} is the row identity and {@code _source} provides the cell values.
 * </p>
 *
 * <p>
 * Supported parameters:
 * </p>
 * <ul>
 * <li>{@code es_host}: base URL of the cluster, default {@code http://localhost:9200}</li>
 * <li>{@code index}: index name or pattern; when absent, a source entry other than
 * {@value #SOURCE_TYPE} is used</li>
 * <li>{@code query}: query DSL object, default {@code match_all}</li>
 * <li>{@code batch_size}: documents per scroll page, default 500</li>
 * <li>{@code scroll}: scroll context keep-alive, default {@code 1m}</li>
 * </ul>
 *
 * <p>
 * Authentication and connection pooling are left to the {@link HttpClient}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ElasticsearchFormatReader implements FormatReader {

    /** Format key of this backend. */
    public static final String SOURCE_TYPE = "elasticsearch";

    private static final String DEFAULT_HOST = "http://localhost:9200";

    // Created on the first request
    private final Supplier<HttpClient> httpClient;

    private final ObjectMapper mapper = new ObjectMapper();

    public ElasticsearchFormatReader() {
        this(HttpClient::newHttpClient);
    }

    /**
     * Creates a reader using the given HTTP client.
     *
     * @param httpClient client used for every request
     */
    public ElasticsearchFormatReader(HttpClient httpClient) {
        this(() -> httpClient);
    }

    ElasticsearchFormatReader(Supplier<HttpClient> clientFactory) {
        this.httpClient = Suppliers.memoize(clientFactory);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public TabularDataset read(List<String> source, Map<String, Object> parameters)
            throws IOException {
        ReaderParameters params = new ReaderParameters(parameters);
        String host = StringUtils.removeEnd(params.getString("es_host", DEFAULT_HOST), "/");
        String index = resolveIndex(source, params);
        Map<String, Object> query = params.getMap("query");
        int batchSize = params.getInt("batch_size", 500);
        String keepAlive = params.getString("scroll", "1m");

        List<String> names = new ArrayList<>(mappingProperties(host, index));
        List<Column> columns = names.stream().map(Column::object).collect(Collectors.toList());
        log.debug("Elasticsearch index inspected: host={}, index={}, columns={}", host, index,
                names);

        Partition rows = () -> {
            ScrollIterator hits = new ScrollIterator(host, index, query, batchSize, keepAlive);
            return StreamSupport
                    .stream(Spliterators.spliteratorUnknownSize(hits, Spliterator.ORDERED), false)
                    .onClose(hits::clear).map(hit -> {
                        Map<String, Object> document =
                                JsonFlattener.flattenObjects(hit.path("_source"));
                        List<Object> values = new ArrayList<>(names.size());
                        for (String name : names) {
                            values.add(document.get(name));
                        }
                        return new DataRow(hit.path("_id").asText(), values);
                    });
        };
        return new TabularDataset(columns, null, List.of(rows));
    }

    private static String resolveIndex(List<String> source, ReaderParameters params) {
        String index = params.getString("index", null);
        if (StringUtils.isBlank(index)) {
            index = source.stream().filter(s -> !SOURCE_TYPE.equalsIgnoreCase(s.trim()))
                    .findFirst().orElse(null);
        }
        if (StringUtils.isBlank(index)) {
            throw new IllegalArgumentException("Parameter 'index' is required for " + SOURCE_TYPE);
        }
        return index.trim();
    }

    private Set<String> mappingProperties(String host, String index) throws IOException {
        URI uri = URI.create(host + "/" + index + "/_mapping");
        JsonNode response = send(HttpRequest.newBuilder(uri).GET().build());
        Set<String> names = new LinkedHashSet<>();
        response.forEach(indexMapping -> {
            JsonNode mappings = indexMapping.path("mappings");
            if (mappings.has("properties")) {
                collectProperties(null, mappings.path("properties"), names);
            } else {
                // Pre-7 clusters nest the properties under the document type
                mappings.forEach(type -> collectProperties(null, type.path("properties"), names));
            }
        });
        return names;
    }

    private static void collectProperties(String prefix, JsonNode properties, Set<String> names) {
        properties.fields().forEachRemaining(property -> {
            String name = prefix == null ? property.getKey() : prefix + "." + property.getKey();
            JsonNode nested = property.getValue().path("properties");
            if (nested.isObject() && !"nested".equals(property.getValue().path("type").asText())) {
                collectProperties(name, nested, names);
            } else {
                names.add(name);
            }
        });
    }

    private JsonNode send(HttpRequest request) throws IOException {
        HttpResponse<String> response;
        try {
            response = httpClient.get().send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while calling " + request.uri());
        }
        if (response.statusCode() >= 300) {
            throw new IOException(String.format("Elasticsearch request %s %s failed: %d %s",
                    request.method(), request.uri(), response.statusCode(), response.body()));
        }
        return mapper.readTree(response.body());
    }

    private HttpRequest post(String url, Object body) throws IOException {
        return HttpRequest.newBuilder(URI.create(url)).header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
    }

    /**
     * Pages through the hits of a search with the scroll API.
     */
    private final class ScrollIterator implements Iterator<JsonNode> {

        private final String host;

        private final String index;

        private final Map<String, Object> query;

        private final int batchSize;

        private final String keepAlive;

        private final Deque<JsonNode> buffer = new ArrayDeque<>();

        private String scrollId;

        private boolean started;

        private boolean exhausted;

        ScrollIterator(String host, String index, Map<String, Object> query, int batchSize,
                String keepAlive) {
            this.host = host;
            this.index = index;
            this.query = query;
            this.batchSize = batchSize;
            this.keepAlive = keepAlive;
        }

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                try {
                    fetch();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void fetch() throws IOException {
            JsonNode page;
            if (!started) {
                ObjectNode body = mapper.createObjectNode();
                body.put("size", batchSize);
                body.set("query", query.isEmpty() ? mapper.createObjectNode().set("match_all",
                        mapper.createObjectNode()) : mapper.valueToTree(query));
                page = send(post(host + "/" + index + "/_search?scroll=" + keepAlive, body));
                started = true;
            } else {
                page = send(post(host + "/_search/scroll",
                        Map.of("scroll", keepAlive, "scroll_id", scrollId)));
            }
            scrollId = page.path("_scroll_id").asText(null);
            JsonNode hits = page.path("hits").path("hits");
            hits.forEach(buffer::add);
            exhausted = hits.size() == 0 || scrollId == null;
        }

        void clear() {
            if (scrollId == null) {
                return;
            }
            try {
                HttpRequest request = HttpRequest
                        .newBuilder(URI.create(host + "/_search/scroll"))
                        .header("Content-Type", "application/json")
                        .method("DELETE", HttpRequest.BodyPublishers.ofString(
                                mapper.writeValueAsString(Map.of("scroll_id", List.of(scrollId)))))
                        .build();
                send(request);
            } catch (IOException e) {
                log.warn("Failed to clear scroll context {}: {}", scrollId, e.getMessage());
            }
            scrollId = null;
        }
    }
}
