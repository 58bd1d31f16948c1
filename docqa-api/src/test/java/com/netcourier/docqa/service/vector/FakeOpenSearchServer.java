package com.netcourier.docqa.service.vector;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Understands index lookup and creation, document put, filtered k-NN search in the cosinesimil space and
 * delete by query.
 */
class FakeOpenSearchServer extends FakeStoreExchange {

    private final String index;
    private final Map<String, JsonNode> documents = new ConcurrentHashMap<>();
    volatile boolean indexExists;
    volatile JsonNode indexDefinition;

    FakeOpenSearchServer(String index) {
        this.index = index;
    }

    @Override
    ClientResponse handle(HttpMethod method, String path, JsonNode body) {
        String base = "/" + index;
        if (path.equals(base) && method == HttpMethod.HEAD) {
            return indexExists ? status(HttpStatus.OK) : status(HttpStatus.NOT_FOUND);
        }
        if (path.equals(base) && method == HttpMethod.PUT) {
            indexExists = true;
            indexDefinition = body;
            return json(Map.of("acknowledged", true, "index", index));
        }
        if (!indexExists) {
            return status(HttpStatus.NOT_FOUND);
        }
        if (path.startsWith(base + "/_doc/") && method == HttpMethod.PUT) {
            String id = path.substring((base + "/_doc/").length());
            documents.put(id, body);
            return json(Map.of("_id", id, "result", "created"));
        }
        if (path.equals(base + "/_search")) {
            return json(Map.of("hits", Map.of("hits", search(body))));
        }
        if (path.equals(base + "/_delete_by_query")) {
            JsonNode filter = body.path("query").path("bool").path("filter");
            int before = documents.size();
            documents.values().removeIf(document -> matches(document, filter));
            return json(Map.of("deleted", before - documents.size()));
        }
        return status(HttpStatus.NOT_FOUND);
    }

    private List<Map<String, Object>> search(JsonNode body) {
        JsonNode knn = body.path("query").path("knn").path(OpenSearchVectorIndex.VECTOR_FIELD);
        JsonNode query = knn.get("vector");
        JsonNode filter = knn.path("filter").path("bool").path("filter");
        List<Map<String, Object>> hits = new ArrayList<>();
        documents.forEach((id, document) -> {
            if (!matches(document, filter)) {
                return;
            }
            Map<String, Object> source = new LinkedHashMap<>();
            body.get("_source").forEach(field -> source.put(field.asText(),
                    objectMapper.convertValue(document.get(field.asText()), Object.class)));
            Map<String, Object> hit = new LinkedHashMap<>();
            hit.put("_index", index);
            hit.put("_id", id);
            hit.put("_score", (1d + cosine(query, document.get(OpenSearchVectorIndex.VECTOR_FIELD))) / 2d);
            hit.put("_source", source);
            hits.add(hit);
        });
        hits.sort(Comparator.comparingDouble((Map<String, Object> hit) -> (Double) hit.get("_score")).reversed());
        return hits.subList(0, Math.min(body.get("size").asInt(), hits.size()));
    }

    private static boolean matches(JsonNode document, JsonNode filter) {
        for (JsonNode clause : filter) {
            if (clause.has("term")) {
                Map.Entry<String, JsonNode> term = clause.get("term").fields().next();
                JsonNode actual = document.get(term.getKey());
                if (actual == null || !actual.asText().equals(term.getValue().asText())) {
                    return false;
                }
            }
            if (clause.has("terms")) {
                Map.Entry<String, JsonNode> terms = clause.get("terms").fields().next();
                Set<String> allowed = new HashSet<>();
                terms.getValue().forEach(value -> allowed.add(value.asText()));
                JsonNode actual = document.get(terms.getKey());
                if (actual == null || !allowed.contains(actual.asText())) {
                    return false;
                }
            }
        }
        return true;
    }
}
