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
 * Understands the subset of the Qdrant points API the index uses: collection lookup and creation, upsert,
 * filtered search and delete by filter.
 */
class FakeQdrantServer extends FakeStoreExchange {

    private final String collection;
    private final Map<String, JsonNode> points = new ConcurrentHashMap<>();
    volatile boolean collectionExists;
    volatile JsonNode collectionDefinition;

    FakeQdrantServer(String collection) {
        this.collection = collection;
    }

    @Override
    ClientResponse handle(HttpMethod method, String path, JsonNode body) {
        String base = "/collections/" + collection;
        if (path.equals(base) && method == HttpMethod.GET) {
            return collectionExists ? json(Map.of("result", Map.of("status", "green"))) : status(HttpStatus.NOT_FOUND);
        }
        if (path.equals(base) && method == HttpMethod.PUT) {
            collectionExists = true;
            collectionDefinition = body;
            return json(Map.of("result", true));
        }
        if (path.equals(base + "/index")) {
            return json(Map.of("result", Map.of("status", "completed")));
        }
        if (!collectionExists) {
            return status(HttpStatus.NOT_FOUND);
        }
        if (path.equals(base + "/points") && method == HttpMethod.PUT) {
            body.get("points").forEach(point -> points.put(point.get("id").asText(), point));
            return json(Map.of("result", Map.of("status", "completed")));
        }
        if (path.equals(base + "/points/search")) {
            return json(Map.of("result", search(body)));
        }
        if (path.equals(base + "/points/delete")) {
            JsonNode must = body.path("filter").path("must");
            points.values().removeIf(point -> matches(point.get("payload"), must));
            return json(Map.of("result", Map.of("status", "completed")));
        }
        return status(HttpStatus.NOT_FOUND);
    }

    private List<Map<String, Object>> search(JsonNode body) {
        JsonNode query = body.get("vector");
        JsonNode must = body.path("filter").path("must");
        List<Map<String, Object>> hits = new ArrayList<>();
        for (JsonNode point : points.values()) {
            if (!matches(point.get("payload"), must)) {
                continue;
            }
            Map<String, Object> hit = new LinkedHashMap<>();
            hit.put("id", point.get("id").asText());
            hit.put("version", 1);
            hit.put("score", cosine(query, point.get("vector")));
            hit.put("payload", objectMapper.convertValue(point.get("payload"), Map.class));
            hits.add(hit);
        }
        hits.sort(Comparator.comparingDouble((Map<String, Object> hit) -> (Double) hit.get("score")).reversed());
        return hits.subList(0, Math.min(body.get("limit").asInt(), hits.size()));
    }

    private static boolean matches(JsonNode payload, JsonNode must) {
        for (JsonNode condition : must) {
            JsonNode actual = payload.get(condition.get("key").asText());
            if (actual == null) {
                return false;
            }
            JsonNode match = condition.get("match");
            if (match.has("value") && !match.get("value").asText().equals(actual.asText())) {
                return false;
            }
            if (match.has("any")) {
                Set<String> allowed = new HashSet<>();
                match.get("any").forEach(value -> allowed.add(value.asText()));
                if (!allowed.contains(actual.asText())) {
                    return false;
                }
            }
        }
        return true;
    }
}
