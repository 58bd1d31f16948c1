package com.netcourier.docqa.service.vector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.docqa.service.error.IndexUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * Exact brute-force cosine search held in process. Each owner has its own immutable partition that
 * writers replace atomically, so searches never wait on writers and never see a half-applied
 * update. When a snapshot path is configured the full index is loaded from it at construction and
 * rewritten after every mutation.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final ConcurrentMap<String, Map<String, StoredVector>> partitions = new ConcurrentHashMap<>();
    private final int dimensions;
    private final Path snapshotPath;
    private final ObjectMapper objectMapper;
    private final Object snapshotLock = new Object();

    public InMemoryVectorIndex(int dimensions) {
        this(dimensions, null, new ObjectMapper());
    }

    public InMemoryVectorIndex(int dimensions, Path snapshotPath, ObjectMapper objectMapper) {
        this.dimensions = dimensions;
        this.snapshotPath = snapshotPath;
        this.objectMapper = objectMapper;
        if (snapshotPath != null) {
            load(snapshotPath);
        }
    }

    @Override
    public void add(String ownerId, String chunkId, float[] vector, VectorMetadata metadata) {
        addAll(ownerId, List.of(new EmbeddedVector(chunkId, vector, metadata)));
    }

    @Override
    public void addAll(String ownerId, List<EmbeddedVector> vectors) {
        IndexArguments.requireOwner(ownerId);
        if (vectors.isEmpty()) {
            return;
        }
        for (EmbeddedVector vector : vectors) {
            IndexArguments.requireChunkId(vector.chunkId());
            IndexArguments.requireVector(vector.vector(), dimensions);
        }
        partitions.compute(ownerId, (owner, current) -> {
            Map<String, StoredVector> next = current == null ? new HashMap<>() : new HashMap<>(current);
            for (EmbeddedVector vector : vectors) {
                next.put(vector.chunkId(), new StoredVector(vector.chunkId(), vector.vector().clone(),
                        vector.metadata().documentId(), vector.metadata().chunkIndex()));
            }
            return Map.copyOf(next);
        });
        persist();
    }

    @Override
    public List<VectorMatch> search(String ownerId, float[] queryVector, int k, SearchFilters filters) {
        IndexArguments.requireOwner(ownerId);
        IndexArguments.requireVector(queryVector, dimensions);
        IndexArguments.requireK(k);
        Map<String, StoredVector> partition = partitions.getOrDefault(ownerId, Map.of());
        List<VectorMatch> matches = new ArrayList<>(partition.size());
        for (StoredVector stored : partition.values()) {
            if (!filters.accepts(stored.documentId())) {
                continue;
            }
            double score = IndexArguments.cosine(queryVector, stored.vector());
            matches.add(new VectorMatch(stored.chunkId(), stored.documentId(), stored.chunkIndex(), score));
        }
        return matches.stream()
                .sorted(VectorMatch.RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public void delete(String ownerId, String chunkId) {
        IndexArguments.requireOwner(ownerId);
        removeWhere(ownerId, stored -> stored.chunkId().equals(chunkId));
    }

    @Override
    public void deleteDocument(String ownerId, long documentId) {
        IndexArguments.requireOwner(ownerId);
        removeWhere(ownerId, stored -> stored.documentId() == documentId);
    }

    @Override
    public void deleteAll(String ownerId) {
        IndexArguments.requireOwner(ownerId);
        if (partitions.remove(ownerId) != null) {
            persist();
        }
    }

    @Override
    public VectorIndexVariant variant() {
        return VectorIndexVariant.IN_MEMORY;
    }

    int size(String ownerId) {
        return partitions.getOrDefault(ownerId, Map.of()).size();
    }

    private void removeWhere(String ownerId, Predicate<StoredVector> condition) {
        boolean[] changed = {false};
        partitions.computeIfPresent(ownerId, (owner, current) -> {
            Map<String, StoredVector> next = new HashMap<>(current);
            changed[0] = next.values().removeIf(condition);
            return next.isEmpty() ? null : Map.copyOf(next);
        });
        if (changed[0]) {
            persist();
        }
    }

    private void load(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try {
            List<SnapshotEntry> entries = objectMapper.readValue(path.toFile(), new TypeReference<List<SnapshotEntry>>() {
            });
            Map<String, Map<String, StoredVector>> loaded = new HashMap<>();
            for (SnapshotEntry entry : entries) {
                loaded.computeIfAbsent(entry.ownerId(), owner -> new HashMap<>())
                        .put(entry.chunkId(), new StoredVector(entry.chunkId(), entry.vector(), entry.documentId(), entry.chunkIndex()));
            }
            loaded.forEach((owner, vectors) -> partitions.put(owner, Map.copyOf(vectors)));
            log.info("Loaded {} vectors for {} owners from {}", entries.size(), loaded.size(), path);
        } catch (IOException e) {
            throw new IndexUnavailableException("Failed to read vector snapshot " + path, e);
        }
    }

    private void persist() {
        if (snapshotPath == null) {
            return;
        }
        synchronized (snapshotLock) {
            List<SnapshotEntry> entries = new ArrayList<>();
            partitions.forEach((owner, vectors) -> vectors.values().forEach(stored -> entries.add(
                    new SnapshotEntry(owner, stored.chunkId(), stored.documentId(), stored.chunkIndex(), stored.vector()))));
            try {
                if (snapshotPath.getParent() != null) {
                    Files.createDirectories(snapshotPath.getParent());
                }
                Path temp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
                objectMapper.writeValue(temp.toFile(), entries);
                Files.move(temp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new IndexUnavailableException("Failed to write vector snapshot " + snapshotPath, e);
            }
        }
    }

    private record StoredVector(String chunkId, float[] vector, long documentId, int chunkIndex) {}

    record SnapshotEntry(String ownerId, String chunkId, long documentId, int chunkIndex, float[] vector) {}
}
