package com.netcourier.docqa.service.vector;

import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.ingestion.Fingerprints;

import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.UUID;

final class IndexArguments {

    private IndexArguments() {
    }

    static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidParametersException("Owner id is required");
        }
    }

    static void requireVector(float[] vector, int dimensions) {
        if (vector == null || vector.length != dimensions) {
            throw new InvalidParametersException("Vector must have " + dimensions + " dimensions");
        }
    }

    static void requireK(int k) {
        if (k < 1) {
            throw new InvalidParametersException("k must be at least 1");
        }
    }

    static void requireChunkId(String chunkId) {
        if (chunkId == null || chunkId.isBlank()) {
            throw new InvalidParametersException("Chunk id is required");
        }
    }

    /**
     * Stable storage key derived from owner and chunk id, shaped as a UUID so Qdrant accepts it.
     */
    static String pointId(String ownerId, String chunkId) {
        byte[] digest = HexFormat.of().parseHex(Fingerprints.sha256(ownerId + "/" + chunkId));
        ByteBuffer buffer = ByteBuffer.wrap(digest, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong()).toString();
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }
}
