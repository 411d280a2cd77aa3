package com.talentscope.search.embed;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import org.springframework.stereotype.Component;

/**
 * Deterministic unit vectors seeded from the text hash. Only useful for local development and
 * tests; vectors carry no semantic meaning.
 */
@Component
public class LocalHashEmbedder {
    private final EmbeddingProperties properties;

    public LocalHashEmbedder(EmbeddingProperties properties) {
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        int dimension = Math.max(1, properties.getDimensions());
        SplittableRandom random = new SplittableRandom(stableSeed(text));
        double[] values = new double[dimension];
        double sumSquares = 0.0;
        for (int i = 0; i < dimension; i++) {
            double value = random.nextDouble(-1.0, 1.0);
            values[i] = value;
            sumSquares += value * value;
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    private long stableSeed(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
