package com.knotcore.util;

import com.knotcore.exception.ValidationException;

/**
 * Vector helpers for hint embeddings.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two equal-length vectors. Zero vectors have similarity 0.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new ValidationException(
                    String.format("Vector dimensions differ: %d vs %d", a.length, b.length));
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Cosine similarity clamped to [0, 1]; opposite directions count as unrelated.
     */
    public static double similarity(float[] a, float[] b) {
        return clamp(cosine(a, b), 0.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Format float array as pgvector string format.
     */
    public static String toLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(vector[i]);
        }
        sb.append("]");
        return sb.toString();
    }

    /**
     * Parse pgvector text output such as {@code [0.1,0.2]}.
     *
     * @return Parsed vector, or null for null input
     */
    public static float[] fromLiteral(String literal) {
        if (literal == null) {
            return null;
        }
        String body = literal.trim();
        if (!body.startsWith("[") || !body.endsWith("]")) {
            throw new IllegalArgumentException("Not a vector literal: " + literal);
        }
        body = body.substring(1, body.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }
}
