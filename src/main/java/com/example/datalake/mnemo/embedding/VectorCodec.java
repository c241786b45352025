package com.example.datalake.mnemo.embedding;

import com.example.datalake.mnemo.exception.VectorDimensionException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Packs vectors as fixed-width little-endian float32 arrays and measures distances between them.
 */
public final class VectorCodec {

    private VectorCodec() {
    }

    public static byte[] pack(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    public static float[] unpack(byte[] packed) {
        if (packed.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Packed vector length " + packed.length + " is not a multiple of 4");
        }
        ByteBuffer buffer = ByteBuffer.wrap(packed).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[packed.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * Euclidean distance, the same metric pgvector's {@code <->} operator uses.
     */
    public static double l2Distance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new VectorDimensionException(a.length, b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Scales to unit length in place. A zero vector is returned unchanged.
     */
    public static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return vector;
        }
        double scale = 1.0 / Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] * scale);
        }
        return vector;
    }

    public static void requireDimension(float[] vector, int expected) {
        if (vector == null || vector.length != expected) {
            throw new VectorDimensionException(expected, vector == null ? 0 : vector.length);
        }
    }
}
