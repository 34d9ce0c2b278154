package com.rollup.service.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * HyperLogLog cardinality sketch used to estimate unique visitors per rollup.
 *
 * <p>Each key is hashed with 64-bit Murmur3. The low {@code p} bits select a register,
 * the remaining bits give the rank (position of the lowest set bit). Registers take one
 * byte each, so a sketch of precision 14 occupies 16 KiB plus a 3 byte header when
 * serialized. Standard error is about {@code 1.04 / sqrt(2^p)}.
 *
 * <p>Serialized layout:
 * <pre>
 * [0]      magic 'H'
 * [1]      format version (1)
 * [2]      precision p
 * [3..]    2^p register bytes
 * </pre>
 *
 * <p>Not thread-safe. Instances held by the rollup buffer are only touched under the
 * buffer's write lock.
 */
public final class CardinalitySketch {

    public static final int DEFAULT_PRECISION = 14;
    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 18;

    private static final byte MAGIC = 'H';
    private static final byte VERSION = 1;
    private static final int HEADER_BYTES = 3;

    private static final HashFunction HASH = Hashing.murmur3_128();

    private final int precision;
    private final byte[] registers;

    public CardinalitySketch() {
        this(DEFAULT_PRECISION);
    }

    public CardinalitySketch(int precision) {
        Preconditions.checkArgument(
                precision >= MIN_PRECISION && precision <= MAX_PRECISION,
                "invalid precision [%s]: should be in [%s, %s]", precision, MIN_PRECISION, MAX_PRECISION);
        this.precision = precision;
        this.registers = new byte[1 << precision];
    }

    private CardinalitySketch(int precision, byte[] registers) {
        this.precision = precision;
        this.registers = registers;
    }

    /**
     * Decodes a sketch previously produced by {@link #serialize()}.
     *
     * @throws SketchFormatException if the bytes are not a valid sketch
     */
    public static CardinalitySketch deserialize(byte[] bytes) {
        int p = readHeader(bytes);
        byte[] decoded = Arrays.copyOfRange(bytes, HEADER_BYTES, bytes.length);
        validateRegisters(decoded, p);
        return new CardinalitySketch(p, decoded);
    }

    // ==================== Core Operations ====================

    public void add(String key) {
        if (key == null || key.isEmpty()) {
            return;
        }
        addHash(HASH.hashString(key, StandardCharsets.UTF_8).asLong());
    }

    private void addHash(long hash) {
        int bucket = (int) (hash & ((1L << precision) - 1));
        long w = hash >>> precision;

        int rank;
        if (w == 0) {
            rank = Long.SIZE - precision + 1;
        } else {
            rank = Long.numberOfTrailingZeros(w) + 1;
        }

        if (registers[bucket] < rank) {
            registers[bucket] = (byte) rank;
        }
    }

    /**
     * Returns the estimated number of distinct keys added.
     */
    public long estimate() {
        int m = registers.length;
        double sum = 0.0;
        int zeros = 0;
        for (byte register : registers) {
            sum += 1.0 / (1L << register);
            if (register == 0) {
                zeros++;
            }
        }

        double raw = alpha(m) * m * m / sum;
        if (raw <= 2.5 * m && zeros > 0) {
            // linear counting
            return Math.round(m * Math.log((double) m / zeros));
        }
        return Math.round(raw);
    }

    public boolean isEmpty() {
        for (byte register : registers) {
            if (register != 0) {
                return false;
            }
        }
        return true;
    }

    public int getPrecision() {
        return precision;
    }

    // ==================== Union ====================

    /**
     * Unions another sketch into this one.
     *
     * @throws SketchFormatException if the precisions differ
     */
    public void merge(CardinalitySketch other) {
        if (other == null) {
            return;
        }
        if (other.precision != precision) {
            throw new SketchFormatException(
                    "Cannot merge sketch of precision %d into precision %d".formatted(other.precision, precision));
        }
        mergeRegisters(other.registers);
    }

    /**
     * Unions serialized sketch bytes into this one. The bytes are fully validated before
     * any register is touched.
     *
     * @throws SketchFormatException on malformed or incompatible input
     */
    public void merge(byte[] otherBytes) {
        int p = readHeader(otherBytes);
        if (p != precision) {
            throw new SketchFormatException(
                    "Cannot merge sketch of precision %d into precision %d".formatted(p, precision));
        }
        byte[] other = Arrays.copyOfRange(otherBytes, HEADER_BYTES, otherBytes.length);
        validateRegisters(other, p);
        mergeRegisters(other);
    }

    private void mergeRegisters(byte[] other) {
        for (int i = 0; i < registers.length; i++) {
            if (registers[i] < other[i]) {
                registers[i] = other[i];
            }
        }
    }

    public CardinalitySketch copy() {
        return new CardinalitySketch(precision, registers.clone());
    }

    // ==================== Serialization ====================

    public byte[] serialize() {
        byte[] out = new byte[HEADER_BYTES + registers.length];
        out[0] = MAGIC;
        out[1] = VERSION;
        out[2] = (byte) precision;
        System.arraycopy(registers, 0, out, HEADER_BYTES, registers.length);
        return out;
    }

    private static int readHeader(byte[] bytes) {
        if (bytes == null || bytes.length < HEADER_BYTES) {
            throw new SketchFormatException("Sketch bytes are missing or truncated");
        }
        if (bytes[0] != MAGIC) {
            throw new SketchFormatException("Not a cardinality sketch (bad magic byte)");
        }
        if (bytes[1] != VERSION) {
            throw new SketchFormatException("Unsupported sketch format version: " + bytes[1]);
        }
        int p = bytes[2];
        if (p < MIN_PRECISION || p > MAX_PRECISION) {
            throw new SketchFormatException("Invalid sketch precision: " + p);
        }
        if (bytes.length != HEADER_BYTES + (1 << p)) {
            throw new SketchFormatException(
                    "Sketch length %d does not match precision %d".formatted(bytes.length, p));
        }
        return p;
    }

    private static void validateRegisters(byte[] registers, int p) {
        int maxRank = Long.SIZE - p + 1;
        for (byte register : registers) {
            if (register < 0 || register > maxRank) {
                throw new SketchFormatException("Sketch register out of range: " + register);
            }
        }
    }

    private static double alpha(int m) {
        return switch (m) {
            case 16 -> 0.673;
            case 32 -> 0.697;
            case 64 -> 0.709;
            default -> 0.7213 / (1 + 1.079 / m);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CardinalitySketch other)) return false;
        return precision == other.precision && Arrays.equals(registers, other.registers);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(registers) + precision;
    }

    @Override
    public String toString() {
        return "CardinalitySketch(p=%d, estimate=%d)".formatted(precision, estimate());
    }
}
