package com.rollup.service.sketch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CardinalitySketchTest {

    @Test
    @DisplayName("Empty sketch estimates zero")
    void emptySketch() {
        var sketch = new CardinalitySketch();

        assertThat(sketch.isEmpty()).isTrue();
        assertThat(sketch.estimate()).isZero();
    }

    @Test
    @DisplayName("Repeated keys are counted once")
    void repeatedKeysCountedOnce() {
        var sketch = new CardinalitySketch();
        for (int i = 0; i < 1000; i++) {
            sketch.add("session-1");
        }

        assertThat(sketch.estimate()).isEqualTo(1);
    }

    @Test
    @DisplayName("Null and empty keys are ignored")
    void nullAndEmptyIgnored() {
        var sketch = new CardinalitySketch();
        sketch.add(null);
        sketch.add("");

        assertThat(sketch.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Estimate stays within a few percent for large cardinalities")
    void estimateAccuracy() {
        var sketch = new CardinalitySketch();
        int distinct = 100_000;
        for (int i = 0; i < distinct; i++) {
            sketch.add("visitor-" + i);
        }

        assertThat((double) sketch.estimate()).isCloseTo(distinct, within(distinct * 0.03));
    }

    @Test
    @DisplayName("Small cardinalities are near exact")
    void smallCardinality() {
        var sketch = new CardinalitySketch();
        for (int i = 0; i < 50; i++) {
            sketch.add("visitor-" + i);
        }

        assertThat(sketch.estimate()).isBetween(48L, 52L);
    }

    @Test
    @DisplayName("Union estimates the cardinality of the combined sets")
    void mergeIsUnion() {
        var left = new CardinalitySketch();
        var right = new CardinalitySketch();
        for (int i = 0; i < 6000; i++) {
            left.add("visitor-" + i);
        }
        for (int i = 4000; i < 10000; i++) {
            right.add("visitor-" + i);
        }

        left.merge(right.serialize());

        assertThat((double) left.estimate()).isCloseTo(10000, within(300.0));
    }

    @Test
    @DisplayName("Merging a sketch into itself does not change it")
    void mergeIsIdempotent() {
        var sketch = new CardinalitySketch();
        for (int i = 0; i < 500; i++) {
            sketch.add("visitor-" + i);
        }
        var before = sketch.copy();

        sketch.merge(sketch.serialize());

        assertThat(sketch).isEqualTo(before);
    }

    @Test
    @DisplayName("Serialized form round-trips byte for byte")
    void serializeRoundTrip() {
        var sketch = new CardinalitySketch(12);
        for (int i = 0; i < 2000; i++) {
            sketch.add("visitor-" + i);
        }

        byte[] bytes = sketch.serialize();
        var decoded = CardinalitySketch.deserialize(bytes);

        assertThat(decoded).isEqualTo(sketch);
        assertThat(decoded.serialize()).isEqualTo(bytes);
        assertThat(decoded.getPrecision()).isEqualTo(12);
    }

    @Test
    @DisplayName("Malformed bytes are rejected without touching the receiver")
    void malformedBytesRejected() {
        var sketch = new CardinalitySketch();
        sketch.add("visitor-1");
        var before = sketch.copy();

        byte[] truncated = Arrays.copyOf(sketch.serialize(), 100);
        byte[] badMagic = sketch.serialize();
        badMagic[0] = 'X';
        byte[] badRegister = new CardinalitySketch().serialize();
        badRegister[badRegister.length - 1] = 127;

        assertThatThrownBy(() -> sketch.merge(truncated)).isInstanceOf(SketchFormatException.class);
        assertThatThrownBy(() -> sketch.merge(badMagic)).isInstanceOf(SketchFormatException.class);
        assertThatThrownBy(() -> sketch.merge(badRegister)).isInstanceOf(SketchFormatException.class);
        assertThatThrownBy(() -> sketch.merge((byte[]) null)).isInstanceOf(SketchFormatException.class);
        assertThat(sketch).isEqualTo(before);
    }

    @Test
    @DisplayName("Sketches of different precision cannot be merged")
    void precisionMismatch() {
        var p14 = new CardinalitySketch(14);
        var p12 = new CardinalitySketch(12);
        p12.add("visitor-1");

        assertThatThrownBy(() -> p14.merge(p12)).isInstanceOf(SketchFormatException.class);
        assertThatThrownBy(() -> p14.merge(p12.serialize())).isInstanceOf(SketchFormatException.class);
    }

    @Test
    @DisplayName("Precision outside the supported range is rejected")
    void invalidPrecision() {
        assertThatThrownBy(() -> new CardinalitySketch(3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CardinalitySketch(19)).isInstanceOf(IllegalArgumentException.class);
    }
}
