package io.kubedevice.reconcile;

import io.fabric8.kubernetes.api.model.Quantity;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for Quantities.
 */
class QuantitiesTest {

    @Test
    void testWholeValues() {
        assertThat(Quantities.value(new Quantity("4"))).isEqualTo(4L);
        assertThat(Quantities.value(new Quantity("1Ki"))).isEqualTo(1024L);
        assertThat(Quantities.value(new Quantity("64Gi"))).isEqualTo(68719476736L);
    }

    @Test
    void testFractionalValuesRoundUp() {
        assertThat(Quantities.value(new Quantity("500m"))).isEqualTo(1L);
        assertThat(Quantities.value(new Quantity("3500m"))).isEqualTo(4L);
    }

    @Test
    void testOversizedValueSaturates() {
        assertThat(Quantities.value(new Quantity("1000000E"))).isEqualTo(Long.MAX_VALUE);
        assertThat(Quantities.value(new Quantity("100Ei"))).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void testForEachValueSkipsNullMap() {
        Map<String, Long> values = new LinkedHashMap<>();

        Quantities.forEachValue(null, values::put);
        Quantities.forEachValue(Map.of("cpu", new Quantity("250m")), values::put);

        assertThat(values).containsExactly(entry("cpu", 1L));
    }
}
