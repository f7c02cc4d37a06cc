package io.kubedevice.reconcile;

import io.fabric8.kubernetes.api.model.Quantity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Quantity helpers matching the integer view Kubernetes gives of a quantity.
 */
final class Quantities {

    private static final BigDecimal MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final BigDecimal MIN = BigDecimal.valueOf(Long.MIN_VALUE);

    private Quantities() {
        // Utility class
    }

    /**
     * Whole-number value of a quantity, rounded up: {@code 500m} is 1, {@code 1Ki} is 1024.
     * Values outside the range of a long saturate at {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE}.
     */
    static long value(Quantity quantity) {
        BigDecimal amount = quantity.getNumericalAmount().setScale(0, RoundingMode.CEILING);
        if (amount.compareTo(MAX) > 0) {
            return Long.MAX_VALUE;
        }
        if (amount.compareTo(MIN) < 0) {
            return Long.MIN_VALUE;
        }
        return amount.longValueExact();
    }

    static void forEachValue(Map<String, Quantity> quantities, BiConsumer<String, Long> action) {
        if (quantities == null) {
            return;
        }
        quantities.forEach((name, quantity) -> action.accept(name, value(quantity)));
    }
}
