package com.star.loginsight.detection;

import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.DimensionKey;

import java.util.Optional;

/**
 * Read-only access to historical expectations, supplied by the caller. A missing
 * entry is a data condition, never an error.
 */
@FunctionalInterface
public interface BaselineLookup {

    Optional<Baseline> get(DimensionKey key);

    /**
     * Whether the signature of {@code key} has any history for the key's service.
     * By default an entry for the exact key, for {@code (service,*,signature)} or
     * for {@code (*,*,signature)} counts as history. Keys without a signature are
     * always known. Lookups that can enumerate their entries override this so that a
     * wildcard-service key is known when any service has the signature.
     */
    default boolean knowsSignature(DimensionKey key) {
        if (!key.hasSignature()) {
            return true;
        }
        String signature = key.getErrorSignature();
        return get(key).isPresent()
                || get(DimensionKey.of(key.getService(), DimensionKey.WILDCARD, signature)).isPresent()
                || get(DimensionKey.of(DimensionKey.WILDCARD, DimensionKey.WILDCARD, signature)).isPresent();
    }

    static BaselineLookup empty() {
        return key -> Optional.empty();
    }
}
