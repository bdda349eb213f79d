package com.star.loginsight.detection;

import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.DimensionKey;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable map-backed lookup. A signature counts as known for a service when any
 * entry carries it for that service or for the wildcard service. For a key whose
 * service is the wildcard, an entry under any service is enough.
 */
public class InMemoryBaselineLookup implements BaselineLookup {

    private final Map<DimensionKey, Baseline> entries;
    private final Set<String> knownSignatures;
    private final Set<String> anyServiceSignatures;

    public InMemoryBaselineLookup(Map<DimensionKey, Baseline> entries) {
        this.entries = Map.copyOf(entries);
        this.knownSignatures = new HashSet<>();
        this.anyServiceSignatures = new HashSet<>();
        for (DimensionKey key : this.entries.keySet()) {
            if (key.hasSignature()) {
                knownSignatures.add(signatureIndex(key.getService(), key.getErrorSignature()));
                anyServiceSignatures.add(key.getErrorSignature());
            }
        }
    }

    @Override
    public Optional<Baseline> get(DimensionKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean knowsSignature(DimensionKey key) {
        if (!key.hasSignature()) {
            return true;
        }
        if (!key.hasService()) {
            return anyServiceSignatures.contains(key.getErrorSignature());
        }
        return knownSignatures.contains(signatureIndex(key.getService(), key.getErrorSignature()))
                || knownSignatures.contains(signatureIndex(DimensionKey.WILDCARD, key.getErrorSignature()));
    }

    public int size() {
        return entries.size();
    }

    private static String signatureIndex(String service, String signature) {
        return service + "|" + signature;
    }
}
