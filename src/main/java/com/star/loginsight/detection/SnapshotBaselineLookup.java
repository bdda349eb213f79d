package com.star.loginsight.detection;

import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.DimensionKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes reads from a shared lookup so that one run sees one consistent view.
 * A read that throws is treated as a miss and recorded as a warning.
 */
@Slf4j
public class SnapshotBaselineLookup implements BaselineLookup {

    private final BaselineLookup delegate;
    private final Map<DimensionKey, Optional<Baseline>> entries = new ConcurrentHashMap<>();
    private final Map<DimensionKey, Boolean> signatures = new ConcurrentHashMap<>();
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    public SnapshotBaselineLookup(BaselineLookup delegate) {
        this.delegate = delegate != null ? delegate : BaselineLookup.empty();
    }

    @Override
    public Optional<Baseline> get(DimensionKey key) {
        return entries.computeIfAbsent(key, this::read);
    }

    @Override
    public boolean knowsSignature(DimensionKey key) {
        return signatures.computeIfAbsent(key, this::readSignature);
    }

    public List<String> getWarnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    private Optional<Baseline> read(DimensionKey key) {
        try {
            Optional<Baseline> baseline = delegate.get(key);
            return baseline != null ? baseline : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Baseline lookup failed for {}: {}", key, e.getMessage());
            warnings.add(String.format("Baseline unavailable for %s (%s); treated as missing", key, e.getMessage()));
            return Optional.empty();
        }
    }

    // An unreadable history must not turn into a NEW_SIGNATURE claim.
    private Boolean readSignature(DimensionKey key) {
        try {
            return delegate.knowsSignature(key);
        } catch (RuntimeException e) {
            log.warn("Signature history lookup failed for {}: {}", key, e.getMessage());
            warnings.add(String.format("Signature history unavailable for %s (%s); not flagged as new", key, e.getMessage()));
            return Boolean.TRUE;
        }
    }
}
