package com.star.loginsight.service;

import com.star.loginsight.detection.BaselineLookup;
import com.star.loginsight.detection.InMemoryBaselineLookup;
import com.star.loginsight.dto.BaselineRequest;
import com.star.loginsight.entity.BaselineDocument;
import com.star.loginsight.exception.ConfigException;
import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.MetricKind;
import com.star.loginsight.repository.BaselineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stored baselines in Elasticsearch. Every analysis reads one full snapshot, so
 * concurrent replacement never mixes two baseline generations within a run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BaselineService {

    private final BaselineRepository baselineRepository;
    private final Clock clock;

    public BaselineLookup snapshot() {
        Map<DimensionKey, Baseline> entries = new HashMap<>();
        for (BaselineDocument document : baselineRepository.findAll()) {
            entries.put(document.toKey(), document.toBaseline());
        }
        log.debug("Loaded baseline snapshot with {} entries", entries.size());
        return new InMemoryBaselineLookup(entries);
    }

    public List<BaselineDocument> findAll() {
        List<BaselineDocument> documents = new ArrayList<>();
        baselineRepository.findAll().forEach(documents::add);
        documents.sort(Comparator.comparing(BaselineDocument::getId));
        return documents;
    }

    public List<BaselineDocument> findByService(String service) {
        List<BaselineDocument> documents = new ArrayList<>(baselineRepository.findByService(service));
        documents.sort(Comparator.comparing(BaselineDocument::getId));
        return documents;
    }

    /**
     * Replaces every stored baseline.
     *
     * @throws ConfigException if two entries share a dimension key
     */
    public List<BaselineDocument> replaceAll(List<BaselineRequest> requests) {
        Instant now = clock.instant();
        Map<String, BaselineDocument> documents = new LinkedHashMap<>();
        for (BaselineRequest request : requests) {
            BaselineDocument document = toDocument(request, now);
            if (documents.putIfAbsent(document.getId(), document) != null) {
                throw ConfigException.invalidField("baselines", document.getId(), "duplicate dimension key");
            }
        }

        baselineRepository.deleteAll();
        baselineRepository.saveAll(documents.values());

        log.info("Replaced baselines with {} entries", documents.size());
        return findAll();
    }

    private BaselineDocument toDocument(BaselineRequest request, Instant updatedAt) {
        if (!Double.isFinite(request.getExpected()) || !Double.isFinite(request.getVariability())) {
            throw ConfigException.invalidField("baselines", request, "expected and variability must be finite");
        }
        DimensionKey key = DimensionKey.of(request.getService().trim(), slot(request.getSeverity()),
                slot(request.getErrorSignature()));
        return BaselineDocument.builder()
                .id(key.asString())
                .service(key.getService())
                .severity(key.getSeverity())
                .errorSignature(key.getErrorSignature())
                .expected(request.getExpected())
                .variability(request.getVariability())
                .metric(request.getMetric() != null ? request.getMetric() : MetricKind.COUNT)
                .updatedAt(updatedAt)
                .build();
    }

    // Severities and signatures are stored upper-case, as the parser emits them.
    private static String slot(String value) {
        return value == null || value.isBlank() ? DimensionKey.WILDCARD : value.trim().toUpperCase(Locale.ROOT);
    }
}
