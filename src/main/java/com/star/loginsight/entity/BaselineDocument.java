package com.star.loginsight.entity;

import com.star.loginsight.model.Baseline;
import com.star.loginsight.model.DimensionKey;
import com.star.loginsight.model.MetricKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.DateFormat;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = "loginsight-baselines")
public class BaselineDocument {

    @Id
    private String id;  // dimension key, "service|severity|signature"

    @Field(type = FieldType.Keyword)
    private String service;

    @Field(type = FieldType.Keyword)
    private String severity;

    @Field(type = FieldType.Keyword)
    private String errorSignature;

    @Field(type = FieldType.Double)
    private Double expected;

    @Field(type = FieldType.Double)
    private Double variability;

    @Field(type = FieldType.Keyword)
    private MetricKind metric;

    @Field(type = FieldType.Date, format = {DateFormat.date_time, DateFormat.epoch_millis})
    private Instant updatedAt;

    public DimensionKey toKey() {
        return DimensionKey.of(service, severity, errorSignature);
    }

    public Baseline toBaseline() {
        return Baseline.of(
                expected != null ? expected : 0.0,
                variability != null ? variability : 0.0,
                metric != null ? metric : MetricKind.COUNT);
    }
}
