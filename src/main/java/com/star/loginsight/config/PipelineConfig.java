package com.star.loginsight.config;

import com.star.loginsight.aggregation.Aggregator;
import com.star.loginsight.detection.AnomalyDetector;
import com.star.loginsight.hypothesis.HypothesisEngine;
import com.star.loginsight.parser.EventParser;
import com.star.loginsight.parser.SignatureClassifier;
import com.star.loginsight.parser.TimestampParser;
import com.star.loginsight.pipeline.AnalysisPipeline;
import com.star.loginsight.processor.LogLineReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(InsightProperties.class)
public class PipelineConfig {

    @Value("${app.file.max-line-length:100000}")
    private int maxLineLength;

    @Value("${app.file.max-lines:1000000}")
    private long maxLines;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "parseExecutor")
    public ThreadPoolTaskExecutor parseExecutor(InsightProperties properties) {
        int threads = Math.max(1, properties.getParser().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("parse-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public EventParser eventParser(InsightProperties properties,
                                   @Qualifier("parseExecutor") ThreadPoolTaskExecutor parseExecutor) {
        return EventParser.builder()
                .timestampParser(new TimestampParser(ZoneId.of(properties.getTimeZone())))
                .signatureClassifier(new SignatureClassifier(properties.toSignatureRules()))
                .executor(parseExecutor)
                .chunkSize(properties.getParser().getChunkSize())
                .maxLineLength(properties.getParser().getMaxLineLength())
                .build();
    }

    @Bean
    public AnalysisPipeline analysisPipeline(EventParser eventParser, Clock clock) {
        return new AnalysisPipeline(eventParser, new Aggregator(), new AnomalyDetector(),
                new HypothesisEngine(), clock);
    }

    @Bean
    public LogLineReader logLineReader(Clock clock) {
        return LogLineReader.builder()
                .maxLineLength(maxLineLength)
                .maxLines(maxLines)
                .clock(clock)
                .build();
    }
}
