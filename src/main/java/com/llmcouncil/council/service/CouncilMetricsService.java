package com.llmcouncil.council.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class CouncilMetricsService {

    private final AtomicLong modelRequestCount = new AtomicLong();
    private final AtomicLong modelFailureCount = new AtomicLong();
    private final AtomicLong turnCount = new AtomicLong();
    private final AtomicLong unparsedRankingCount = new AtomicLong();

    public void recordModelRequest(String purpose, String model) {
        long count = modelRequestCount.incrementAndGet();
        log.debug("Model request #{} sent (purpose={}, model={}).", count, purpose, model);
    }

    public void recordModelFailure(String purpose, String model, String reason) {
        long failures = modelFailureCount.incrementAndGet();
        log.warn("Model {} failed during {}: {}. Total failures={}.", model, purpose, reason, failures);
    }

    public void recordStage(String stage, int dispatched, int succeeded) {
        log.info("{} settled: {}/{} models succeeded.", stage, succeeded, dispatched);
    }

    public void recordUnparsedRanking(String model) {
        long unparsed = unparsedRankingCount.incrementAndGet();
        log.info("Ranking from {} contained no recognizable labels. Total unparsed={}.", model, unparsed);
    }

    public void recordTurnStarted() {
        turnCount.incrementAndGet();
    }

    public void logSummary() {
        log.info("Council stats: turns={}, modelRequests={}, modelFailures={}, unparsedRankings={}.",
                turnCount.get(), modelRequestCount.get(), modelFailureCount.get(), unparsedRankingCount.get());
    }
}
