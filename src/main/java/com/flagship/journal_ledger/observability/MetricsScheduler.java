package com.flagship.journal_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need database queries, so scrapes stay cheap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PostingQueueMetrics postingQueueMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        outboxMetrics.refreshMetrics();
        postingQueueMetrics.refreshMetrics();
    }
}
