package com.guno.salesintel.scheduler;

import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.collector.SourceCollectorRegistry;
import com.guno.salesintel.config.CollectorProperties;
import com.guno.salesintel.engine.MultiSourceData;
import com.guno.salesintel.service.DataSourceOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * WatchlistRefreshScheduler - keeps profile data of watched companies warm in cache
 *
 * Disabled unless {@code watchlist.enabled=true}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WatchlistRefreshScheduler {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DataSourceOrchestrator orchestrator;
    private final SourceCollectorRegistry collectorRegistry;
    private final CollectorProperties collectorProperties;

    @Value("${watchlist.enabled:false}")
    private boolean enabled;

    @Value("${watchlist.companies:}")
    private List<String> companies;

    // ================================
    // STARTUP
    // ================================

    @EventListener(ApplicationReadyEvent.class)
    public void logStartupConfiguration() {
        log.info("Registered collectors: {}", collectorRegistry.supportedSources());
        log.info("Enabled HTTP endpoints: {}", collectorProperties.getEnabledSources());
        log.info("Watchlist refresh: {} ({} companies)", enabled ? "ENABLED" : "DISABLED", watchedCompanies().size());
    }

    // ================================
    // SCHEDULED REFRESH
    // ================================

    @Scheduled(cron = "${watchlist.cron:0 0 3 * * *}")
    public void scheduledRefresh() {
        if (!enabled) {
            return;
        }
        refreshWatchlist();
    }

    /**
     * @return number of companies refreshed without error
     */
    public int refreshWatchlist() {
        List<String> targets = watchedCompanies();
        log.info("Watchlist refresh started at {} - {} companies",
                LocalDateTime.now().format(TIME_FORMATTER), targets.size());

        int refreshed = 0;
        double totalCost = 0;
        for (String company : targets) {
            try {
                MultiSourceData data = orchestrator.getMultiSourceData(company, ConsumerType.PROFILE);
                totalCost += data.getTotalNewCost();
                refreshed++;
                log.info("Refreshed '{}' - cache hits: {}, new calls: {}, cost: ${}",
                        company, data.getCacheHits(), data.getNewApiCalls(), data.getTotalNewCost());
            } catch (Exception e) {
                log.error("❌ Watchlist refresh failed for '{}': {}", company, e.getMessage(), e);
            }
        }

        log.info("Watchlist refresh completed - {}/{} companies, total cost: ${}", refreshed, targets.size(), totalCost);
        return refreshed;
    }

    private List<String> watchedCompanies() {
        if (companies == null) {
            return List.of();
        }
        return companies.stream().filter(c -> c != null && !c.isBlank()).map(String::trim).toList();
    }
}
