package com.kotsin.breakout.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.engine.BreakoutEngine;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.position.DailySummary;
import com.kotsin.breakout.session.ReconciliationReport;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Starts the live session once the context is up, rolls it over when the trading date changes,
 * and flushes state on shutdown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LiveSessionRunner {

    private final BreakoutEngine liveEngine;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;

    @Value("${pivots.file:}")
    private String pivotsFile;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        startSession(LocalDate.now(properties.zone()));
    }

    @Scheduled(fixedDelayString = "${engine-status.log-interval-ms:60000}")
    public void statusAndRollover() {
        LocalDate today = LocalDate.now(properties.zone());
        LocalDate current = liveEngine.getSessionDate();
        if (current != null && today.isAfter(current)) {
            log.info("Trading date changed {} -> {}, starting a new session", current, today);
            startSession(today);
            return;
        }
        DailySummary summary = liveEngine.positionManager().dailySummary();
        log.info("Engine status: session={} entriesEnabled={} ticks={} rejected={} open={} trades={} netPnl={}",
                current, liveEngine.isEntriesEnabled(), liveEngine.getTicksProcessed(),
                liveEngine.getTicksRejected(), liveEngine.positionManager().positions().size(),
                summary.trades(), String.format(Locale.ROOT, "%.2f", summary.netPnl()));
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down live engine for session {}", liveEngine.getSessionDate());
        liveEngine.shutdown();
    }

    void startSession(LocalDate date) {
        List<PivotLevel> pivots = loadPivots();
        try {
            ReconciliationReport report = liveEngine.startSession(date, pivots);
            if (!report.isClean()) {
                log.warn("Session {} started with halted symbols {}", date, report.haltedSymbols());
            }
        } catch (RuntimeException e) {
            // entries stay disabled until a restart retries the session start
            log.error("Failed to start session {}: {}", date, e.getMessage(), e);
        }
    }

    List<PivotLevel> loadPivots() {
        if (StringUtils.isBlank(pivotsFile)) {
            log.warn("pivots.file not set; session starts with an empty watchlist");
            return List.of();
        }
        try {
            List<PivotLevel> pivots = objectMapper.readValue(Files.readString(Path.of(pivotsFile)),
                    new TypeReference<List<PivotLevel>>() { });
            log.info("Loaded {} pivots from {}", pivots.size(), pivotsFile);
            return pivots;
        } catch (IOException e) {
            log.error("Could not read pivots from {}: {}", pivotsFile, e.getMessage());
            return List.of();
        }
    }
}
