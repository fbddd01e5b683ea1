package com.kotsin.breakout.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.breakout.position.PendingOrder;
import com.kotsin.breakout.position.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.Set;

/**
 * Everything needed to resume a session after a restart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionSnapshot {

    private LocalDate sessionDate;
    private Instant savedAt;

    @Builder.Default
    private List<Position> positions = new ArrayList<>();
    // pivot key -> entries filled on that pivot
    @Builder.Default
    private Map<String, Integer> attemptCounts = new HashMap<>();
    @Builder.Default
    private Map<String, Long> lastLogicalPositions = new HashMap<>();
    // symbol -> open time of the last accepted bar, so ordering holds across a restart
    @Builder.Default
    private Map<String, Instant> lastOpenTimes = new HashMap<>();
    @Builder.Default
    private List<PendingOrder> pendingOrders = new ArrayList<>();
    @Builder.Default
    private Set<String> haltedSymbols = new TreeSet<>();
}
