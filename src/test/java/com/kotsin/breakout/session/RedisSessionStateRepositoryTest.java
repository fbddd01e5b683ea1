package com.kotsin.breakout.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.breakout.model.SetupType;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.position.OrderPurpose;
import com.kotsin.breakout.position.PendingOrder;
import com.kotsin.breakout.position.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisSessionStateRepositoryTest {

    private static final LocalDate SESSION = LocalDate.of(2024, 3, 15);
    private static final String KEY = "breakout:session:2024-03-15";
    private static final String BACKUP = "breakout:session:2024-03-15:backup";

    @Mock
    private RedisTemplate<String, String> redis;
    @Mock
    private ValueOperations<String, String> values;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private RedisSessionStateRepository repository;

    @BeforeEach
    void setUp() {
        lenient().when(redis.opsForValue()).thenReturn(values);
        repository = new RedisSessionStateRepository(redis, mapper);
    }

    private SessionSnapshot snapshot() {
        Instant entry = Instant.parse("2024-03-15T14:00:00Z");
        Position position = Position.builder()
                .symbol("AAPL").side(Side.LONG).setupType(SetupType.MOMENTUM).pivotKey("AAPL_100.00")
                .pivotPrice(100).entryPrice(100.5).entryTime(entry).entryOrderId("AAPL-ENT-1")
                .shares(199).remainingShares(99).stopPrice(100.5).initialStopPrice(100)
                .stopOrderId("AAPL-STP-2").highestPrice(100.8).lowestPrice(100.5).nextPartialLevel(1)
                .build();
        PendingOrder pending = PendingOrder.builder()
                .clientOrderId("MSFT-ENT-3").symbol("MSFT").purpose(OrderPurpose.ENTRY).side(Side.SHORT)
                .shares(40).referencePrice(399.0).submittedAt(entry).build();
        return SessionSnapshot.builder()
                .sessionDate(SESSION)
                .savedAt(entry)
                .positions(List.of(position))
                .pendingOrders(List.of(pending))
                .attemptCounts(Map.of("AAPL_100.00", 1))
                .lastLogicalPositions(Map.of("AAPL", 812L))
                .build();
    }

    @Test
    @DisplayName("Keys are scoped by session date")
    void keys() {
        assertEquals(KEY, RedisSessionStateRepository.key(SESSION));
        assertEquals(BACKUP, RedisSessionStateRepository.backupKey(SESSION));
    }

    @Test
    @DisplayName("Saving copies the previous snapshot to the backup key first")
    void saveKeepsBackup() {
        when(values.get(KEY)).thenReturn("{\"sessionDate\":\"2024-03-15\"}");

        repository.save(snapshot());

        verify(values).set(BACKUP, "{\"sessionDate\":\"2024-03-15\"}", Duration.ofDays(7));
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(values).set(eq(KEY), json.capture(), eq(Duration.ofDays(7)));
        assertTrue(json.getValue().contains("AAPL-STP-2"));
    }

    @Test
    @DisplayName("The first save of a session writes no backup")
    void firstSaveHasNoBackup() {
        when(values.get(KEY)).thenReturn(null);
        repository.save(snapshot());
        verify(values, never()).set(eq(BACKUP), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("A saved snapshot loads back with positions, pending orders and counters")
    void roundTrip() throws Exception {
        when(values.get(KEY)).thenReturn(mapper.writeValueAsString(snapshot()));

        SessionSnapshot loaded = repository.load(SESSION).orElseThrow();
        Position p = loaded.getPositions().get(0);
        assertEquals(99, p.getRemainingShares());
        assertEquals(100.5, p.getStopPrice());
        assertEquals(1, p.getNextPartialLevel());
        assertEquals(OrderPurpose.ENTRY, loaded.getPendingOrders().get(0).getPurpose());
        assertEquals(812L, loaded.getLastLogicalPositions().get("AAPL"));
        assertEquals(1, loaded.getAttemptCounts().get("AAPL_100.00"));
    }

    @Test
    @DisplayName("An unreadable primary falls back to the backup snapshot")
    void fallsBackToBackup() throws Exception {
        when(values.get(KEY)).thenReturn("{\"sessionDate\":");
        when(values.get(BACKUP)).thenReturn(mapper.writeValueAsString(snapshot()));

        Optional<SessionSnapshot> loaded = repository.load(SESSION);
        assertTrue(loaded.isPresent());
        assertEquals("AAPL", loaded.get().getPositions().get(0).getSymbol());
    }

    @Test
    @DisplayName("Nothing stored means no snapshot")
    void missing() {
        when(values.get(anyString())).thenReturn(null);
        assertTrue(repository.load(SESSION).isEmpty());
    }
}
