package com.kotsin.breakout.audit;

import com.kotsin.breakout.position.ClosedTrade;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Closed-trade archive in MongoDB.
 */
@Repository
public interface ClosedTradeRepository extends MongoRepository<ClosedTrade, String> {

    List<ClosedTrade> findBySessionDateOrderByExitTimeAsc(LocalDate sessionDate);

    List<ClosedTrade> findBySymbolOrderByExitTimeDesc(String symbol);

    @Query("{ 'realizedPnl': { $gt: 0 }, 'sessionDate': ?0 }")
    List<ClosedTrade> findWinners(LocalDate sessionDate);

    long countBySessionDate(LocalDate sessionDate);
}
