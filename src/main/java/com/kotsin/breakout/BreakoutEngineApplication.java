package com.kotsin.breakout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Intraday breakout engine: consumes bars, order flow and fills from Kafka, decides entries and
 * exits per symbol, and keeps session state in Redis.
 */
@SpringBootApplication
@EnableKafka
@EnableScheduling
public class BreakoutEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BreakoutEngineApplication.class, args);
    }
}
