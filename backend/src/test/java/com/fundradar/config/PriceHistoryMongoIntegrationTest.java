package com.fundradar.config;

import com.fundradar.domain.HighWaterMark;
import com.fundradar.domain.HighWaterMarkRepository;
import com.fundradar.domain.PriceBar;
import com.fundradar.domain.PriceBarRepository;
import com.fundradar.timeseries.PriceBarStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import({MongoConfig.class, PriceBarStore.class})
class PriceHistoryMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    @Autowired
    PriceBarStore priceBarStore;

    @Autowired
    PriceBarRepository priceBarRepository;

    @Autowired
    HighWaterMarkRepository highWaterMarkRepository;

    private static PriceBar bar(String symbol, LocalDate date, String close) {
        PriceBar b = new PriceBar();
        b.setSymbol(symbol);
        b.setDate(date);
        b.setClose(new BigDecimal(close));
        b.setAdjClose(new BigDecimal(close));
        return b;
    }

    @Test
    @DisplayName("bulk upsert is idempotent and keeps Decimal128 precision")
    void upsertIsIdempotent() {
        LocalDate d1 = LocalDate.of(2024, 1, 2);
        LocalDate d2 = LocalDate.of(2024, 1, 3);
        List<PriceBar> bars = List.of(bar("VALE3.SA", d1, "68.123456789012345678"), bar("VALE3.SA", d2, "67.90"));

        assertThat(priceBarStore.upsert(bars)).isEqualTo(2);
        assertThat(priceBarStore.upsert(List.of(bar("VALE3.SA", d1, "68.123456789012345678"),
                bar("VALE3.SA", d2, "67.90")))).isZero();

        List<PriceBar> read = priceBarRepository.findInRange("VALE3.SA", d1, d2);
        assertThat(read).hasSize(2);
        assertThat(read.get(0).getClose()).isEqualByComparingTo("68.123456789012345678");
        assertThat(priceBarRepository.findFirstBySymbolAndDateLessThanEqualOrderByDateDesc("VALE3.SA", d2.plusDays(5)))
                .hasValueSatisfying(b -> assertThat(b.getDate()).isEqualTo(d2));
    }

    @Test
    @DisplayName("stale high-water mark save fails with optimistic locking")
    void highWaterMarkIsVersioned() {
        HighWaterMark hwm = new HighWaterMark();
        hwm.setPortfolioId("fund-versioned");
        hwm.raiseTo(new BigDecimal("1000000"), LocalDate.of(2024, 1, 1), Instant.now());
        highWaterMarkRepository.save(hwm);

        HighWaterMark first = highWaterMarkRepository.findById("fund-versioned").orElseThrow();
        HighWaterMark second = highWaterMarkRepository.findById("fund-versioned").orElseThrow();
        first.raiseTo(new BigDecimal("1100000"), LocalDate.of(2024, 6, 30), Instant.now());
        highWaterMarkRepository.save(first);
        second.raiseTo(new BigDecimal("1050000"), LocalDate.of(2024, 6, 30), Instant.now());

        assertThatThrownBy(() -> highWaterMarkRepository.save(second))
                .isInstanceOf(OptimisticLockingFailureException.class);
        assertThat(highWaterMarkRepository.findById("fund-versioned").orElseThrow().getValue())
                .isEqualByComparingTo("1100000");
    }

    @Test
    @DisplayName("price_history unique index is created")
    void indexesCreated() {
        List<String> names = mongoTemplate.indexOps(PriceBar.class).getIndexInfo().stream()
                .map(IndexInfo::getName).toList();

        assertThat(names).contains("symbol_date_unique");
    }
}
