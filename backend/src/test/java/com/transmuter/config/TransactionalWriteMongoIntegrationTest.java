package com.transmuter.config;

import com.transmuter.domain.CollateralRepository;
import com.transmuter.domain.TokenBalance;
import com.transmuter.domain.TokenBalanceRepository;
import com.transmuter.domain.TransmuterLedger;
import com.transmuter.domain.TransmuterLedgerRepository;
import com.transmuter.integration.BalanceBookTokenGateway;
import com.transmuter.state.TransmuterStateStore;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * State writes against a single-node replica set, where balance and ledger documents commit together.
 */
@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class TransactionalWriteMongoIntegrationTest {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100_000_000);

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    TransmuterLedgerRepository ledgerRepository;
    @Autowired
    CollateralRepository collateralRepository;
    @Autowired
    TokenBalanceRepository tokenBalanceRepository;
    @Autowired
    TransactionTemplate transactionTemplate;
    @Autowired
    MongoTemplate mongoTemplate;

    private TransmuterStateStore store;
    private BalanceBookTokenGateway gateway;

    @BeforeEach
    void setUp() {
        ledgerRepository.deleteAll();
        tokenBalanceRepository.deleteAll();
        store = new TransmuterStateStore(ledgerRepository, collateralRepository, transactionTemplate);
        store.initialize("agEUR", List.of("0xkeeper"));
        gateway = new BalanceBookTokenGateway(tokenBalanceRepository, "agEUR", "reserve");
    }

    @Test
    @DisplayName("a committed write stores balances as decimal strings")
    void committedWritePersistsBalance() {
        store.write(state -> {
            gateway.deposit("EUROC", "0xalice", HUNDRED);
            return null;
        });

        assertThat(gateway.balanceOf("EUROC", "0xalice")).isEqualTo(HUNDRED);
        Document raw = mongoTemplate.getCollection("token_balances")
                .find(new Document("_id", TokenBalance.idOf("EUROC", "0xalice"))).first();
        assertThat(raw).isNotNull();
        assertThat(raw.get("balance")).isEqualTo("100000000");
    }

    @Test
    @DisplayName("a write failing after a token movement rolls back the balances and the ledger")
    void failedWriteRollsBackEverything() {
        store.write(state -> {
            gateway.deposit("EUROC", "0xalice", HUNDRED);
            return null;
        });

        assertThatThrownBy(() -> store.write(state -> {
            gateway.transfer("EUROC", "0xalice", "reserve", HUNDRED);
            state.ledger().getTrusted().add("0xintruder");
            throw new IllegalStateException("settlement aborted");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(gateway.balanceOf("EUROC", "0xalice")).isEqualTo(HUNDRED);
        assertThat(gateway.balanceOf("EUROC", "reserve")).isZero();
        TransmuterLedger ledger = ledgerRepository.findById(TransmuterLedger.SINGLETON_ID).orElseThrow();
        assertThat(ledger.getTrusted()).containsExactly("0xkeeper");
    }
}
