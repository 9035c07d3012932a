package com.extrophi.token_ledger.reporting;

import com.extrophi.token_ledger.ledger.AccountService;
import com.extrophi.token_ledger.ledger.AwardCommand;
import com.extrophi.token_ledger.ledger.LedgerEntry;
import com.extrophi.token_ledger.ledger.LedgerErrorKind;
import com.extrophi.token_ledger.ledger.TokenLedgerService;
import com.extrophi.token_ledger.ledger.TransactionKind;
import com.extrophi.token_ledger.ledger.TransferCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * History paging and account statistics.
 */
@SpringBootTest
@Testcontainers
class TokenReportingServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("token_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("ledger.idempotency.redis-enabled", () -> "false");
        registry.add("ledger.reconciliation.enabled", () -> "false");
    }

    @Autowired
    private TokenReportingService reportingService;

    @Autowired
    private TokenLedgerService tokenLedgerService;

    @Autowired
    private AccountService accountService;

    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        alice = UUID.randomUUID();
        bob = UUID.randomUUID();
        accountService.createAccount(alice);
        accountService.createAccount(bob);
    }

    private void award(UUID accountId, String amount, String reason) {
        tokenLedgerService.award(AwardCommand.builder()
                .toAccountId(accountId)
                .amount(new BigDecimal(amount))
                .reason(reason)
                .build())
            .orElseThrow();
    }

    private void transfer(UUID from, UUID to, String amount, UUID attributionId) {
        tokenLedgerService.transfer(TransferCommand.builder()
                .fromAccountId(from)
                .toAccountId(to)
                .amount(new BigDecimal(amount))
                .reason("move")
                .attributionId(attributionId)
                .build())
            .orElseThrow();
    }

    @Test
    @DisplayName("History is newest first and pages without overlap")
    void testHistoryPaging() {
        for (int i = 1; i <= 5; i++) {
            award(alice, String.valueOf(i), "award " + i);
        }

        List<LedgerEntry> firstPage = reportingService.history(alice, 2, 0, null).orElseThrow();
        List<LedgerEntry> secondPage = reportingService.history(alice, 2, 2, null).orElseThrow();
        List<LedgerEntry> lastPage = reportingService.history(alice, 2, 4, null).orElseThrow();

        assertEquals(List.of("award 5", "award 4"), firstPage.stream().map(LedgerEntry::getReason).toList());
        assertEquals(List.of("award 3", "award 2"), secondPage.stream().map(LedgerEntry::getReason).toList());
        assertEquals(List.of("award 1"), lastPage.stream().map(LedgerEntry::getReason).toList());
        assertTrue(reportingService.history(alice, 2, 10, null).orElseThrow().isEmpty());
    }

    @Test
    @DisplayName("History filter returns only the requested kind, from either side")
    void testHistoryKindFilter() {
        award(alice, "10", "publish");
        transfer(alice, bob, "3", null);
        transfer(bob, alice, "1", UUID.randomUUID());

        List<LedgerEntry> transfers = reportingService.history(bob, 10, 0, TransactionKind.TRANSFER).orElseThrow();
        List<LedgerEntry> attributions = reportingService.history(bob, 10, 0, TransactionKind.ATTRIBUTION).orElseThrow();
        List<LedgerEntry> earns = reportingService.history(bob, 10, 0, TransactionKind.EARN).orElseThrow();

        assertEquals(1, transfers.size());
        assertEquals(bob, transfers.get(0).getToAccountId());
        assertEquals(1, attributions.size());
        assertEquals(bob, attributions.get(0).getFromAccountId());
        assertTrue(earns.isEmpty());
    }

    @Test
    @DisplayName("Stats agree with balance, totals and per-kind counts")
    void testStats() {
        // Given
        award(alice, "10", "publish");
        transfer(alice, bob, "3", null);
        transfer(bob, alice, "1", UUID.randomUUID());

        // When
        TokenStats stats = reportingService.stats(alice).orElseThrow();

        // Then
        assertEquals(new BigDecimal("8.00000000"), stats.getBalance());
        assertEquals(new BigDecimal("11.00000000"), stats.getTotalEarned());
        assertEquals(new BigDecimal("3.00000000"), stats.getTotalSpent());
        assertEquals(new BigDecimal("8.00000000"), stats.getNetChange());
        assertEquals(1L, stats.getTransactionCounts().get(TransactionKind.EARN));
        assertEquals(1L, stats.getTransactionCounts().get(TransactionKind.TRANSFER));
        assertEquals(1L, stats.getTransactionCounts().get(TransactionKind.ATTRIBUTION));
        assertEquals(3L, stats.getTotalTransactions());
    }

    @Test
    @DisplayName("New account has zero stats with every kind present")
    void testStatsForNewAccount() {
        TokenStats stats = reportingService.stats(bob).orElseThrow();

        assertEquals(0, stats.getBalance().signum());
        assertEquals(new BigDecimal("0.00000000"), stats.getTotalEarned());
        assertEquals(3, stats.getTransactionCounts().size());
        assertEquals(0L, stats.getTotalTransactions());
    }

    @Test
    @DisplayName("Unknown account is ACCOUNT_NOT_FOUND for history and stats")
    void testUnknownAccount() {
        UUID ghost = UUID.randomUUID();

        assertEquals(LedgerErrorKind.ACCOUNT_NOT_FOUND,
            reportingService.history(ghost, 10, 0, null).getError().getKind());
        assertEquals(LedgerErrorKind.ACCOUNT_NOT_FOUND,
            reportingService.stats(ghost).getError().getKind());
    }

    @Test
    @DisplayName("Limit outside 1..500 and negative offset are rejected")
    void testInvalidPaging() {
        assertThrows(IllegalArgumentException.class, () -> reportingService.history(alice, 0, 0, null));
        assertThrows(IllegalArgumentException.class, () -> reportingService.history(alice, 501, 0, null));
        assertThrows(IllegalArgumentException.class, () -> reportingService.history(alice, 10, -1, null));
        assertTrue(reportingService.history(alice, 500, 0, null).isSuccess());
    }
}
