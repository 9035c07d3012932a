package com.extrophi.token_ledger.ledger;

import com.extrophi.token_ledger.attribution.AttributionEvent;
import com.extrophi.token_ledger.attribution.AttributionRewardResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger behaviour against a real PostgreSQL.
 *
 * These tests verify that:
 * - Awards and transfers move exact amounts and record the resulting balances
 * - Refusals leave balances and the ledger untouched
 * - Ledger entries cannot be changed or removed
 * - Idempotency keys replay the original outcome
 */
@SpringBootTest
@Testcontainers
class TokenLedgerServiceTest {

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
        // Disable Kafka, Redis and the reconciliation job for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("ledger.idempotency.redis-enabled", () -> "false");
        registry.add("ledger.reconciliation.enabled", () -> "false");
    }

    @Autowired
    private TokenLedgerService tokenLedgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerRepository ledgerRepository;

    @Autowired
    private AttributionRewardResolver attributionRewardResolver;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        alice = UUID.randomUUID();
        bob = UUID.randomUUID();
        accountService.createAccount(alice);
        accountService.createAccount(bob);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private AwardResult award(UUID accountId, String amount) {
        return tokenLedgerService.award(AwardCommand.builder()
                .toAccountId(accountId)
                .amount(new BigDecimal(amount))
                .reason("publish")
                .build())
            .orElseThrow();
    }

    private LedgerResult<TransferResult> transfer(UUID from, UUID to, String amount, String reason) {
        return tokenLedgerService.transfer(TransferCommand.builder()
            .fromAccountId(from)
            .toAccountId(to)
            .amount(new BigDecimal(amount))
            .reason(reason)
            .build());
    }

    private BigDecimal balanceOf(UUID accountId) {
        return accountService.getBalance(accountId).orElseThrow();
    }

    private int entryCount(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE from_account_id = ? OR to_account_id = ?",
            Integer.class, accountId, accountId);
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("Award credits the account and records one EARN entry")
    void testAwardCreditsAccount() {
        printTestHeader("Award - Credits Account");

        // When
        AwardResult result = award(alice, "1.0");

        // Then
        assertEquals(new BigDecimal("1.00000000"), result.getNewBalance());
        assertEquals(new BigDecimal("1.00000000"), balanceOf(alice));

        List<LedgerEntry> entries = ledgerRepository.history(alice, 10, 0, null);
        assertEquals(1, entries.size());
        LedgerEntry entry = entries.get(0);
        assertEquals(TransactionKind.EARN, entry.getKind());
        assertNull(entry.getFromAccountId());
        assertNull(entry.getFromBalanceAfter());
        assertEquals(new BigDecimal("1.00000000"), entry.getToBalanceAfter());

        printSuccess("Award recorded with balance " + result.getNewBalance());
    }

    @Test
    @DisplayName("Transfer moves the amount and records both resulting balances")
    void testTransferMovesAmount() {
        printTestHeader("Transfer - Moves Amount");

        // Given
        award(alice, "1.0");

        // When
        TransferResult result = transfer(alice, bob, "0.1", "citation").orElseThrow();

        // Then
        assertEquals(new BigDecimal("0.90000000"), result.getFromBalance());
        assertEquals(new BigDecimal("0.10000000"), result.getToBalance());
        assertEquals(new BigDecimal("0.90000000"), balanceOf(alice));
        assertEquals(new BigDecimal("0.10000000"), balanceOf(bob));

        LedgerEntry entry = ledgerRepository.findById(result.getTransactionId()).orElseThrow();
        assertEquals(TransactionKind.TRANSFER, entry.getKind());
        assertEquals(new BigDecimal("0.90000000"), entry.getFromBalanceAfter());
        assertEquals(new BigDecimal("0.10000000"), entry.getToBalanceAfter());

        printSuccess("Transfer recorded: " + entry.getId());
    }

    @Test
    @DisplayName("Insufficient balance is refused and nothing changes")
    void testInsufficientBalance() {
        printTestHeader("Transfer - Insufficient Balance");

        // Given
        award(alice, "0.01");
        int entriesBefore = entryCount(alice);

        // When
        LedgerResult<TransferResult> result = transfer(alice, bob, "0.1", "citation");

        // Then
        assertTrue(result.isFailure());
        LedgerError error = result.getError();
        assertEquals(LedgerErrorKind.INSUFFICIENT_BALANCE, error.getKind());
        assertEquals("0.01000000", error.getDetails().get("available"));
        assertEquals("0.10000000", error.getDetails().get("required"));
        assertEquals(new BigDecimal("0.01000000"), balanceOf(alice));
        assertEquals(new BigDecimal("0.00000000"), balanceOf(bob));
        assertEquals(entriesBefore, entryCount(alice));

        printSuccess("Refused: " + error.getMessage());
    }

    @Test
    @DisplayName("Self transfer is refused")
    void testSelfTransfer() {
        award(alice, "5");

        LedgerResult<TransferResult> result = transfer(alice, alice, "1.0", "x");

        assertEquals(LedgerErrorKind.SELF_TRANSFER, result.getError().getKind());
        assertEquals(new BigDecimal("5.00000000"), balanceOf(alice));
    }

    @Test
    @DisplayName("Invalid amount wins over self transfer, self transfer wins over missing account")
    void testPreconditionOrder() {
        UUID ghost = UUID.randomUUID();

        assertEquals(LedgerErrorKind.INVALID_AMOUNT,
            transfer(ghost, ghost, "0", "x").getError().getKind());
        assertEquals(LedgerErrorKind.INVALID_AMOUNT,
            transfer(ghost, ghost, "-1", "x").getError().getKind());
        assertEquals(LedgerErrorKind.SELF_TRANSFER,
            transfer(ghost, ghost, "1", "x").getError().getKind());
        assertEquals(LedgerErrorKind.ACCOUNT_NOT_FOUND,
            transfer(ghost, bob, "1", "x").getError().getKind());
        assertEquals(LedgerErrorKind.ACCOUNT_NOT_FOUND,
            transfer(alice, ghost, "1", "x").getError().getKind());
        assertEquals(LedgerErrorKind.INSUFFICIENT_BALANCE,
            transfer(alice, bob, "1", "x").getError().getKind());
    }

    @Test
    @DisplayName("More than 8 decimals is refused, never rounded")
    void testOverPreciseAmount() {
        LedgerResult<AwardResult> result = tokenLedgerService.award(AwardCommand.builder()
            .toAccountId(alice)
            .amount(new BigDecimal("0.000000001"))
            .reason("publish")
            .build());

        assertEquals(LedgerErrorKind.INVALID_AMOUNT, result.getError().getKind());
        assertEquals(new BigDecimal("0.00000000"), balanceOf(alice));
        assertEquals(0, entryCount(alice));
    }

    @Test
    @DisplayName("Award to an unknown account is refused")
    void testAwardUnknownAccount() {
        UUID ghost = UUID.randomUUID();

        LedgerResult<AwardResult> result = tokenLedgerService.award(AwardCommand.builder()
            .toAccountId(ghost)
            .amount(BigDecimal.ONE)
            .reason("publish")
            .build());

        assertEquals(LedgerErrorKind.ACCOUNT_NOT_FOUND, result.getError().getKind());
        assertEquals(ghost.toString(), result.getError().getDetails().get("account_id"));
        assertFalse(accountService.exists(ghost));
    }

    @Test
    @DisplayName("Repeated small awards sum exactly")
    void testNoRoundingDrift() {
        printTestHeader("Award - No Rounding Drift");

        for (int i = 0; i < 3; i++) {
            award(alice, "0.33333333");
        }

        assertEquals(new BigDecimal("0.99999999"), balanceOf(alice));
        printSuccess("Balance is exactly " + balanceOf(alice));
    }

    @Test
    @DisplayName("Metadata and attribution reference are stored with the entry")
    void testAttributionTransferKeepsMetadata() {
        award(alice, "1");
        UUID attributionId = UUID.randomUUID();

        TransferResult result = tokenLedgerService.transfer(TransferCommand.builder()
                .fromAccountId(alice)
                .toAccountId(bob)
                .amount(new BigDecimal("0.1"))
                .reason("CITATION: A title")
                .attributionId(attributionId)
                .metadata(Map.of("source_content_id", "card-1", "attribution_kind", "citation"))
                .build())
            .orElseThrow();

        LedgerEntry entry = ledgerRepository.findById(result.getTransactionId()).orElseThrow();
        assertEquals(TransactionKind.ATTRIBUTION, entry.getKind());
        assertEquals(attributionId, entry.getAttributionId());
        assertEquals("card-1", entry.getMetadata().get("source_content_id"));
        assertEquals("citation", entry.getMetadata().get("attribution_kind"));
        assertEquals("CITATION: A title", entry.getReason());
    }

    @Test
    @DisplayName("Remix attribution pays 0.5 from the target owner to the source owner")
    void testRemixAttribution() {
        printTestHeader("Attribution - Remix Reward");

        // Given: bob owns the remixing card and pays alice, the original creator
        award(bob, "2");

        // When
        TransferResult result = attributionRewardResolver.resolve(AttributionEvent.builder()
                .attributionId(UUID.randomUUID())
                .sourceContentId(UUID.randomUUID())
                .targetContentId(UUID.randomUUID())
                .kind("remix")
                .sourceOwnerId(alice)
                .targetOwnerId(bob)
                .build())
            .orElseThrow();

        // Then
        assertEquals(new BigDecimal("0.50000000"), result.getAmount());
        assertEquals("REMIX", result.getReason());
        assertEquals(TransactionKind.ATTRIBUTION, result.getKind());
        assertEquals(new BigDecimal("1.50000000"), balanceOf(bob));
        assertEquals(new BigDecimal("0.50000000"), balanceOf(alice));

        printSuccess("Remix reward paid: " + result.getTransactionId());
    }

    @Test
    @DisplayName("Ledger entries cannot be updated or deleted")
    void testLedgerIsAppendOnly() {
        printTestHeader("Ledger - Append Only");

        UUID entryId = award(alice, "3").getTransactionId();

        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("UPDATE ledger_entries SET amount = 100 WHERE id = ?", entryId));
        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.update("DELETE FROM ledger_entries WHERE id = ?", entryId));
        assertThrows(DataAccessException.class, () ->
            jdbcTemplate.execute("TRUNCATE ledger_entries CASCADE"));

        LedgerEntry entry = ledgerRepository.findById(entryId).orElseThrow();
        assertEquals(new BigDecimal("3.00000000"), entry.getAmount());

        printSuccess("Entry " + entryId + " is unchanged");
    }

    @Test
    @DisplayName("Balance equals credits minus debits after mixed activity")
    void testBalanceMatchesLedger() {
        award(alice, "10");
        award(bob, "1.5");
        transfer(alice, bob, "2.25", "x").orElseThrow();
        transfer(bob, alice, "0.75", "y").orElseThrow();
        transfer(bob, alice, "100", "too much");

        Map<UUID, BigDecimal> positions = ledgerRepository.netPositions();
        assertEquals(0, balanceOf(alice).compareTo(positions.get(alice)));
        assertEquals(0, balanceOf(bob).compareTo(positions.get(bob)));
        assertEquals(new BigDecimal("8.50000000"), balanceOf(alice));
        assertEquals(new BigDecimal("3.00000000"), balanceOf(bob));
    }

    @Test
    @DisplayName("Repeated idempotency key returns the original award without posting again")
    void testIdempotentAwardReplay() {
        printTestHeader("Idempotency - Award Replay");

        AwardCommand command = AwardCommand.builder()
            .toAccountId(alice)
            .amount(new BigDecimal("2"))
            .reason("publish")
            .idempotencyKey("award-" + alice)
            .build();

        AwardResult first = tokenLedgerService.award(command).orElseThrow();
        AwardResult second = tokenLedgerService.award(command).orElseThrow();

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getTransactionId(), second.getTransactionId());
        assertEquals(new BigDecimal("2.00000000"), balanceOf(alice));
        assertEquals(1, entryCount(alice));

        printSuccess("Second call replayed " + second.getTransactionId());
    }

    @Test
    @DisplayName("Reusing an idempotency key for a different request is a conflict")
    void testIdempotencyKeyConflict() {
        award(alice, "5");
        String key = "transfer-" + alice;

        TransferCommand original = TransferCommand.builder()
            .fromAccountId(alice)
            .toAccountId(bob)
            .amount(new BigDecimal("1"))
            .reason("x")
            .idempotencyKey(key)
            .build();
        tokenLedgerService.transfer(original).orElseThrow();

        LedgerResult<TransferResult> reused = tokenLedgerService.transfer(original.toBuilder()
            .amount(new BigDecimal("2"))
            .build());

        assertEquals(LedgerErrorKind.IDEMPOTENCY_KEY_CONFLICT, reused.getError().getKind());
        assertEquals(new BigDecimal("4.00000000"), balanceOf(alice));
    }
}
