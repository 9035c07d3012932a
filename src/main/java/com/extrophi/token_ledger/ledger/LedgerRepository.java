package com.extrophi.token_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the append-only ledger_entries table.
 *
 * There is no update or delete here; the database trigger rejects both.
 * {@link #append(LedgerEntry)} is package-private and only called by the
 * posting engine inside its transaction.
 */
@Repository
public class LedgerRepository {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS =
        "SELECT id, sequence_number, from_account_id, to_account_id, amount, transaction_kind, " +
        "attribution_id, content_id, reason, from_balance_after, to_balance_after, metadata, " +
        "idempotency_key, created_at FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public LedgerRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the entry once. Any failure is a storage fault and propagates as
     * a DataAccessException, rolling back the surrounding transaction.
     *
     * @return the entry with its database sequence number
     */
    LedgerEntry append(LedgerEntry entry) {
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_entries (id, from_account_id, to_account_id, amount, transaction_kind, " +
            "attribution_id, content_id, reason, from_balance_after, to_balance_after, metadata, " +
            "idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?) RETURNING sequence_number",
            Long.class,
            entry.getId(),
            entry.getFromAccountId(),
            entry.getToAccountId(),
            entry.getAmount(),
            entry.getKind().getDbValue(),
            entry.getAttributionId(),
            entry.getContentId(),
            entry.getReason(),
            entry.getFromBalanceAfter(),
            entry.getToBalanceAfter(),
            writeMetadata(entry.getMetadata()),
            entry.getIdempotencyKey(),
            AccountStore.toOffset(entry.getCreatedAt())
        );
        return entry.withSequenceNumber(sequenceNumber);
    }

    public Optional<LedgerEntry> findById(UUID entryId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", entryRowMapper(), entryId)
            .stream()
            .findFirst();
    }

    public Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE idempotency_key = ?", entryRowMapper(), idempotencyKey)
            .stream()
            .findFirst();
    }

    /**
     * Entries where the account is source or destination, newest first.
     * Ties on created_at are broken by sequence number, so pages are stable.
     */
    public List<LedgerEntry> history(UUID accountId, int limit, int offset, TransactionKind kind) {
        List<Object> args = new ArrayList<>();
        args.add(accountId);
        args.add(accountId);

        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
            .append("WHERE (from_account_id = ? OR to_account_id = ?) ");
        if (kind != null) {
            sql.append("AND transaction_kind = ? ");
            args.add(kind.getDbValue());
        }
        sql.append("ORDER BY created_at DESC, sequence_number DESC LIMIT ? OFFSET ?");
        args.add(limit);
        args.add(offset);

        return jdbcTemplate.query(sql.toString(), entryRowMapper(), args.toArray());
    }

    /**
     * Sum of amounts credited to the account (it is the destination).
     */
    public BigDecimal totalEarned(UUID accountId) {
        return sum("SELECT COALESCE(SUM(amount), 0) FROM ledger_entries WHERE to_account_id = ?", accountId);
    }

    /**
     * Sum of amounts debited from the account (it is the source).
     */
    public BigDecimal totalSpent(UUID accountId) {
        return sum("SELECT COALESCE(SUM(amount), 0) FROM ledger_entries WHERE from_account_id = ?", accountId);
    }

    /**
     * Counts entries per kind where the account is either party. EARN only
     * ever has the account on the credit side.
     */
    public Map<TransactionKind, Long> countByKind(UUID accountId) {
        Map<TransactionKind, Long> counts = new EnumMap<>(TransactionKind.class);
        for (TransactionKind kind : TransactionKind.values()) {
            counts.put(kind, 0L);
        }
        jdbcTemplate.query(
            "SELECT transaction_kind, COUNT(*) AS entry_count FROM ledger_entries " +
            "WHERE from_account_id = ? OR to_account_id = ? GROUP BY transaction_kind",
            rs -> {
                counts.put(TransactionKind.fromDbValue(rs.getString("transaction_kind")),
                    rs.getLong("entry_count"));
            },
            accountId,
            accountId
        );
        return counts;
    }

    /**
     * Net ledger position of every account that appears in the ledger:
     * credits minus debits.
     */
    public Map<UUID, BigDecimal> netPositions() {
        Map<UUID, BigDecimal> positions = new HashMap<>();
        jdbcTemplate.query(
            "SELECT account_id, SUM(delta) AS net FROM (" +
            "  SELECT to_account_id AS account_id, amount AS delta FROM ledger_entries " +
            "  UNION ALL " +
            "  SELECT from_account_id AS account_id, -amount AS delta FROM ledger_entries " +
            "  WHERE from_account_id IS NOT NULL" +
            ") movements GROUP BY account_id",
            rs -> {
                positions.put(rs.getObject("account_id", UUID.class), rs.getBigDecimal("net"));
            }
        );
        return positions;
    }

    private BigDecimal sum(String sql, UUID accountId) {
        BigDecimal total = jdbcTemplate.queryForObject(sql, BigDecimal.class, accountId);
        return TokenAmounts.scaled(total != null ? total : BigDecimal.ZERO);
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, String> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger metadata: " + e.getMessage(), e);
        }
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .sequenceNumber(rs.getLong("sequence_number"))
            .fromAccountId(rs.getObject("from_account_id", UUID.class))
            .toAccountId(rs.getObject("to_account_id", UUID.class))
            .amount(rs.getBigDecimal("amount"))
            .kind(TransactionKind.fromDbValue(rs.getString("transaction_kind")))
            .attributionId(rs.getObject("attribution_id", UUID.class))
            .contentId(rs.getObject("content_id", UUID.class))
            .reason(rs.getString("reason"))
            .fromBalanceAfter(rs.getBigDecimal("from_balance_after"))
            .toBalanceAfter(rs.getBigDecimal("to_balance_after"))
            .metadata(readMetadata(rs.getString("metadata")))
            .idempotencyKey(rs.getString("idempotency_key"))
            .createdAt(AccountStore.toInstant(rs.getTimestamp("created_at")))
            .build();
    }
}
