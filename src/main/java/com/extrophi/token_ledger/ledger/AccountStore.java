package com.extrophi.token_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the accounts table.
 *
 * Reads are public. Locking and balance mutation are package-private so that
 * only the posting engine in this package can change a balance, and only
 * inside its transaction.
 */
@Repository
public class AccountStore {

    private static final String SELECT_COLUMNS = "SELECT id, balance, created_at, last_entry_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the account at balance zero unless it already exists.
     *
     * @return true if a new row was created
     */
    boolean insertIfAbsent(UUID accountId, Instant createdAt) {
        int rows = jdbcTemplate.update(
            "INSERT INTO accounts (id, balance, created_at) VALUES (?, 0, ?) " +
            "ON CONFLICT (id) DO NOTHING",
            accountId,
            toOffset(createdAt)
        );
        return rows == 1;
    }

    public boolean exists(UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM accounts WHERE id = ?)",
            Boolean.class,
            accountId
        );
        return Boolean.TRUE.equals(exists);
    }

    public Optional<BigDecimal> findBalance(UUID accountId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM accounts WHERE id = ?",
            BigDecimal.class,
            accountId
        );
        return balances.stream().findFirst();
    }

    public List<Account> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY id", accountRowMapper());
    }

    /**
     * Locks the given accounts with SELECT ... FOR UPDATE, one at a time in
     * ascending id order so that concurrent postings over overlapping pairs
     * always acquire locks in the same order.
     *
     * Missing accounts are simply absent from the returned map.
     */
    Map<UUID, Account> lockInOrder(Collection<UUID> accountIds) {
        List<UUID> ordered = new ArrayList<>(accountIds);
        ordered.sort(UUID::compareTo);

        Map<UUID, Account> locked = new LinkedHashMap<>();
        for (UUID accountId : ordered) {
            if (locked.containsKey(accountId)) {
                continue;
            }
            List<Account> rows = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE id = ? FOR UPDATE",
                accountRowMapper(),
                accountId
            );
            if (!rows.isEmpty()) {
                locked.put(accountId, rows.get(0));
            }
        }
        return locked;
    }

    /**
     * @return the balance after the credit, as stored
     */
    BigDecimal credit(UUID accountId, BigDecimal amount, Instant entryAt) {
        return jdbcTemplate.queryForObject(
            "UPDATE accounts SET balance = balance + ?, last_entry_at = ? " +
            "WHERE id = ? RETURNING balance",
            BigDecimal.class,
            amount,
            toOffset(entryAt),
            accountId
        );
    }

    /**
     * The CHECK (balance >= 0) constraint backs up the caller's balance check.
     *
     * @return the balance after the debit, as stored
     */
    BigDecimal debit(UUID accountId, BigDecimal amount, Instant entryAt) {
        return jdbcTemplate.queryForObject(
            "UPDATE accounts SET balance = balance - ?, last_entry_at = ? " +
            "WHERE id = ? RETURNING balance",
            BigDecimal.class,
            amount,
            toOffset(entryAt),
            accountId
        );
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getBigDecimal("balance"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("last_entry_at"))
        );
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
