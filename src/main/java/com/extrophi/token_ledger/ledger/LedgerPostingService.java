package com.extrophi.token_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Posting engine: the only code that changes balances.
 *
 * Each posting is one database transaction:
 * 1. Validate the request (amount, self-transfer) before touching storage
 * 2. Lock participant rows in ascending id order
 * 3. Check existence and balance against the locked rows
 * 4. Debit, credit and append the ledger entry with the resulting balances
 *
 * Refusals are returned before any write, so there is nothing to roll back.
 * Storage errors are thrown as DataAccessException, which rolls the whole
 * unit back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingService {

    private final AccountStore accountStore;
    private final LedgerRepository ledgerRepository;
    private final Clock clock;

    /**
     * Moves tokens between two accounts.
     *
     * Preconditions are checked in this order, each with its own failure:
     * invalid amount, self transfer, missing account id, null metadata entry,
     * missing account, insufficient balance, receiver balance overflow.
     */
    @Transactional
    public LedgerResult<TransferResult> postTransfer(TransferCommand command) {
        BigDecimal requested = command.getAmount();
        if (!TokenAmounts.isValidAmount(requested)) {
            return LedgerResult.failure(LedgerError.invalidAmount(requested));
        }
        UUID fromId = command.getFromAccountId();
        UUID toId = command.getToAccountId();
        if (fromId != null && fromId.equals(toId)) {
            return LedgerResult.failure(LedgerError.selfTransfer(fromId));
        }
        if (fromId == null || toId == null) {
            return LedgerResult.failure(LedgerError.accountNotFound(null));
        }
        String badMetadataKey = firstNullMetadataEntry(command.getMetadata());
        if (badMetadataKey != null) {
            return LedgerResult.failure(LedgerError.invalidMetadata(badMetadataKey));
        }
        BigDecimal amount = TokenAmounts.scaled(requested);

        Map<UUID, Account> locked = accountStore.lockInOrder(List.of(fromId, toId));
        Account sender = locked.get(fromId);
        if (sender == null) {
            return LedgerResult.failure(LedgerError.accountNotFound(fromId));
        }
        Account receiver = locked.get(toId);
        if (receiver == null) {
            return LedgerResult.failure(LedgerError.accountNotFound(toId));
        }
        if (sender.getBalance().compareTo(amount) < 0) {
            return LedgerResult.failure(LedgerError.insufficientBalance(sender.getBalance(), amount));
        }
        if (!TokenAmounts.isStorableBalance(receiver.getBalance().add(amount))) {
            return LedgerResult.failure(LedgerError.balanceOverflow(toId, receiver.getBalance(), amount));
        }

        Instant createdAt = nextEntryTimestamp(sender, receiver);
        BigDecimal fromBalance = accountStore.debit(fromId, amount, createdAt);
        BigDecimal toBalance = accountStore.credit(toId, amount, createdAt);

        LedgerEntry entry = ledgerRepository.append(LedgerEntry.builder()
            .id(UUID.randomUUID())
            .fromAccountId(fromId)
            .toAccountId(toId)
            .amount(amount)
            .kind(command.kind())
            .attributionId(command.getAttributionId())
            .reason(command.getReason())
            .fromBalanceAfter(fromBalance)
            .toBalanceAfter(toBalance)
            .metadata(command.getMetadata() != null ? Map.copyOf(command.getMetadata()) : Map.of())
            .idempotencyKey(command.getIdempotencyKey())
            .createdAt(createdAt)
            .build());

        log.debug("Posted {} {}: {} -> {} amount={}", entry.getKind(), entry.getId(), fromId, toId, amount);
        return LedgerResult.success(TransferResult.from(entry, false));
    }

    /**
     * Credits system-originated tokens. Never fails on balance.
     */
    @Transactional
    public LedgerResult<AwardResult> postAward(AwardCommand command) {
        BigDecimal requested = command.getAmount();
        if (!TokenAmounts.isValidAmount(requested)) {
            return LedgerResult.failure(LedgerError.invalidAmount(requested));
        }
        UUID toId = command.getToAccountId();
        if (toId == null) {
            return LedgerResult.failure(LedgerError.accountNotFound(null));
        }
        String badMetadataKey = firstNullMetadataEntry(command.getMetadata());
        if (badMetadataKey != null) {
            return LedgerResult.failure(LedgerError.invalidMetadata(badMetadataKey));
        }
        BigDecimal amount = TokenAmounts.scaled(requested);

        Account receiver = accountStore.lockInOrder(List.of(toId)).get(toId);
        if (receiver == null) {
            return LedgerResult.failure(LedgerError.accountNotFound(toId));
        }
        if (!TokenAmounts.isStorableBalance(receiver.getBalance().add(amount))) {
            return LedgerResult.failure(LedgerError.balanceOverflow(toId, receiver.getBalance(), amount));
        }

        Instant createdAt = nextEntryTimestamp(receiver);
        BigDecimal toBalance = accountStore.credit(toId, amount, createdAt);

        LedgerEntry entry = ledgerRepository.append(LedgerEntry.builder()
            .id(UUID.randomUUID())
            .toAccountId(toId)
            .amount(amount)
            .kind(TransactionKind.EARN)
            .contentId(command.getContentId())
            .reason(command.getReason())
            .toBalanceAfter(toBalance)
            .metadata(command.getMetadata() != null ? Map.copyOf(command.getMetadata()) : Map.of())
            .idempotencyKey(command.getIdempotencyKey())
            .createdAt(createdAt)
            .build());

        log.debug("Posted EARN {}: -> {} amount={}", entry.getId(), toId, amount);
        return LedgerResult.success(AwardResult.from(entry, false));
    }

    /**
     * @return the key of the first entry with a null key or value, or null if there is none
     */
    private static String firstNullMetadataEntry(Map<String, String> metadata) {
        if (metadata == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                return String.valueOf(entry.getKey());
            }
        }
        return null;
    }

    /**
     * Entry timestamps never go backwards for any participant, even if the
     * wall clock does.
     */
    private Instant nextEntryTimestamp(Account... participants) {
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MICROS);
        for (Account participant : participants) {
            Instant last = participant.getLastEntryAt();
            if (last != null && last.isAfter(timestamp)) {
                timestamp = last;
            }
        }
        return timestamp;
    }
}
