package com.extrophi.token_ledger.api;

import com.extrophi.token_ledger.api.dto.AwardTokensRequest;
import com.extrophi.token_ledger.api.dto.AwardTokensResponse;
import com.extrophi.token_ledger.api.dto.BalanceResponse;
import com.extrophi.token_ledger.api.dto.LedgerEntryResponse;
import com.extrophi.token_ledger.api.dto.TokenStatsResponse;
import com.extrophi.token_ledger.api.dto.TransferTokensRequest;
import com.extrophi.token_ledger.api.dto.TransferTokensResponse;
import com.extrophi.token_ledger.ledger.AccountService;
import com.extrophi.token_ledger.ledger.AwardCommand;
import com.extrophi.token_ledger.ledger.AwardResult;
import com.extrophi.token_ledger.ledger.LedgerEntry;
import com.extrophi.token_ledger.ledger.TokenAmounts;
import com.extrophi.token_ledger.ledger.TokenLedgerService;
import com.extrophi.token_ledger.ledger.TransactionKind;
import com.extrophi.token_ledger.ledger.TransferCommand;
import com.extrophi.token_ledger.ledger.TransferResult;
import com.extrophi.token_ledger.reporting.TokenReportingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for $EXTROPY token operations.
 *
 * A thin adapter over the ledger services: ledger failures are unwrapped
 * with orElseThrow() and mapped to HTTP by GlobalExceptionHandler.
 *
 * Award and transfer accept an optional Idempotency-Key header. A repeated
 * key answers 200 with the original outcome instead of 201.
 */
@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
@Slf4j
public class TokenController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TokenLedgerService tokenLedgerService;
    private final TokenReportingService reportingService;
    private final AccountService accountService;

    @PostMapping("/award")
    public ResponseEntity<AwardTokensResponse> award(
            @Valid @RequestBody AwardTokensRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received award request: userId={}, amount={}, idempotencyKey={}",
                request.getUserId(), request.getAmount(), idempotencyKey);

        AwardResult result = tokenLedgerService.award(AwardCommand.builder()
                .toAccountId(request.getUserId())
                .amount(request.getAmount())
                .reason(request.getReason())
                .contentId(request.getContentRef())
                .metadata(request.getMetadata())
                .idempotencyKey(idempotencyKey)
                .build())
            .orElseThrow();

        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(AwardTokensResponse.from(result));
    }

    @PostMapping("/transfer")
    public ResponseEntity<TransferTokensResponse> transfer(
            @Valid @RequestBody TransferTokensRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received transfer request: from={}, to={}, amount={}, idempotencyKey={}",
                request.getFromUserId(), request.getToUserId(), request.getAmount(), idempotencyKey);

        TransferResult result = tokenLedgerService.transfer(TransferCommand.builder()
                .fromAccountId(request.getFromUserId())
                .toAccountId(request.getToUserId())
                .amount(request.getAmount())
                .reason(request.getReason())
                .attributionId(request.getAttributionId())
                .metadata(request.getMetadata())
                .idempotencyKey(idempotencyKey)
                .build())
            .orElseThrow();

        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(TransferTokensResponse.from(result));
    }

    @GetMapping("/balance/{userId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") UUID userId) {
        BigDecimal balance = accountService.getBalance(userId).orElseThrow();
        return ResponseEntity.ok(new BalanceResponse(userId, TokenAmounts.format(balance)));
    }

    /**
     * Paginated history, newest first.
     *
     * @param transactionType optional filter: earn, transfer or attribution
     */
    @GetMapping("/ledger/{userId}")
    public ResponseEntity<List<LedgerEntryResponse>> getLedger(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "limit", defaultValue = "100") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "transaction_type", required = false) String transactionType) {

        TransactionKind kind = null;
        if (transactionType != null && !transactionType.isBlank()) {
            kind = TransactionKind.fromValue(transactionType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction_type: " + transactionType));
        }

        List<LedgerEntry> entries = reportingService.history(userId, limit, offset, kind).orElseThrow();
        return ResponseEntity.ok(entries.stream().map(LedgerEntryResponse::from).toList());
    }

    @GetMapping("/stats/{userId}")
    public ResponseEntity<TokenStatsResponse> getStats(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(TokenStatsResponse.from(reportingService.stats(userId).orElseThrow()));
    }
}
