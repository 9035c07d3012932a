package com.extrophi.token_ledger.attribution;

import com.extrophi.token_ledger.ledger.LedgerError;
import com.extrophi.token_ledger.ledger.LedgerResult;
import com.extrophi.token_ledger.ledger.TokenLedgerService;
import com.extrophi.token_ledger.ledger.TransferCommand;
import com.extrophi.token_ledger.ledger.TransferResult;
import com.extrophi.token_ledger.observability.TokenMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns an attribution into a reward transfer.
 *
 * The citing creator (owner of the target content) pays the fixed reward
 * for the attribution kind to the original creator (owner of the source
 * content). Unknown kinds are refused, never defaulted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttributionRewardResolver {

    static final int TITLE_EXCERPT_LENGTH = 50;

    private final TokenLedgerService tokenLedgerService;
    private final TokenMetrics metrics;

    public LedgerResult<TransferResult> resolve(AttributionEvent event) {
        Optional<AttributionKind> kind = AttributionKind.fromValue(event.getKind());
        if (kind.isEmpty()) {
            log.warn("Refusing attribution {} with unknown kind '{}'", event.getAttributionId(), event.getKind());
            metrics.recordAttributionReward("unknown", "UNKNOWN_ATTRIBUTION_KIND");
            return LedgerResult.failure(LedgerError.unknownAttributionKind(event.getKind()));
        }

        TransferCommand command = TransferCommand.builder()
            .fromAccountId(event.getTargetOwnerId())
            .toAccountId(event.getSourceOwnerId())
            .amount(kind.get().getReward())
            .reason(reason(kind.get(), event.getTargetTitle()))
            .attributionId(attributionReference(event, kind.get()))
            .metadata(metadata(event, kind.get()))
            .build();

        LedgerResult<TransferResult> result = tokenLedgerService.transfer(command);
        String status = result.isSuccess() ? "success" : result.getError().getKind().name();
        metrics.recordAttributionReward(kind.get().name(), status);
        return result;
    }

    static String reason(AttributionKind kind, String targetTitle) {
        if (targetTitle == null || targetTitle.isBlank()) {
            return kind.name();
        }
        String excerpt = targetTitle.length() > TITLE_EXCERPT_LENGTH
            ? targetTitle.substring(0, TITLE_EXCERPT_LENGTH)
            : targetTitle;
        return kind.name() + ": " + excerpt;
    }

    /**
     * Events without an id get a name-based UUID of (source, target, kind), so
     * the entry is still an ATTRIBUTION and repeats map to the same reference.
     */
    static UUID attributionReference(AttributionEvent event, AttributionKind kind) {
        if (event.getAttributionId() != null) {
            return event.getAttributionId();
        }
        String name = event.getSourceContentId() + ":" + event.getTargetContentId() + ":" + kind.name();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, String> metadata(AttributionEvent event, AttributionKind kind) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (event.getSourceContentId() != null) {
            metadata.put("source_content_id", event.getSourceContentId().toString());
        }
        if (event.getTargetContentId() != null) {
            metadata.put("target_content_id", event.getTargetContentId().toString());
        }
        metadata.put("attribution_kind", kind.name().toLowerCase());
        return metadata;
    }
}
