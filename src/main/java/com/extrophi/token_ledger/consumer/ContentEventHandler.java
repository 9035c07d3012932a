package com.extrophi.token_ledger.consumer;

import com.extrophi.token_ledger.attribution.AttributionRewardResolver;
import com.extrophi.token_ledger.consumer.event.AttributionCreatedEvent;
import com.extrophi.token_ledger.consumer.event.CardPublishedEvent;
import com.extrophi.token_ledger.consumer.event.UserRegisteredEvent;
import com.extrophi.token_ledger.ledger.AccountService;
import com.extrophi.token_ledger.ledger.AwardCommand;
import com.extrophi.token_ledger.ledger.LedgerResult;
import com.extrophi.token_ledger.ledger.TokenLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Applies content events to the ledger.
 *
 * Called by ContentEventConsumer after the idempotency check, so handlers
 * do no deduplication of their own.
 */
@Service
@Slf4j
public class ContentEventHandler {

    private final AccountService accountService;
    private final TokenLedgerService tokenLedgerService;
    private final AttributionRewardResolver attributionRewardResolver;
    private final BigDecimal publishReward;

    public ContentEventHandler(AccountService accountService,
                               TokenLedgerService tokenLedgerService,
                               AttributionRewardResolver attributionRewardResolver,
                               @Value("${ledger.rewards.publish:1.00000000}") BigDecimal publishReward) {
        this.accountService = accountService;
        this.tokenLedgerService = tokenLedgerService;
        this.attributionRewardResolver = attributionRewardResolver;
        this.publishReward = publishReward;
    }

    public LedgerResult<Boolean> onUserRegistered(UserRegisteredEvent event) {
        log.info("Handling UserRegistered: userId={}", event.getUserId());
        return LedgerResult.success(accountService.createAccount(event.getUserId()));
    }

    public LedgerResult<?> onCardPublished(CardPublishedEvent event) {
        log.info("Handling CardPublished: cardId={}, userId={}", event.getCardId(), event.getUserId());
        return tokenLedgerService.award(AwardCommand.builder()
            .toAccountId(event.getUserId())
            .amount(publishReward)
            .reason("Published card: " + event.getTitle())
            .contentId(event.getCardId())
            .metadata(Map.of("card_id", String.valueOf(event.getCardId())))
            .build());
    }

    public LedgerResult<?> onAttributionCreated(AttributionCreatedEvent event) {
        log.info("Handling AttributionCreated: attributionId={}, type={}, source={}, target={}",
                event.getAttributionId(), event.getAttributionType(),
                event.getSourceCardId(), event.getTargetCardId());
        return attributionRewardResolver.resolve(event.toAttributionEvent());
    }
}
