package com.extrophi.token_ledger.attribution;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A target content item attributed a source content item.
 *
 * Owners are taken as supplied by the caller. The target owner pays, the
 * source owner is rewarded.
 */
@Value
@Builder
public class AttributionEvent {
    UUID attributionId;
    UUID sourceContentId;
    UUID targetContentId;
    String kind;
    UUID sourceOwnerId;
    UUID targetOwnerId;
    String targetTitle;
}
