package com.questrail.kmip.model;

import java.util.List;
import java.util.Objects;

/**
 * A complete request: header plus its batch items.
 *
 * <p>Instances are ephemeral. The exchange engine builds one per call, hands
 * it to the codec and drops it once encoding succeeds.</p>
 */
public record RequestMessage(RequestHeader header, List<RequestBatchItem> batchItems)
{
    public RequestMessage {
        Objects.requireNonNull(header, "header");
        batchItems = List.copyOf(Objects.requireNonNull(batchItems, "batchItems"));
        if (header.batchCount() != batchItems.size()) {
            throw new IllegalArgumentException("Header batch count " + header.batchCount()
                    + " does not match " + batchItems.size() + " batch item(s)");
        }
    }
}
