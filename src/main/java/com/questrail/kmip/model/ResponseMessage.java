package com.questrail.kmip.model;

import java.util.List;
import java.util.Objects;

/**
 * Decoded response message.
 *
 * <p>No shape validation happens here: a header batch count that disagrees
 * with the decoded items, or an empty item list, is representable so the
 * exchange engine can classify it as a malformed response.</p>
 */
public record ResponseMessage(ResponseHeader header, List<ResponseBatchItem> batchItems)
{
    public ResponseMessage {
        Objects.requireNonNull(header, "header");
        batchItems = List.copyOf(Objects.requireNonNull(batchItems, "batchItems"));
    }
}
