package com.questrail.kmip.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One decoded response batch item.
 *
 * <p>The operation and payload are optional on the wire: a server reporting a
 * failure typically omits the payload, and may omit the operation.</p>
 */
public record ResponseBatchItem(
        Optional<Operation> operation,
        ResultStatus resultStatus,
        Optional<ResultReason> resultReason,
        Optional<String> resultMessage,
        Optional<ResponsePayload> payload
) {
    public ResponseBatchItem {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(resultStatus, "resultStatus");
        Objects.requireNonNull(resultReason, "resultReason");
        Objects.requireNonNull(resultMessage, "resultMessage");
        Objects.requireNonNull(payload, "payload");
    }

    public static ResponseBatchItem success(Operation operation, ResponsePayload payload) {
        return new ResponseBatchItem(Optional.of(operation), ResultStatus.SUCCESS,
                Optional.empty(), Optional.empty(), Optional.ofNullable(payload));
    }

    public static ResponseBatchItem failure(ResultStatus status, ResultReason reason, String message) {
        return new ResponseBatchItem(Optional.empty(), status,
                Optional.ofNullable(reason), Optional.ofNullable(message), Optional.empty());
    }
}
