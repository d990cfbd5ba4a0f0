package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipOutcome;
import com.questrail.kmip.client.KmipStatus;
import com.questrail.kmip.codec.KmipCodec;
import com.questrail.kmip.codec.KmipDecodeException;
import com.questrail.kmip.internal.buffer.WorkingBuffer;
import com.questrail.kmip.internal.time.WallClock;
import com.questrail.kmip.model.RequestBatchItem;
import com.questrail.kmip.model.RequestHeader;
import com.questrail.kmip.model.RequestMessage;
import com.questrail.kmip.model.ResponseBatchItem;
import com.questrail.kmip.model.ResponseMessage;
import com.questrail.kmip.observability.KmipErrorEvent;
import com.questrail.kmip.observability.KmipExchangeEvent;
import com.questrail.kmip.observability.KmipObservabilitySink;
import com.questrail.kmip.transport.KmipTransport;

import java.util.List;
import java.util.Objects;

/**
 * ExchangeOrchestrator
 * =============================================================================
 * Runs one complete request/response exchange on a {@link ProtocolContext}.
 *
 * <h2>Sequence</h2>
 * <ol>
 *   <li>Build a single-item request message stamped with the wall clock.</li>
 *   <li>Encode and send it ({@link FrameTransmitter}).</li>
 *   <li>Receive one frame ({@link FrameReceiver}) and decode it.</li>
 *   <li>Require exactly one batch item. A server-reported failure is returned
 *       as-is; a success is handed to the operation's extractor.</li>
 * </ol>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>No exception escapes for protocol, I/O or allocation failures; every
 *       failure becomes a {@link KmipOutcome} with the matching status.</li>
 *   <li>The context holds no working buffer on return, whatever the path.</li>
 *   <li>Outputs exist only on success.</li>
 *   <li>Every call produces exactly one observability event.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Stateless apart from its collaborators; safe to share as long as each
 * concurrent call uses its own context.
 */
public final class ExchangeOrchestrator
{
    static final String RAW_OPERATION = "RAW";

    private final KmipCodec codec;
    private final FrameTransmitter transmitter;
    private final FrameReceiver receiver;
    private final WallClock clock;
    private final KmipObservabilitySink sink;

    public ExchangeOrchestrator(KmipCodec codec,
                                int encodeBlockSize,
                                WallClock clock,
                                KmipObservabilitySink sink)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.transmitter = new FrameTransmitter(codec, encodeBlockSize);
        this.receiver = new FrameReceiver();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Execute a codec-driven operation.
     */
    public <T> KmipOutcome<T> execute(ProtocolContext context,
                                      KmipTransport transport,
                                      int maxMessageSize,
                                      ExchangeOperation<T> operation)
    {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(operation, "operation");
        requirePositive(maxMessageSize);

        final String name = operation.operation().name();
        int sent = 0;
        int received = 0;
        try {
            RequestMessage request = new RequestMessage(
                    new RequestHeader(context.version(), maxMessageSize, clock.now(), 1),
                    List.of(RequestBatchItem.of(operation.requestPayload())));

            sent = transmitter.send(context, transport, request);
            WorkingBuffer frame = receiver.receive(context, transport, maxMessageSize);
            received = frame.capacity();

            ResponseMessage response = decode(frame);
            context.release();

            ResponseBatchItem item = soleBatchItem(response);
            if (item.operation().isPresent() && item.operation().get() != operation.operation()) {
                throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE,
                        "Response batch item is for " + item.operation().get() + ", expected " + operation.operation());
            }

            KmipStatus status = KmipStatus.of(item.resultStatus());
            if (!status.isSuccess()) {
                sink.onExchange(new KmipExchangeEvent(clock.now(), name, status,
                        item.resultReason().orElse(null), sent, received));
                return KmipOutcome.serverResult(status,
                        item.resultReason().orElse(null),
                        item.resultMessage().orElse(null));
            }

            T value = operation.extract(item.payload(), context);
            sink.onExchange(new KmipExchangeEvent(clock.now(), name, status, null, sent, received));
            return KmipOutcome.success(value);
        }
        catch (ExchangeException e) {
            return failed(name, e);
        }
        finally {
            context.release();
        }
    }

    /**
     * Send caller-encoded request bytes and return the complete response frame,
     * prefix included, undecoded.
     *
     * <p>The server's result status is not inspected: a response that frames
     * correctly is a success here, whatever it says.</p>
     */
    public KmipOutcome<byte[]> passthrough(ProtocolContext context,
                                           KmipTransport transport,
                                           int maxMessageSize,
                                           byte[] request)
    {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(request, "request");
        requirePositive(maxMessageSize);

        int sent = 0;
        try {
            sent = transmitter.sendEncoded(transport, request);
            WorkingBuffer frame = receiver.receive(context, transport, maxMessageSize);
            int received = frame.capacity();
            byte[] response = context.copyOut(0, received);
            sink.onExchange(new KmipExchangeEvent(clock.now(), RAW_OPERATION, KmipStatus.SUCCESS,
                    null, sent, received));
            return KmipOutcome.success(response);
        }
        catch (ExchangeException e) {
            return failed(RAW_OPERATION, e);
        }
        finally {
            context.release();
        }
    }

    private ResponseMessage decode(WorkingBuffer frame) throws ExchangeException
    {
        final ResponseMessage response;
        try {
            response = codec.decodeResponse(frame.view());
        }
        catch (KmipDecodeException e) {
            throw new ExchangeException(KmipStatus.DECODING_ERROR, e.getMessage(), e);
        }
        catch (RuntimeException e) {
            throw new ExchangeException(KmipStatus.DECODING_ERROR, "Codec failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ExchangeException(KmipStatus.DECODING_ERROR, "Codec returned no response");
        }
        return response;
    }

    private static ResponseBatchItem soleBatchItem(ResponseMessage response) throws ExchangeException
    {
        int declared = response.header().batchCount();
        if (declared != 1) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE,
                    "Response declares " + declared + " batch item(s), expected 1");
        }
        List<ResponseBatchItem> items = response.batchItems();
        if (items.size() != 1) {
            throw new ExchangeException(KmipStatus.MALFORMED_RESPONSE,
                    "Response carries " + items.size() + " batch item(s), expected 1");
        }
        return items.get(0);
    }

    private <T> KmipOutcome<T> failed(String operation, ExchangeException e)
    {
        sink.onError(new KmipErrorEvent(clock.now(), operation, e.status(), e.getMessage(), e.getCause()));
        return KmipOutcome.failure(e.status(), e.getMessage());
    }

    private static void requirePositive(int maxMessageSize)
    {
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive");
        }
    }
}
