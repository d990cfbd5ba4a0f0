package com.questrail.kmip.codec.impl;

import com.questrail.kmip.codec.EncodeResult;
import com.questrail.kmip.codec.KmipCodec;
import com.questrail.kmip.codec.KmipDecodeException;
import com.questrail.kmip.model.*;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.ReadOnlyBufferException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultKmipCodec
 * -----------------------------------------------------------------------------
 * TTLV implementation of {@link KmipCodec}.
 *
 * <p>Outbound, requests are written directly into the caller's buffer; a
 * {@link BufferOverflowException} anywhere in the write becomes
 * {@link EncodeResult.BufferTooSmall}.</p>
 *
 * <p>Inbound, the frame is first parsed into a {@link TtlvItem} tree and then
 * mapped onto the model types. Mapping is tolerant of fields it does not know
 * (they are skipped) and strict about the fields it needs.</p>
 *
 * <p>Instances are stateless and may be shared.</p>
 */
public final class DefaultKmipCodec implements KmipCodec
{
    @Override
    public EncodeResult encodeRequest(RequestMessage request, ByteBuffer target)
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(target, "target");

        if (target.order() != ByteOrder.BIG_ENDIAN) {
            return EncodeResult.failed("TTLV target must be big-endian");
        }

        final int start = target.position();
        try {
            TtlvWriter w = new TtlvWriter(target);
            writeRequestMessage(w, request);
            return EncodeResult.encoded(target.position() - start);
        }
        catch (BufferOverflowException e) {
            return EncodeResult.bufferTooSmall();
        }
        catch (ReadOnlyBufferException e) {
            return EncodeResult.failed("Target buffer is read-only");
        }
        catch (IllegalArgumentException e) {
            return EncodeResult.failed(e.getMessage());
        }
    }

    @Override
    public ResponseMessage decodeResponse(ByteBuffer frame)
    {
        Objects.requireNonNull(frame, "frame");

        ByteBuffer in = frame.slice();
        try {
            TtlvItem root = TtlvReader.read(in);
            if (in.hasRemaining()) {
                throw new TtlvFormatException(in.remaining() + " trailing byte(s) after response message");
            }
            if (root.tag() != TtlvTag.RESPONSE_MESSAGE || !root.isStructure()) {
                throw new TtlvFormatException("Expected response message structure, found "
                        + TtlvTag.hex(root.tag()));
            }
            return decodeResponseMessage(root);
        }
        catch (TtlvFormatException e) {
            throw new KmipDecodeException("Malformed KMIP response: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // Request encoding
    // ========================================================================

    private static void writeRequestMessage(TtlvWriter w, RequestMessage request)
    {
        int message = w.beginStructure(TtlvTag.REQUEST_MESSAGE);

        RequestHeader header = request.header();
        int rh = w.beginStructure(TtlvTag.REQUEST_HEADER);
        writeProtocolVersion(w, header.protocolVersion());
        w.writeInteger(TtlvTag.MAXIMUM_RESPONSE_SIZE, header.maximumResponseSize());
        w.writeDateTime(TtlvTag.TIME_STAMP, header.timeStamp());
        w.writeInteger(TtlvTag.BATCH_COUNT, header.batchCount());
        w.endStructure(rh);

        for (RequestBatchItem item : request.batchItems()) {
            int bi = w.beginStructure(TtlvTag.BATCH_ITEM);
            w.writeEnumeration(TtlvTag.OPERATION, item.operation().code());
            int payload = w.beginStructure(TtlvTag.REQUEST_PAYLOAD);
            writeRequestPayload(w, item.payload());
            w.endStructure(payload);
            w.endStructure(bi);
        }

        w.endStructure(message);
    }

    private static void writeProtocolVersion(TtlvWriter w, ProtocolVersion version)
    {
        int pv = w.beginStructure(TtlvTag.PROTOCOL_VERSION);
        w.writeInteger(TtlvTag.PROTOCOL_VERSION_MAJOR, version.major());
        w.writeInteger(TtlvTag.PROTOCOL_VERSION_MINOR, version.minor());
        w.endStructure(pv);
    }

    private static void writeRequestPayload(TtlvWriter w, RequestPayload payload)
    {
        if (payload instanceof RequestPayload.Create create) {
            w.writeEnumeration(TtlvTag.OBJECT_TYPE, create.objectType().code());
            writeTemplateAttribute(w, create.templateAttribute());
        }
        else if (payload instanceof RequestPayload.Destroy destroy) {
            writeUniqueIdentifier(w, destroy.uniqueIdentifier());
        }
        else if (payload instanceof RequestPayload.Get get) {
            writeUniqueIdentifier(w, get.uniqueIdentifier());
        }
        else {
            throw new IllegalArgumentException("Unsupported request payload: " + payload);
        }
    }

    private static void writeUniqueIdentifier(TtlvWriter w, String uniqueIdentifier)
    {
        if (uniqueIdentifier.isEmpty()) {
            throw new IllegalArgumentException("Unique identifier must not be empty");
        }
        w.writeTextString(TtlvTag.UNIQUE_IDENTIFIER, uniqueIdentifier);
    }

    private static void writeTemplateAttribute(TtlvWriter w, TemplateAttribute template)
    {
        int ta = w.beginStructure(TtlvTag.TEMPLATE_ATTRIBUTE);
        for (Attribute attribute : template.attributes()) {
            int a = w.beginStructure(TtlvTag.ATTRIBUTE);
            w.writeTextString(TtlvTag.ATTRIBUTE_NAME, attribute.name());
            if (attribute.index().isPresent()) {
                w.writeInteger(TtlvTag.ATTRIBUTE_INDEX, attribute.index().get());
            }
            writeAttributeValue(w, attribute.value());
            w.endStructure(a);
        }
        w.endStructure(ta);
    }

    private static void writeAttributeValue(TtlvWriter w, AttributeValue value)
    {
        if (value instanceof AttributeValue.TextString text) {
            w.writeTextString(TtlvTag.ATTRIBUTE_VALUE, text.value());
        }
        else if (value instanceof AttributeValue.Int integer) {
            w.writeInteger(TtlvTag.ATTRIBUTE_VALUE, integer.value());
        }
        else if (value instanceof AttributeValue.Enumeration enumeration) {
            w.writeEnumeration(TtlvTag.ATTRIBUTE_VALUE, enumeration.code());
        }
        else if (value instanceof AttributeValue.ByteString bytes) {
            w.writeByteString(TtlvTag.ATTRIBUTE_VALUE, bytes.value());
        }
        else if (value instanceof AttributeValue.Name name) {
            int v = w.beginStructure(TtlvTag.ATTRIBUTE_VALUE);
            w.writeTextString(TtlvTag.NAME_VALUE, name.value());
            w.writeEnumeration(TtlvTag.NAME_TYPE, name.type().code());
            w.endStructure(v);
        }
        else {
            throw new IllegalArgumentException("Unsupported attribute value: " + value);
        }
    }

    // ========================================================================
    // Response decoding
    // ========================================================================

    private static ResponseMessage decodeResponseMessage(TtlvItem root) throws TtlvFormatException
    {
        ResponseHeader header = decodeResponseHeader(root.require(TtlvTag.RESPONSE_HEADER));

        List<ResponseBatchItem> items = new ArrayList<>();
        for (TtlvItem item : root.all(TtlvTag.BATCH_ITEM)) {
            items.add(decodeBatchItem(item));
        }
        return new ResponseMessage(header, items);
    }

    private static ResponseHeader decodeResponseHeader(TtlvItem header) throws TtlvFormatException
    {
        TtlvItem pv = header.require(TtlvTag.PROTOCOL_VERSION);
        ProtocolVersion version = new ProtocolVersion(
                nonNegative(pv.require(TtlvTag.PROTOCOL_VERSION_MAJOR)),
                nonNegative(pv.require(TtlvTag.PROTOCOL_VERSION_MINOR)));

        return new ResponseHeader(
                version,
                header.require(TtlvTag.TIME_STAMP).asDateTime(),
                header.require(TtlvTag.BATCH_COUNT).asInteger());
    }

    private static ResponseBatchItem decodeBatchItem(TtlvItem item) throws TtlvFormatException
    {
        Optional<Operation> operation = Optional.empty();
        Optional<TtlvItem> opItem = item.find(TtlvTag.OPERATION);
        if (opItem.isPresent()) {
            int code = opItem.get().asEnumeration();
            operation = Optional.of(Operation.fromCode(code).orElseThrow(
                    () -> new TtlvFormatException("Unsupported operation 0x" + Integer.toHexString(code))));
        }

        int statusCode = item.require(TtlvTag.RESULT_STATUS).asEnumeration();
        ResultStatus status = ResultStatus.fromCode(statusCode).orElseThrow(
                () -> new TtlvFormatException("Unknown result status " + statusCode));

        // Reasons added by later protocol revisions are reported as a general failure.
        Optional<ResultReason> reason = Optional.empty();
        Optional<TtlvItem> reasonItem = item.find(TtlvTag.RESULT_REASON);
        if (reasonItem.isPresent()) {
            reason = Optional.of(ResultReason.fromCode(reasonItem.get().asEnumeration())
                    .orElse(ResultReason.GENERAL_FAILURE));
        }

        Optional<String> message = Optional.empty();
        Optional<TtlvItem> messageItem = item.find(TtlvTag.RESULT_MESSAGE);
        if (messageItem.isPresent()) {
            message = Optional.of(messageItem.get().asTextString());
        }

        Optional<ResponsePayload> payload = Optional.empty();
        Optional<TtlvItem> payloadItem = item.find(TtlvTag.RESPONSE_PAYLOAD);
        if (payloadItem.isPresent()) {
            if (operation.isEmpty()) {
                throw new TtlvFormatException("Response payload present without an operation");
            }
            payload = Optional.of(decodePayload(operation.get(), payloadItem.get()));
        }

        return new ResponseBatchItem(operation, status, reason, message, payload);
    }

    private static ResponsePayload decodePayload(Operation operation, TtlvItem payload) throws TtlvFormatException
    {
        if (!payload.isStructure()) {
            throw new TtlvFormatException("Response payload must be a structure");
        }
        return switch (operation) {
            case CREATE -> new ResponsePayload.Create(
                    objectType(payload.require(TtlvTag.OBJECT_TYPE)),
                    payload.require(TtlvTag.UNIQUE_IDENTIFIER).asTextString());
            case DESTROY -> new ResponsePayload.Destroy(
                    payload.require(TtlvTag.UNIQUE_IDENTIFIER).asTextString());
            case GET -> decodeGetPayload(payload);
        };
    }

    private static ResponsePayload.Get decodeGetPayload(TtlvItem payload) throws TtlvFormatException
    {
        ObjectType type = objectType(payload.require(TtlvTag.OBJECT_TYPE));
        String uid = payload.require(TtlvTag.UNIQUE_IDENTIFIER).asTextString();

        if (!type.carriesKeyBlock()) {
            return new ResponsePayload.Get(type, uid, Optional.empty());
        }

        TtlvItem object = payload.require(objectTag(type));
        return new ResponsePayload.Get(type, uid, Optional.of(decodeKeyBlock(object.require(TtlvTag.KEY_BLOCK))));
    }

    private static KeyBlock decodeKeyBlock(TtlvItem block) throws TtlvFormatException
    {
        int formatCode = block.require(TtlvTag.KEY_FORMAT_TYPE).asEnumeration();
        KeyFormatType format = KeyFormatType.fromCode(formatCode).orElseThrow(
                () -> new TtlvFormatException("Unknown key format type 0x" + Integer.toHexString(formatCode)));

        // A wrapped key value is a byte string; an unwrapped one is a structure
        // whose key material is either a byte string or a transparent structure.
        byte[] material = null;
        TtlvItem keyValue = block.require(TtlvTag.KEY_VALUE);
        if (keyValue.isStructure()) {
            TtlvItem keyMaterial = keyValue.require(TtlvTag.KEY_MATERIAL);
            if (!keyMaterial.isStructure()) {
                material = keyMaterial.asByteString();
            }
        }
        else {
            material = keyValue.asByteString();
        }

        CryptographicAlgorithm algorithm = null;
        Optional<TtlvItem> algItem = block.find(TtlvTag.CRYPTOGRAPHIC_ALGORITHM);
        if (algItem.isPresent()) {
            algorithm = CryptographicAlgorithm.fromCode(algItem.get().asEnumeration()).orElse(null);
        }

        Integer length = null;
        Optional<TtlvItem> lengthItem = block.find(TtlvTag.CRYPTOGRAPHIC_LENGTH);
        if (lengthItem.isPresent()) {
            length = lengthItem.get().asInteger();
        }

        KeyWrappingData wrapping = null;
        Optional<TtlvItem> wrappingItem = block.find(TtlvTag.KEY_WRAPPING_DATA);
        if (wrappingItem.isPresent()) {
            wrapping = decodeKeyWrappingData(wrappingItem.get());
        }

        return new KeyBlock(format, material, algorithm, length, wrapping);
    }

    private static KeyWrappingData decodeKeyWrappingData(TtlvItem wrapping) throws TtlvFormatException
    {
        int methodCode = wrapping.require(TtlvTag.WRAPPING_METHOD).asEnumeration();
        WrappingMethod method = WrappingMethod.fromCode(methodCode).orElseThrow(
                () -> new TtlvFormatException("Unknown wrapping method " + methodCode));

        Optional<String> keyId = Optional.empty();
        Optional<TtlvItem> info = wrapping.find(TtlvTag.ENCRYPTION_KEY_INFORMATION);
        if (info.isPresent()) {
            keyId = Optional.of(info.get().require(TtlvTag.UNIQUE_IDENTIFIER).asTextString());
        }
        return new KeyWrappingData(method, keyId);
    }

    private static ObjectType objectType(TtlvItem item) throws TtlvFormatException
    {
        int code = item.asEnumeration();
        return ObjectType.fromCode(code).orElseThrow(
                () -> new TtlvFormatException("Unknown object type 0x" + Integer.toHexString(code)));
    }

    private static int objectTag(ObjectType type)
    {
        return switch (type) {
            case SYMMETRIC_KEY -> TtlvTag.SYMMETRIC_KEY;
            case PUBLIC_KEY -> TtlvTag.PUBLIC_KEY;
            case PRIVATE_KEY -> TtlvTag.PRIVATE_KEY;
            default -> throw new IllegalArgumentException(type + " does not carry a key block");
        };
    }

    private static int nonNegative(TtlvItem item) throws TtlvFormatException
    {
        int value = item.asInteger();
        if (value < 0) {
            throw new TtlvFormatException("Field " + TtlvTag.hex(item.tag()) + " must be non-negative");
        }
        return value;
    }
}
