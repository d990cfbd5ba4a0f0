package com.questrail.kmip.codec.impl;

import com.questrail.kmip.codec.EncodeResult;
import com.questrail.kmip.codec.KmipDecodeException;
import com.questrail.kmip.model.Attribute;
import com.questrail.kmip.model.CryptographicAlgorithm;
import com.questrail.kmip.model.CryptographicUsageMask;
import com.questrail.kmip.model.KeyBlock;
import com.questrail.kmip.model.KeyFormatType;
import com.questrail.kmip.model.ObjectType;
import com.questrail.kmip.model.Operation;
import com.questrail.kmip.model.ProtocolVersion;
import com.questrail.kmip.model.RequestBatchItem;
import com.questrail.kmip.model.RequestHeader;
import com.questrail.kmip.model.RequestMessage;
import com.questrail.kmip.model.RequestPayload;
import com.questrail.kmip.model.ResponseBatchItem;
import com.questrail.kmip.model.ResponseMessage;
import com.questrail.kmip.model.ResponsePayload;
import com.questrail.kmip.model.ResultReason;
import com.questrail.kmip.model.ResultStatus;
import com.questrail.kmip.model.TemplateAttribute;
import com.questrail.kmip.model.WrappingMethod;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultKmipCodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultKmipCodec}.
 *
 * <p>Encoded requests are checked by reading them back with
 * {@link TtlvReader}; responses come from {@link KmipResponseFrames}.</p>
 */
final class DefaultKmipCodecTest
{
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final DefaultKmipCodec codec = new DefaultKmipCodec();

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    @Test
    void encodesDestroyRequestWithSingleBatchItem() throws Exception
    {
        ByteBuffer target = ByteBuffer.allocate(1024);
        EncodeResult result = codec.encodeRequest(request(new RequestPayload.Destroy("key-42")), target);

        EncodeResult.Encoded encoded = assertInstanceOf(EncodeResult.Encoded.class, result);
        assertEquals(target.position(), encoded.length());
        assertEquals(0, encoded.length() % 8);

        byte[] bytes = Arrays.copyOf(target.array(), encoded.length());
        assertArrayEquals(new byte[] { 0x42, 0x00, 0x78, 0x01 }, Arrays.copyOf(bytes, 4));
        assertEquals(encoded.length() - 8, ByteBuffer.wrap(bytes, 4, 4).getInt());

        TtlvItem root = TtlvReader.read(ByteBuffer.wrap(bytes));
        TtlvItem header = root.require(TtlvTag.REQUEST_HEADER);
        TtlvItem version = header.require(TtlvTag.PROTOCOL_VERSION);
        assertEquals(1, version.require(TtlvTag.PROTOCOL_VERSION_MAJOR).asInteger());
        assertEquals(2, version.require(TtlvTag.PROTOCOL_VERSION_MINOR).asInteger());
        assertEquals(4096, header.require(TtlvTag.MAXIMUM_RESPONSE_SIZE).asInteger());
        assertEquals(NOW, header.require(TtlvTag.TIME_STAMP).asDateTime());
        assertEquals(1, header.require(TtlvTag.BATCH_COUNT).asInteger());

        List<TtlvItem> items = root.all(TtlvTag.BATCH_ITEM);
        assertEquals(1, items.size());
        assertEquals(Operation.DESTROY.code(), items.get(0).require(TtlvTag.OPERATION).asEnumeration());
        assertEquals("key-42", items.get(0).require(TtlvTag.REQUEST_PAYLOAD)
                .require(TtlvTag.UNIQUE_IDENTIFIER).asTextString());
    }

    @Test
    void encodesCreateTemplateAttributes() throws Exception
    {
        TemplateAttribute template = TemplateAttribute.of(
                Attribute.cryptographicAlgorithm(CryptographicAlgorithm.AES),
                Attribute.cryptographicLength(256),
                Attribute.cryptographicUsageMask(CryptographicUsageMask.ENCRYPT | CryptographicUsageMask.DECRYPT),
                Attribute.name("backup-key"));

        ByteBuffer target = ByteBuffer.allocate(2048);
        EncodeResult result = codec.encodeRequest(
                request(new RequestPayload.Create(ObjectType.SYMMETRIC_KEY, template)), target);
        assertInstanceOf(EncodeResult.Encoded.class, result);

        TtlvItem payload = TtlvReader.read(ByteBuffer.wrap(target.array(), 0, target.position()))
                .require(TtlvTag.BATCH_ITEM)
                .require(TtlvTag.REQUEST_PAYLOAD);
        assertEquals(ObjectType.SYMMETRIC_KEY.code(), payload.require(TtlvTag.OBJECT_TYPE).asEnumeration());

        List<TtlvItem> attributes = payload.require(TtlvTag.TEMPLATE_ATTRIBUTE).all(TtlvTag.ATTRIBUTE);
        assertEquals(4, attributes.size());

        assertEquals(Attribute.CRYPTOGRAPHIC_ALGORITHM, attributes.get(0).require(TtlvTag.ATTRIBUTE_NAME).asTextString());
        assertEquals(CryptographicAlgorithm.AES.code(), attributes.get(0).require(TtlvTag.ATTRIBUTE_VALUE).asEnumeration());
        assertEquals(256, attributes.get(1).require(TtlvTag.ATTRIBUTE_VALUE).asInteger());
        assertEquals(0x000C, attributes.get(2).require(TtlvTag.ATTRIBUTE_VALUE).asInteger());

        TtlvItem name = attributes.get(3).require(TtlvTag.ATTRIBUTE_VALUE);
        assertTrue(name.isStructure());
        assertEquals("backup-key", name.require(TtlvTag.NAME_VALUE).asTextString());
        assertEquals(1, name.require(TtlvTag.NAME_TYPE).asEnumeration());
    }

    @Test
    void reportsBufferTooSmallWhenTargetRunsOut()
    {
        EncodeResult result = codec.encodeRequest(request(new RequestPayload.Get("key-1")), ByteBuffer.allocate(40));
        assertInstanceOf(EncodeResult.BufferTooSmall.class, result);
    }

    @Test
    void encodedLengthIsIndependentOfTargetCapacity()
    {
        RequestMessage message = request(new RequestPayload.Get("key-1"));
        EncodeResult small = codec.encodeRequest(message, ByteBuffer.allocate(256));
        EncodeResult large = codec.encodeRequest(message, ByteBuffer.allocate(4096));
        assertEquals(small, large);
    }

    @Test
    void littleEndianTargetIsAnEncodingFailure()
    {
        ByteBuffer target = ByteBuffer.allocate(1024).order(ByteOrder.LITTLE_ENDIAN);
        EncodeResult result = codec.encodeRequest(request(new RequestPayload.Get("key-1")), target);
        assertInstanceOf(EncodeResult.Failed.class, result);
    }

    @Test
    void emptyIdentifierIsAnEncodingFailure()
    {
        EncodeResult result = codec.encodeRequest(request(new RequestPayload.Destroy("")), ByteBuffer.allocate(1024));
        EncodeResult.Failed failed = assertInstanceOf(EncodeResult.Failed.class, result);
        assertTrue(failed.reason().contains("empty"));
    }

    // ---------------------------------------------------------------------
    // Decoding
    // ---------------------------------------------------------------------

    @Test
    void decodesCreateResponse()
    {
        ResponseMessage response = decode(KmipResponseFrames.createSuccess("1f165d65-cbbd-4bd6-9867-80e0b390acf9"));

        assertEquals(1, response.header().batchCount());
        assertEquals(ProtocolVersion.KMIP_1_0, response.header().protocolVersion());
        assertEquals(KmipResponseFrames.TIME_STAMP, response.header().timeStamp());

        ResponseBatchItem item = response.batchItems().get(0);
        assertEquals(Operation.CREATE, item.operation().orElseThrow());
        assertEquals(ResultStatus.SUCCESS, item.resultStatus());

        ResponsePayload.Create payload = assertInstanceOf(ResponsePayload.Create.class, item.payload().orElseThrow());
        assertEquals(ObjectType.SYMMETRIC_KEY, payload.objectType());
        assertEquals("1f165d65-cbbd-4bd6-9867-80e0b390acf9", payload.uniqueIdentifier());
    }

    @Test
    void decodesRawSymmetricKey()
    {
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) 0x11);

        ResponsePayload.Get payload = assertInstanceOf(ResponsePayload.Get.class,
                decode(KmipResponseFrames.rawSymmetricKey("key-7", key)).batchItems().get(0).payload().orElseThrow());

        assertEquals(ObjectType.SYMMETRIC_KEY, payload.objectType());
        KeyBlock block = payload.keyBlock().orElseThrow();
        assertEquals(KeyFormatType.RAW, block.keyFormatType());
        assertArrayEquals(key, block.keyMaterial().orElseThrow());
        assertEquals(CryptographicAlgorithm.AES, block.cryptographicAlgorithm().orElseThrow());
        assertEquals(256, block.cryptographicLength().orElseThrow());
        assertTrue(block.keyWrappingData().isEmpty());
    }

    @Test
    void decodesKeyWrappingData()
    {
        byte[] frame = KmipResponseFrames.response()
                .getItem(ObjectType.SYMMETRIC_KEY, "key-8", KeyFormatType.RAW, new byte[24], true)
                .build();

        ResponsePayload.Get payload = (ResponsePayload.Get) decode(frame).batchItems().get(0).payload().orElseThrow();
        var wrapping = payload.keyBlock().orElseThrow().keyWrappingData().orElseThrow();
        assertEquals(WrappingMethod.ENCRYPT, wrapping.wrappingMethod());
        assertEquals("wrapping-key-1", wrapping.encryptionKeyIdentifier().orElseThrow());
    }

    @Test
    void decodesNonKeyObjectWithoutKeyBlock()
    {
        byte[] frame = KmipResponseFrames.response()
                .getItem(ObjectType.CERTIFICATE, "cert-1", KeyFormatType.RAW, new byte[0], false)
                .build();

        ResponsePayload.Get payload = (ResponsePayload.Get) decode(frame).batchItems().get(0).payload().orElseThrow();
        assertEquals(ObjectType.CERTIFICATE, payload.objectType());
        assertTrue(payload.keyBlock().isEmpty());
    }

    @Test
    void decodesServerFailure()
    {
        ResponseBatchItem item = decode(KmipResponseFrames.failure(
                Operation.GET, ResultStatus.OPERATION_FAILED, ResultReason.ITEM_NOT_FOUND, "no such key"))
                .batchItems().get(0);

        assertEquals(ResultStatus.OPERATION_FAILED, item.resultStatus());
        assertEquals(ResultReason.ITEM_NOT_FOUND, item.resultReason().orElseThrow());
        assertEquals("no such key", item.resultMessage().orElseThrow());
        assertTrue(item.payload().isEmpty());
    }

    @Test
    void unknownResultReasonBecomesGeneralFailure()
    {
        ByteBuffer out = ByteBuffer.allocate(512);
        TtlvWriter w = new TtlvWriter(out);
        int message = w.beginStructure(TtlvTag.RESPONSE_MESSAGE);
        writeHeader(w, 1);
        int bi = w.beginStructure(TtlvTag.BATCH_ITEM);
        w.writeEnumeration(TtlvTag.RESULT_STATUS, ResultStatus.OPERATION_FAILED.code());
        w.writeEnumeration(TtlvTag.RESULT_REASON, 0x0777);
        w.endStructure(bi);
        w.endStructure(message);

        ResponseBatchItem item = decode(Arrays.copyOf(out.array(), out.position())).batchItems().get(0);
        assertEquals(ResultReason.GENERAL_FAILURE, item.resultReason().orElseThrow());
        assertTrue(item.operation().isEmpty());
    }

    @Test
    void keepsDisagreeingBatchCountForTheCaller()
    {
        ResponseMessage response = decode(KmipResponseFrames.response()
                .declaringBatchCount(2)
                .destroyItem("key-1")
                .build());

        assertEquals(2, response.header().batchCount());
        assertEquals(1, response.batchItems().size());
    }

    @Test
    void rejectsTrailingBytes()
    {
        byte[] frame = KmipResponseFrames.destroySuccess("key-1");
        byte[] padded = Arrays.copyOf(frame, frame.length + 8);
        assertThrows(KmipDecodeException.class, () -> codec.decodeResponse(ByteBuffer.wrap(padded)));
    }

    @Test
    void rejectsTruncatedFrame()
    {
        byte[] frame = KmipResponseFrames.destroySuccess("key-1");
        byte[] truncated = Arrays.copyOf(frame, frame.length - 16);
        KmipDecodeException e = assertThrows(KmipDecodeException.class,
                () -> codec.decodeResponse(ByteBuffer.wrap(truncated)));
        assertTrue(e.getMessage().startsWith("Malformed KMIP response"));
    }

    @Test
    void rejectsRequestMessageAsResponse()
    {
        ByteBuffer target = ByteBuffer.allocate(1024);
        codec.encodeRequest(request(new RequestPayload.Get("key-1")), target);
        target.flip();
        assertThrows(KmipDecodeException.class, () -> codec.decodeResponse(target));
    }

    @Test
    void rejectsAllZeroFrame()
    {
        assertThrows(KmipDecodeException.class, () -> codec.decodeResponse(ByteBuffer.wrap(new byte[24])));
    }

    @Test
    void rejectsPayloadWithoutOperation()
    {
        ByteBuffer out = ByteBuffer.allocate(512);
        TtlvWriter w = new TtlvWriter(out);
        int message = w.beginStructure(TtlvTag.RESPONSE_MESSAGE);
        writeHeader(w, 1);
        int bi = w.beginStructure(TtlvTag.BATCH_ITEM);
        w.writeEnumeration(TtlvTag.RESULT_STATUS, ResultStatus.SUCCESS.code());
        int p = w.beginStructure(TtlvTag.RESPONSE_PAYLOAD);
        w.writeTextString(TtlvTag.UNIQUE_IDENTIFIER, "key-1");
        w.endStructure(p);
        w.endStructure(bi);
        w.endStructure(message);

        assertThrows(KmipDecodeException.class,
                () -> codec.decodeResponse(ByteBuffer.wrap(out.array(), 0, out.position())));
    }

    @Test
    void rejectsTimeStampOutsideInstantRange()
    {
        byte[] frame = KmipResponseFrames.destroySuccess("key-1");
        byte[] timeStampHeader = { 0x42, 0x00, (byte) 0x92, 0x09, 0x00, 0x00, 0x00, 0x08 };
        int at = indexOf(frame, timeStampHeader);
        assertTrue(at > 0);
        ByteBuffer.wrap(frame, at + 8, 8).putLong(Long.MAX_VALUE);

        KmipDecodeException e = assertThrows(KmipDecodeException.class,
                () -> codec.decodeResponse(ByteBuffer.wrap(frame)));
        assertTrue(e.getMessage().contains("Date-Time"), e.getMessage());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private ResponseMessage decode(byte[] frame)
    {
        return codec.decodeResponse(ByteBuffer.wrap(frame));
    }

    private static RequestMessage request(RequestPayload payload)
    {
        return new RequestMessage(
                new RequestHeader(ProtocolVersion.KMIP_1_2, 4096, NOW, 1),
                List.of(RequestBatchItem.of(payload)));
    }

    private static int indexOf(byte[] haystack, byte[] needle)
    {
        outer:
        for (int i = 0; i + needle.length <= haystack.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static void writeHeader(TtlvWriter w, int batchCount)
    {
        int header = w.beginStructure(TtlvTag.RESPONSE_HEADER);
        int pv = w.beginStructure(TtlvTag.PROTOCOL_VERSION);
        w.writeInteger(TtlvTag.PROTOCOL_VERSION_MAJOR, 1);
        w.writeInteger(TtlvTag.PROTOCOL_VERSION_MINOR, 0);
        w.endStructure(pv);
        w.writeDateTime(TtlvTag.TIME_STAMP, NOW);
        w.writeInteger(TtlvTag.BATCH_COUNT, batchCount);
        w.endStructure(header);
    }
}
