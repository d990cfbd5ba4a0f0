package com.questrail.kmip.codec;

import com.questrail.kmip.model.RequestMessage;
import com.questrail.kmip.model.ResponseMessage;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Test codec with scripted behavior.
 *
 * <p>Encoding writes {@code encodedLength} bytes of {@code 0x5A} and reports
 * "buffer too small" whenever the target has less room than that. Decoding
 * returns the configured response, or throws the configured exception, and
 * records the frame it was given.</p>
 */
public final class StubKmipCodec implements KmipCodec {

    private int encodedLength = 64;
    private String encodeFailure;
    private int forcedTooSmall;

    private ResponseMessage response;
    private RuntimeException decodeFailure;

    private final List<Integer> encodeCapacities = new ArrayList<>();
    private final List<byte[]> decodedFrames = new ArrayList<>();

    public StubKmipCodec encodesTo(int length) {
        this.encodedLength = length;
        return this;
    }

    /**
     * Report "buffer too small" on the next {@code times} attempts regardless
     * of the target's size.
     */
    public StubKmipCodec tooSmall(int times) {
        this.forcedTooSmall = times;
        return this;
    }

    public StubKmipCodec failEncodingWith(String reason) {
        this.encodeFailure = reason;
        return this;
    }

    public StubKmipCodec decodesTo(ResponseMessage response) {
        this.response = response;
        return this;
    }

    public StubKmipCodec failDecodingWith(RuntimeException failure) {
        this.decodeFailure = failure;
        return this;
    }

    @Override
    public EncodeResult encodeRequest(RequestMessage request, ByteBuffer target) {
        encodeCapacities.add(target.remaining());
        if (encodeFailure != null) {
            return EncodeResult.failed(encodeFailure);
        }
        if (forcedTooSmall > 0) {
            forcedTooSmall--;
            return EncodeResult.bufferTooSmall();
        }
        if (target.remaining() < encodedLength) {
            return EncodeResult.bufferTooSmall();
        }
        for (int i = 0; i < encodedLength; i++) {
            target.put((byte) 0x5A);
        }
        return EncodeResult.encoded(encodedLength);
    }

    @Override
    public ResponseMessage decodeResponse(ByteBuffer frame) {
        byte[] copy = new byte[frame.remaining()];
        frame.duplicate().get(copy);
        decodedFrames.add(copy);
        if (decodeFailure != null) {
            throw decodeFailure;
        }
        return response;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Capacity offered to each encode attempt, in order.
     */
    public List<Integer> encodeCapacities() {
        return Collections.unmodifiableList(encodeCapacities);
    }

    public List<byte[]> decodedFrames() {
        return Collections.unmodifiableList(decodedFrames);
    }
}
