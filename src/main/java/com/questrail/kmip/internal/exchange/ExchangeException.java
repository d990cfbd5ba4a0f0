package com.questrail.kmip.internal.exchange;

import com.questrail.kmip.client.KmipStatus;

import java.util.Objects;

/**
 * Failure of one exchange phase, classified by the {@link KmipStatus} the
 * caller will eventually see.
 *
 * <p>Raised by the transmitter, receiver, context and result extractors;
 * caught only by {@link ExchangeOrchestrator}, which converts it into an
 * outcome after the working buffer has been released.</p>
 */
public final class ExchangeException extends Exception
{
    private final KmipStatus status;

    public ExchangeException(KmipStatus status, String message)
    {
        super(message);
        this.status = requireLocal(status);
    }

    public ExchangeException(KmipStatus status, String message, Throwable cause)
    {
        super(message, cause);
        this.status = requireLocal(status);
    }

    public KmipStatus status()
    {
        return status;
    }

    private static KmipStatus requireLocal(KmipStatus status)
    {
        Objects.requireNonNull(status, "status");
        if (status.isServerResult()) {
            throw new IllegalArgumentException(status + " is a server result, not an exchange failure");
        }
        return status;
    }
}
