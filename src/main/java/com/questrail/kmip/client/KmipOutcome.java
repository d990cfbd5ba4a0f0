package com.questrail.kmip.client;

import com.questrail.kmip.model.ResultReason;

import java.util.Objects;
import java.util.Optional;

/**
 * KmipOutcome
 * -----------------------------------------------------------------------------
 * Result of one KMIP call: a {@link KmipStatus} and, on success only, the
 * operation's output.
 *
 * <p>Outputs are never partially populated: a non-success outcome carries no
 * value. Server-reported failures may carry the result reason and message the
 * server supplied; locally raised failures carry a diagnostic message.</p>
 *
 * @param <T> the operation's output type ({@link Void} when there is none)
 */
public final class KmipOutcome<T>
{
    private final KmipStatus status;
    private final T value;
    private final ResultReason resultReason;
    private final String message;

    private KmipOutcome(KmipStatus status, T value, ResultReason resultReason, String message)
    {
        this.status = Objects.requireNonNull(status, "status");
        this.value = value;
        this.resultReason = resultReason;
        this.message = message;
    }

    public static <T> KmipOutcome<T> success(T value)
    {
        return new KmipOutcome<>(KmipStatus.SUCCESS, value, null, null);
    }

    /**
     * A server-reported, non-success result.
     */
    public static <T> KmipOutcome<T> serverResult(KmipStatus status, ResultReason reason, String message)
    {
        if (!status.isServerResult() || status.isSuccess()) {
            throw new IllegalArgumentException(status + " is not a server failure status");
        }
        return new KmipOutcome<>(status, null, reason, message);
    }

    /**
     * A failure raised by this client.
     */
    public static <T> KmipOutcome<T> failure(KmipStatus status, String message)
    {
        if (status.isServerResult()) {
            throw new IllegalArgumentException(status + " is reported by the server, not raised locally");
        }
        return new KmipOutcome<>(status, null, null, message);
    }

    public KmipStatus status()
    {
        return status;
    }

    public boolean isSuccess()
    {
        return status.isSuccess();
    }

    /**
     * The operation output; empty unless {@link #isSuccess()}, and empty for
     * operations without output.
     */
    public Optional<T> value()
    {
        return Optional.ofNullable(value);
    }

    public Optional<ResultReason> resultReason()
    {
        return Optional.ofNullable(resultReason);
    }

    public Optional<String> message()
    {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString()
    {
        // The value may be key material; only its presence is shown.
        return "KmipOutcome[" +
                "status=" + status +
                ", hasValue=" + (value != null) +
                (resultReason != null ? ", reason=" + resultReason : "") +
                (message != null ? ", message=" + message : "") +
                ']';
    }
}
