// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.stream;

import static java.lang.System.Logger.Level.TRACE;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import com.hedera.pbj.runtime.io.stream.WritableStreamingData;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.hiero.history.node.spi.stream.ResponseCode;
import org.hiero.history.node.spi.stream.ResponseStream;

/**
 * {@link ResponseStream} writing frames to a byte stream. Every frame is the response code byte, the payload length as
 * an unsigned protobuf varint and the payload. The end of the response is the end of the byte stream.
 * <p>
 * Blocking writes cannot be interrupted, so the write deadline is enforced before each frame is started.
 */
public final class LengthPrefixedResponseStream implements ResponseStream {
    /** The logger for this class. */
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final String remotePeer;
    private final String protocol;
    private final OutputStream out;
    private final WritableStreamingData data;
    private final Clock clock;
    private volatile Instant readDeadline = Instant.MAX;
    private volatile Instant writeDeadline = Instant.MAX;
    private volatile boolean closed;

    /**
     * @param remotePeer the remote peer identifier
     * @param protocol the protocol the stream was opened for
     * @param out the byte stream to the peer, owned by this stream from now on
     * @param clock clock used to check deadlines
     */
    public LengthPrefixedResponseStream(
            @NonNull final String remotePeer,
            @NonNull final String protocol,
            @NonNull final OutputStream out,
            @NonNull final Clock clock) {
        this.remotePeer = Objects.requireNonNull(remotePeer);
        this.protocol = Objects.requireNonNull(protocol);
        this.out = Objects.requireNonNull(out);
        this.data = new WritableStreamingData(out);
        this.clock = Objects.requireNonNull(clock);
    }

    @NonNull
    @Override
    public String remotePeer() {
        return remotePeer;
    }

    @NonNull
    @Override
    public String protocol() {
        return protocol;
    }

    @Override
    public void setReadDeadline(@NonNull final Instant deadline) {
        readDeadline = Objects.requireNonNull(deadline);
    }

    @Override
    public void setWriteDeadline(@NonNull final Instant deadline) {
        writeDeadline = Objects.requireNonNull(deadline);
    }

    /**
     * @return the current read deadline, {@link Instant#MAX} if never set
     */
    @NonNull
    public Instant readDeadline() {
        return readDeadline;
    }

    @Override
    public void writeChunk(@NonNull final Bytes payload) throws IOException {
        writeFrame(ResponseCode.SUCCESS, payload);
    }

    @Override
    public void writeErrorResponse(@NonNull final ResponseCode code, @NonNull final String message)
            throws IOException {
        if (code == ResponseCode.SUCCESS) {
            throw new IllegalArgumentException("error response needs an error code");
        }
        writeFrame(code, Bytes.wrap(message.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.flush();
        } finally {
            out.close();
        }
        LOGGER.log(TRACE, "Closed response stream to {0}", remotePeer);
    }

    @Override
    public synchronized void reset() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        out.close();
        LOGGER.log(TRACE, "Reset response stream to {0}", remotePeer);
    }

    private synchronized void writeFrame(final ResponseCode code, final Bytes payload) throws IOException {
        if (closed) {
            throw new IOException("stream to " + remotePeer + " is closed");
        }
        if (!clock.instant().isBefore(writeDeadline)) {
            throw new SocketTimeoutException("write deadline exceeded for stream to " + remotePeer);
        }
        try {
            data.writeByte((byte) code.wireValue());
            data.writeVarInt(Math.toIntExact(payload.length()), false);
            data.writeBytes(payload);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        out.flush();
    }
}
