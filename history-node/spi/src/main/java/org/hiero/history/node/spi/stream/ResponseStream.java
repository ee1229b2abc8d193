// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.stream;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.time.Instant;

/**
 * One inbound peer stream as seen by a request handler. The transport behind it owns framing and delivery, the
 * handler only decides what is written and when the stream ends.
 */
public interface ResponseStream {

    /**
     * @return an identifier of the remote peer, stable for the lifetime of the connection
     */
    @NonNull
    String remotePeer();

    /**
     * @return the protocol identifier the stream was opened for
     */
    @NonNull
    String protocol();

    /**
     * Set the point in time after which reads from the peer fail. Independent of any handler context deadline.
     *
     * @param deadline the read deadline
     */
    void setReadDeadline(@NonNull Instant deadline);

    /**
     * Set the point in time after which writes to the peer fail. Independent of any handler context deadline.
     *
     * @param deadline the write deadline
     */
    void setWriteDeadline(@NonNull Instant deadline);

    /**
     * Write one successful response chunk.
     *
     * @param payload the encoded chunk content
     * @throws IOException if the chunk could not be written
     */
    void writeChunk(@NonNull Bytes payload) throws IOException;

    /**
     * Write an error response frame.
     *
     * @param code the error code, never {@link ResponseCode#SUCCESS}
     * @param message the error message sent to the peer
     * @throws IOException if the frame could not be written
     */
    void writeErrorResponse(@NonNull ResponseCode code, @NonNull String message) throws IOException;

    /**
     * Close the stream cleanly, telling the peer the response is complete.
     *
     * @throws IOException if the stream could not be closed
     */
    void close() throws IOException;

    /**
     * Abort the stream without a clean close. Used once the response has failed.
     *
     * @throws IOException if the stream could not be reset
     */
    void reset() throws IOException;
}
