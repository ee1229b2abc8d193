// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.stream;

/**
 * Result codes prefixed to every response frame.
 */
public enum ResponseCode {
    /** A chunk carrying requested data */
    SUCCESS(0),
    /** The peer sent a request we will not serve, including requests over its rate limit */
    INVALID_REQUEST(1),
    /** Nothing was wrong with the request, this node failed to serve it */
    SERVER_ERROR(2),
    /** The requested data is not available on this node */
    RESOURCE_UNAVAILABLE(3);

    /** Message sent with {@link #SERVER_ERROR}, it deliberately carries no detail */
    public static final String GENERIC_ERROR_MESSAGE = "internal service error";
    /** Message sent with {@link #INVALID_REQUEST} when a peer is over its rate limit */
    public static final String RATE_LIMITED_MESSAGE = "rate limited";

    private final int wireValue;

    ResponseCode(final int wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * @return the byte written on the wire for this code
     */
    public int wireValue() {
        return wireValue;
    }
}
