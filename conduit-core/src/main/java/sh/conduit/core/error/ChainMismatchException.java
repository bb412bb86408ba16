// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Thrown when the connected chainId does not match the expected one.
 */
public final class ChainMismatchException extends ConduitException {

    private final long expected;
    private final long actual;

    public ChainMismatchException(final long expected, final long actual) {
        super("Chain ID mismatch: expected " + expected + " but connected to " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
