// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.error;

/**
 * Thrown when a subscription or receipt payload cannot be turned into its model type.
 */
public final class PayloadFormatException extends ConduitException {

    public PayloadFormatException(final String message) {
        super(message);
    }

    public PayloadFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
