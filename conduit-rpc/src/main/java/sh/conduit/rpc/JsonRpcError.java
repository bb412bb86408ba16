// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error member of an inbound JSON-RPC response. Any field may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(Integer code, String message, Object data) {}
