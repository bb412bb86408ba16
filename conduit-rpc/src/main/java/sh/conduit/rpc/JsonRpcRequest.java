// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Outbound JSON-RPC 2.0 envelope: {@code {"method","params","id","jsonrpc":"2.0"}}.
 */
@JsonPropertyOrder({"method", "params", "id", "jsonrpc"})
public record JsonRpcRequest(String method, List<?> params, long id, String jsonrpc) {

    public static final String VERSION = "2.0";

    public JsonRpcRequest {
        params = params == null ? List.of() : params;
    }

    public static JsonRpcRequest of(final String method, final List<?> params, final long id) {
        return new JsonRpcRequest(method, params, id, VERSION);
    }
}
