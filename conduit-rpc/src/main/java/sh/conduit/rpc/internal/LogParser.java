// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.internal;

import static sh.conduit.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import sh.conduit.core.error.PayloadFormatException;
import sh.conduit.core.model.LogEntry;
import sh.conduit.core.model.TransactionReceipt;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;

/**
 * Turns raw JSON-RPC payloads (maps as produced by Jackson) into
 * {@link LogEntry} and {@link TransactionReceipt} values.
 *
 * <p>
 * Malformed payloads surface as {@link PayloadFormatException}.
 */
public final class LogParser {

    private LogParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a list of raw log maps into LogEntry objects.
     *
     * @param value the raw value (typically a List of Maps); null yields an empty list
     * @return list of parsed LogEntry objects
     */
    public static List<LogEntry> parseLogs(final Object value) {
        if (value == null) {
            return List.of();
        }
        final List<Map<String, Object>> rawLogs;
        try {
            rawLogs = MAPPER.convertValue(value, new TypeReference<List<Map<String, Object>>>() {});
        } catch (IllegalArgumentException e) {
            throw new PayloadFormatException("Expected a list of log objects: " + value, e);
        }
        final var logs = new ArrayList<LogEntry>(rawLogs.size());
        for (Map<String, Object> map : rawLogs) {
            logs.add(parseLog(map));
        }
        return List.copyOf(logs);
    }

    /**
     * Parses a single log entry map.
     *
     * <p><strong>Null Handling:</strong>
     * <ul>
     *   <li>{@code address}, {@code transactionHash} - required</li>
     *   <li>{@code data} - null maps to {@link HexData#EMPTY}</li>
     *   <li>{@code blockHash}, {@code blockNumber} - null for pending logs</li>
     *   <li>{@code topics} - null maps to an empty list</li>
     *   <li>{@code logIndex} - defaults to 0</li>
     *   <li>{@code removed} - defaults to false</li>
     * </ul>
     *
     * @param map the raw map
     * @return parsed LogEntry
     * @throws PayloadFormatException if a required field is missing or a value is not valid hex
     */
    public static LogEntry parseLog(final Map<String, Object> map) {
        try {
            final @Nullable String address = RpcUtils.stringValue(map.get("address"));
            final @Nullable String data = RpcUtils.stringValue(map.get("data"));
            final @Nullable String blockHash = RpcUtils.stringValue(map.get("blockHash"));
            final @Nullable String txHash = RpcUtils.stringValue(map.get("transactionHash"));
            final @Nullable Long logIndex = RpcUtils.decodeHexLong(map.get("logIndex"));

            final @Nullable List<String> topicsHex = MAPPER.convertValue(
                    map.get("topics"),
                    new TypeReference<List<String>>() {}
            );
            final List<Hash> topics = topicsHex != null
                    ? topicsHex.stream().map(Hash::new).toList()
                    : List.of();

            return new LogEntry(
                    new Address(required(address, "address", map)),
                    data != null ? new HexData(data) : HexData.EMPTY,
                    topics,
                    blockHash != null ? new Hash(blockHash) : null,
                    RpcUtils.decodeHexLong(map.get("blockNumber")),
                    new Hash(required(txHash, "transactionHash", map)),
                    logIndex != null ? logIndex : 0L,
                    Boolean.TRUE.equals(map.get("removed")));
        } catch (IllegalArgumentException e) {
            throw new PayloadFormatException("Malformed log entry: " + map, e);
        }
    }

    /**
     * Parses a transaction receipt map, including its logs.
     *
     * <p>
     * {@code status} is {@code 0x1} for success. {@code to} is null for contract
     * creation, in which case {@code contractAddress} is set.
     *
     * @param map the raw receipt map
     * @return parsed receipt
     * @throws PayloadFormatException if a required field is missing or malformed
     */
    public static TransactionReceipt parseReceipt(final Map<String, Object> map) {
        try {
            final @Nullable String to = RpcUtils.stringValue(map.get("to"));
            final @Nullable String contractAddress = RpcUtils.stringValue(map.get("contractAddress"));
            final @Nullable Long blockNumber = RpcUtils.decodeHexLong(map.get("blockNumber"));
            return new TransactionReceipt(
                    new Hash(required(RpcUtils.stringValue(map.get("transactionHash")), "transactionHash", map)),
                    new Hash(required(RpcUtils.stringValue(map.get("blockHash")), "blockHash", map)),
                    blockNumber != null ? blockNumber : 0L,
                    new Address(required(RpcUtils.stringValue(map.get("from")), "from", map)),
                    to != null ? new Address(to) : null,
                    contractAddress != null ? new Address(contractAddress) : null,
                    parseLogs(map.get("logs")),
                    "0x1".equals(RpcUtils.stringValue(map.get("status"))),
                    RpcUtils.decodeHexBigInteger(map.get("cumulativeGasUsed")));
        } catch (IllegalArgumentException e) {
            throw new PayloadFormatException("Malformed transaction receipt: " + map, e);
        }
    }

    private static String required(final @Nullable String value, final String field, final Map<String, Object> map) {
        if (value == null) {
            throw new PayloadFormatException("Missing " + field + " in " + map);
        }
        return value;
    }
}
