// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.model;

import java.util.List;
import java.util.Objects;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;
import sh.conduit.core.types.HexData;

/**
 * Represents an event log entry emitted by a smart contract.
 *
 * <p>
 * <strong>Nullability:</strong>
 * <ul>
 * <li>{@code blockHash} and {@code blockNumber} - can be {@code null} for logs
 * from pending transactions</li>
 * <li>All other fields are required and cannot be null</li>
 * </ul>
 *
 * @param address         the address of the contract that emitted the log
 * @param data            the non-indexed log data (may be empty)
 * @param topics          the indexed log topics (may be empty; topic[0] is
 *                        usually the event signature)
 * @param blockHash       the hash of the block containing this log
 * @param blockNumber     the number of the block containing this log
 * @param transactionHash the hash of the transaction that generated this log
 * @param logIndex        the index of this log within the block
 * @param removed         true if this log was removed due to a chain reorganization
 */
public record LogEntry(
        Address address,
        HexData data,
        List<Hash> topics,
        Hash blockHash,
        Long blockNumber,
        Hash transactionHash,
        long logIndex,
        boolean removed) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        topics = List.copyOf(topics);
    }
}
