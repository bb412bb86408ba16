// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.Hash;

/**
 * Receipt for a mined transaction.
 *
 * <p>
 * {@code to} is null for contract creations, in which case
 * {@code contractAddress} holds the deployed address; otherwise
 * {@code contractAddress} is null.
 *
 * @param transactionHash   the hash of the executed transaction
 * @param blockHash         the hash of the block containing this transaction
 * @param blockNumber       the number of the block containing this transaction
 * @param from              the address that sent the transaction
 * @param to                the recipient address, or null for contract creation
 * @param contractAddress   the deployed contract address, or null
 * @param logs              the event logs emitted during execution
 * @param status            {@code true} if execution succeeded, {@code false} if reverted
 * @param cumulativeGasUsed the total gas used in the block up to and including this transaction
 */
public record TransactionReceipt(
        Hash transactionHash,
        Hash blockHash,
        long blockNumber,
        Address from,
        Address to,
        Address contractAddress,
        List<LogEntry> logs,
        boolean status,
        BigInteger cumulativeGasUsed) {

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(cumulativeGasUsed, "cumulativeGasUsed cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        logs = List.copyOf(logs);
    }
}
