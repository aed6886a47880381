package com.pulseflow.pulseflow_backend.chain;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Mined, successful transaction. Reverted transactions never produce an outcome; the adapter
 * throws instead.
 */
public record TransactionOutcome(
        String txHash,
        BigInteger gasPrice,
        BigInteger gasUsed,
        List<TokenTransfer> transfers
) {

    public TransactionOutcome {
        gasPrice = gasPrice != null ? gasPrice : BigInteger.ZERO;
        gasUsed = gasUsed != null ? gasUsed : BigInteger.ZERO;
        transfers = transfers != null ? List.copyOf(transfers) : List.of();
    }

    /** Sum of {@code token} transferred to {@code recipient} in this transaction. */
    public BigInteger receivedBy(String token, String recipient) {
        return transfers.stream()
                .filter(t -> t.token().equalsIgnoreCase(token) && t.to().equalsIgnoreCase(recipient))
                .map(TokenTransfer::value)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /** Sum of {@code token} that left {@code sender} in this transaction. */
    public BigInteger sentFrom(String token, String sender) {
        return transfers.stream()
                .filter(t -> t.token().equalsIgnoreCase(token) && t.from().equalsIgnoreCase(sender))
                .map(TokenTransfer::value)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /** Value of the first {@code token} transfer to {@code recipient}, in log order. */
    public Optional<BigInteger> firstReceivedBy(String token, String recipient) {
        return transfers.stream()
                .filter(t -> t.token().equalsIgnoreCase(token) && t.to().equalsIgnoreCase(recipient))
                .map(TokenTransfer::value)
                .findFirst();
    }

    /** Value of the first {@code token} transfer in log order, whoever received it. */
    public Optional<BigInteger> firstOf(String token) {
        return transfers.stream()
                .filter(t -> t.token().equalsIgnoreCase(token))
                .map(TokenTransfer::value)
                .findFirst();
    }
}
