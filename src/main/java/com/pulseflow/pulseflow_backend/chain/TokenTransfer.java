package com.pulseflow.pulseflow_backend.chain;

import java.math.BigInteger;

/** A decoded ERC-20 {@code Transfer} log. */
public record TokenTransfer(String token, String from, String to, BigInteger value) {
}
