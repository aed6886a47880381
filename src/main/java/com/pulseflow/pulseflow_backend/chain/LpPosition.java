package com.pulseflow.pulseflow_backend.chain;

import java.math.BigInteger;

/** The wallet's share of a pair, as reported by the automation contract. */
public record LpPosition(
        BigInteger lpBalance,
        String token0,
        String token1,
        BigInteger token0Amount,
        BigInteger token1Amount
) {
}
