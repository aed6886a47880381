package com.pulseflow.pulseflow_backend.chain;

import java.math.BigInteger;

/** Snapshot of a constant-product pair. */
public record PoolReserves(
        String pairAddress,
        String token0,
        String token1,
        BigInteger reserve0,
        BigInteger reserve1,
        BigInteger totalSupply
) {

    public BigInteger reserveOf(String token) {
        if (token0.equalsIgnoreCase(token)) return reserve0;
        if (token1.equalsIgnoreCase(token)) return reserve1;
        throw new IllegalArgumentException("Token " + token + " is not part of pair " + pairAddress);
    }

    public boolean isToken0(String token) {
        return token0.equalsIgnoreCase(token);
    }
}
