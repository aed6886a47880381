package com.pulseflow.pulseflow_backend.chain;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Every blockchain read and write the engine needs. Amounts are base units (18 decimals), addresses are
 * 0x-prefixed hex. Writes are signed with the workflow's own wallet; implementations must serialize
 * writes per workflow so two overlapping runs cannot reuse a nonce.
 */
public interface ChainAdapter {

    String walletAddress(String workflowId);

    /** Address of the wrapped native coin (WPLS), used when a path or pair involves PLS. */
    String wrappedNativeToken();

    BigInteger nativeBalance(String workflowId);

    BigInteger tokenBalance(String workflowId, String token);

    Optional<PoolReserves> findPool(String tokenA, String tokenB);

    List<BigInteger> getAmountsOut(BigInteger amountIn, List<String> path);

    List<BigInteger> getAmountsIn(BigInteger amountOut, List<String> path);

    LpPosition lpPosition(String workflowId, String pairAddress);

    // ── writes ────────────────────────────────────────────────────────────────

    TransactionOutcome swapTokensForTokens(String workflowId, BigInteger amountIn, BigInteger amountOutMin,
                                           List<String> path, String to);

    TransactionOutcome swapPlsForTokens(String workflowId, BigInteger plsAmount, BigInteger amountOutMin,
                                        List<String> path, String to);

    TransactionOutcome swapTokensForPls(String workflowId, BigInteger amountIn, BigInteger amountOutMin,
                                        List<String> path, String to);

    TransactionOutcome addLiquidity(String workflowId, String tokenA, String tokenB,
                                    BigInteger amountADesired, BigInteger amountBDesired,
                                    BigInteger amountAMin, BigInteger amountBMin, String to);

    TransactionOutcome addLiquidityPls(String workflowId, String token, BigInteger amountTokenDesired,
                                       BigInteger amountTokenMin, BigInteger amountPlsMin,
                                       BigInteger plsAmount, String to);

    TransactionOutcome removeLiquidity(String workflowId, String tokenA, String tokenB, BigInteger liquidity,
                                       BigInteger amountAMin, BigInteger amountBMin, String to);

    TransactionOutcome removeLiquidityPls(String workflowId, String token, BigInteger liquidity,
                                          BigInteger amountTokenMin, BigInteger amountPlsMin, String to);

    TransactionOutcome transferToken(String workflowId, String token, String to, BigInteger amount);

    TransactionOutcome transferPls(String workflowId, String to, BigInteger amount);

    TransactionOutcome burnToken(String workflowId, String token, BigInteger amount);

    TransactionOutcome claimToken(String workflowId, String token, BigInteger amount);
}
