package com.pulseflow.pulseflow_backend.chain;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * In-memory chain for engine and executor tests. Reads come from the maps below; writes are recorded and
 * answered with a canned outcome per operation, or fail with a canned exception.
 */
public class FakeChainAdapter implements ChainAdapter {

    public static final String WALLET = "0x1111111111111111111111111111111111111111";
    public static final String WPLS = "0xA1077a294dDE1B09bB078844df40758a5D0f9a27";
    public static final BigInteger DEFAULT_GAS_PRICE = BigInteger.valueOf(30_000_000_000L);

    public BigInteger nativeBalance = BigInteger.ZERO;
    // Served one per call before falling back to nativeBalance
    public final Deque<BigInteger> queuedNativeBalances = new ArrayDeque<>();
    public final Map<String, BigInteger> tokenBalances = new HashMap<>();
    public final List<PoolReserves> pools = new ArrayList<>();
    public final Map<String, LpPosition> lpPositions = new HashMap<>();
    public BiFunction<BigInteger, List<String>, List<BigInteger>> amountsOut = (in, path) -> {
        List<BigInteger> amounts = new ArrayList<>();
        BigInteger current = in;
        for (int i = 0; i < path.size(); i++) {
            amounts.add(current);
            current = current.multiply(BigInteger.TWO);
        }
        return amounts;
    };

    public final Map<String, TransactionOutcome> outcomes = new HashMap<>();
    public final Map<String, RuntimeException> failures = new HashMap<>();
    public final List<Call> calls = new ArrayList<>();

    public record Call(String operation, List<Object> args) {
        public Object arg(int index) {
            return args.get(index);
        }
    }

    public List<Call> calls(String operation) {
        return calls.stream().filter(c -> c.operation().equals(operation)).toList();
    }

    private TransactionOutcome write(String operation, Object... args) {
        calls.add(new Call(operation, List.of(args)));
        RuntimeException failure = failures.get(operation);
        if (failure != null) {
            throw failure;
        }
        return outcomes.getOrDefault(operation,
                new TransactionOutcome("0x" + operation, DEFAULT_GAS_PRICE, BigInteger.valueOf(150_000), List.of()));
    }

    @Override
    public String walletAddress(String workflowId) {
        return WALLET;
    }

    @Override
    public String wrappedNativeToken() {
        return WPLS;
    }

    @Override
    public BigInteger nativeBalance(String workflowId) {
        calls.add(new Call("nativeBalance", List.of()));
        BigInteger queued = queuedNativeBalances.poll();
        return queued != null ? queued : nativeBalance;
    }

    @Override
    public BigInteger tokenBalance(String workflowId, String token) {
        return tokenBalances.getOrDefault(token, BigInteger.ZERO);
    }

    @Override
    public Optional<PoolReserves> findPool(String tokenA, String tokenB) {
        return pools.stream()
                .filter(p -> (p.token0().equalsIgnoreCase(tokenA) && p.token1().equalsIgnoreCase(tokenB))
                        || (p.token0().equalsIgnoreCase(tokenB) && p.token1().equalsIgnoreCase(tokenA)))
                .findFirst();
    }

    @Override
    public List<BigInteger> getAmountsOut(BigInteger amountIn, List<String> path) {
        return amountsOut.apply(amountIn, path);
    }

    @Override
    public List<BigInteger> getAmountsIn(BigInteger amountOut, List<String> path) {
        List<BigInteger> amounts = new ArrayList<>();
        BigInteger current = amountOut;
        for (int i = 0; i < path.size(); i++) {
            amounts.add(0, current);
            current = current.multiply(BigInteger.TWO);
        }
        return amounts;
    }

    @Override
    public LpPosition lpPosition(String workflowId, String pairAddress) {
        LpPosition position = lpPositions.get(pairAddress);
        if (position == null) {
            throw new IllegalArgumentException("No LP position for " + pairAddress);
        }
        return position;
    }

    @Override
    public TransactionOutcome swapTokensForTokens(String workflowId, BigInteger amountIn, BigInteger amountOutMin,
                                                  List<String> path, String to) {
        return write("swapTokensForTokens", amountIn, amountOutMin, path, to);
    }

    @Override
    public TransactionOutcome swapPlsForTokens(String workflowId, BigInteger plsAmount, BigInteger amountOutMin,
                                               List<String> path, String to) {
        return write("swapPlsForTokens", plsAmount, amountOutMin, path, to);
    }

    @Override
    public TransactionOutcome swapTokensForPls(String workflowId, BigInteger amountIn, BigInteger amountOutMin,
                                               List<String> path, String to) {
        return write("swapTokensForPls", amountIn, amountOutMin, path, to);
    }

    @Override
    public TransactionOutcome addLiquidity(String workflowId, String tokenA, String tokenB,
                                           BigInteger amountADesired, BigInteger amountBDesired,
                                           BigInteger amountAMin, BigInteger amountBMin, String to) {
        return write("addLiquidity", tokenA, tokenB, amountADesired, amountBDesired, amountAMin, amountBMin, to);
    }

    @Override
    public TransactionOutcome addLiquidityPls(String workflowId, String token, BigInteger amountTokenDesired,
                                              BigInteger amountTokenMin, BigInteger amountPlsMin,
                                              BigInteger plsAmount, String to) {
        return write("addLiquidityPls", token, amountTokenDesired, amountTokenMin, amountPlsMin, plsAmount, to);
    }

    @Override
    public TransactionOutcome removeLiquidity(String workflowId, String tokenA, String tokenB, BigInteger liquidity,
                                              BigInteger amountAMin, BigInteger amountBMin, String to) {
        return write("removeLiquidity", tokenA, tokenB, liquidity, amountAMin, amountBMin, to);
    }

    @Override
    public TransactionOutcome removeLiquidityPls(String workflowId, String token, BigInteger liquidity,
                                                 BigInteger amountTokenMin, BigInteger amountPlsMin, String to) {
        return write("removeLiquidityPls", token, liquidity, amountTokenMin, amountPlsMin, to);
    }

    @Override
    public TransactionOutcome transferToken(String workflowId, String token, String to, BigInteger amount) {
        return write("transferToken", token, to, amount);
    }

    @Override
    public TransactionOutcome transferPls(String workflowId, String to, BigInteger amount) {
        return write("transferPls", to, amount);
    }

    @Override
    public TransactionOutcome burnToken(String workflowId, String token, BigInteger amount) {
        return write("burnToken", token, amount);
    }

    @Override
    public TransactionOutcome claimToken(String workflowId, String token, BigInteger amount) {
        return write("claimToken", token, amount);
    }
}
