package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.PoolReserves;
import com.pulseflow.pulseflow_backend.chain.TransactionOutcome;
import com.pulseflow.pulseflow_backend.exception.ChainAdapterException;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

@Slf4j
abstract class LiquidityExecutor extends ChainNodeExecutor {

    protected LiquidityExecutor(ChainAdapter chain, AmountResolver amounts) {
        super(chain, amounts);
    }

    /*
     * { "token": "0x...", "amountTokenDesired": {...}, "plsAmount": {...}, "slippage": 0.01, "to": "0x..." }
     */
    protected NodeOutcome addLiquidityPls(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String token = config.requireString("token", "Token address");
        BigInteger amountTokenDesired = amount("amountTokenDesired", node, context, workflowId);
        BigInteger plsAmount = amount("plsAmount", node, context, workflowId);
        BigDecimal slippage = slippage(config);
        String to = recipient(config, workflowId);

        TransactionOutcome tx = chain.addLiquidityPls(workflowId, token, amountTokenDesired,
                applySlippage(amountTokenDesired, slippage), applySlippage(plsAmount, slippage), plsAmount, to);

        String wpls = chain.wrappedNativeToken();
        Map<String, Object> output = transactionOutput(tx);
        Optional<String> pair = pairAddress(token, wpls);
        output.put("liquidity", pair.map(p -> tx.receivedBy(p, to)).orElse(BigInteger.ZERO));
        output.put("amountToken", pair.map(p -> tx.receivedBy(token, p)).orElse(amountTokenDesired));
        output.put("amountPLS", pair.map(p -> tx.receivedBy(wpls, p)).orElse(plsAmount));
        return NodeOutcome.of(output);
    }

    protected Optional<String> pairAddress(String tokenA, String tokenB) {
        return chain.findPool(tokenA, tokenB).map(PoolReserves::pairAddress);
    }

    /**
     * Share of each reserve that {@code liquidity} LP tokens redeem, less slippage. Falls back to zero
     * minimums when the pool cannot be read; the router still enforces the burn itself.
     */
    protected BigInteger[] removalMinimums(String tokenA, String tokenB, BigInteger liquidity, BigDecimal slippage) {
        BigInteger[] zero = {BigInteger.ZERO, BigInteger.ZERO};
        try {
            Optional<PoolReserves> found = chain.findPool(tokenA, tokenB);
            if (found.isEmpty() || found.get().totalSupply().signum() == 0) {
                log.warn("Could not estimate removal minimums for {}/{}: pool not found or empty", tokenA, tokenB);
                return zero;
            }
            PoolReserves pool = found.get();
            BigInteger expectedA = pool.reserveOf(tokenA).multiply(liquidity).divide(pool.totalSupply());
            BigInteger expectedB = pool.reserveOf(tokenB).multiply(liquidity).divide(pool.totalSupply());
            return new BigInteger[]{applySlippage(expectedA, slippage), applySlippage(expectedB, slippage)};
        } catch (ChainAdapterException e) {
            log.warn("Could not estimate removal minimums for {}/{}, using 0: {}", tokenA, tokenB, e.getMessage());
            return zero;
        }
    }
}

/*
 * Config shape:
 * {
 *   "tokenA": "0x...", "tokenB": "0x...",
 *   "amountADesired": { "type": "static", "value": "10" },
 *   "amountBDesired": { ... },        // optional, quoted from the pool reserves when absent
 *   "usePLS": false,                  // true switches to the addLiquidityPLS shape
 *   "slippage": 0.01, "to": "0x..."
 * }
 */
@Component
class AddLiquidityExecutor extends LiquidityExecutor {
    AddLiquidityExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.ADD_LIQUIDITY; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        if (config.flag("usePLS")) {
            return addLiquidityPls(node, context, workflowId);
        }
        String tokenA = config.requireString("tokenA", "Token A address");
        String tokenB = config.requireString("tokenB", "Token B address");
        BigInteger amountADesired = amount("amountADesired", node, context, workflowId);
        BigInteger amountBDesired = amount("amountBDesired", node, context, workflowId);
        if (amountBDesired.signum() == 0) {
            amountBDesired = quote(tokenA, tokenB, amountADesired);
        }
        BigDecimal slippage = slippage(config);
        String to = recipient(config, workflowId);

        TransactionOutcome tx = chain.addLiquidity(workflowId, tokenA, tokenB, amountADesired, amountBDesired,
                applySlippage(amountADesired, slippage), applySlippage(amountBDesired, slippage), to);

        Map<String, Object> output = transactionOutput(tx);
        Optional<String> pair = pairAddress(tokenA, tokenB);
        output.put("liquidity", pair.map(p -> tx.receivedBy(p, to)).orElse(BigInteger.ZERO));
        output.put("amountA", pair.map(p -> tx.receivedBy(tokenA, p)).orElse(amountADesired));
        output.put("amountB", pair.map(p -> tx.receivedBy(tokenB, p)).orElse(amountBDesired));
        return NodeOutcome.of(output);
    }

    private BigInteger quote(String tokenA, String tokenB, BigInteger amountA) {
        PoolReserves pool = chain.findPool(tokenA, tokenB).orElseThrow(() -> new NodeConfigurationException(
                "Amount B is required when no LP exists between the specified tokens"));
        BigInteger reserveA = pool.reserveOf(tokenA);
        if (reserveA.signum() == 0) {
            throw new NodeConfigurationException("Amount B is required when the LP has no liquidity");
        }
        return amountA.multiply(pool.reserveOf(tokenB)).divide(reserveA);
    }
}

@Component
class AddLiquidityPlsExecutor extends LiquidityExecutor {
    AddLiquidityPlsExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.ADD_LIQUIDITY_PLS; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        return addLiquidityPls(node, context, workflowId);
    }
}

/*
 * { "tokenA": "0x...", "tokenB": "0x...", "liquidity": {...}, "slippage": 0.01, "to": "0x..." }
 */
@Component
class RemoveLiquidityExecutor extends LiquidityExecutor {
    RemoveLiquidityExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.REMOVE_LIQUIDITY; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String tokenA = config.requireString("tokenA", "Token A address");
        String tokenB = config.requireString("tokenB", "Token B address");
        BigInteger liquidity = amount("liquidity", node, context, workflowId);
        String to = recipient(config, workflowId);
        BigInteger[] mins = removalMinimums(tokenA, tokenB, liquidity, slippage(config));

        TransactionOutcome tx = chain.removeLiquidity(workflowId, tokenA, tokenB, liquidity, mins[0], mins[1], to);

        Map<String, Object> output = transactionOutput(tx);
        output.put("amountA", tx.receivedBy(tokenA, to));
        output.put("amountB", tx.receivedBy(tokenB, to));
        return NodeOutcome.of(output);
    }
}

/*
 * { "token": "0x...", "liquidity": {...}, "slippage": 0.01, "to": "0x..." }
 */
@Component
class RemoveLiquidityPlsExecutor extends LiquidityExecutor {
    RemoveLiquidityPlsExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.REMOVE_LIQUIDITY_PLS; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String token = config.requireString("token", "Token address");
        String wpls = chain.wrappedNativeToken();
        BigInteger liquidity = amount("liquidity", node, context, workflowId);
        String to = recipient(config, workflowId);
        BigInteger[] mins = removalMinimums(token, wpls, liquidity, slippage(config));

        TransactionOutcome tx = chain.removeLiquidityPls(workflowId, token, liquidity, mins[0], mins[1], to);

        Map<String, Object> output = transactionOutput(tx);
        output.put("amountToken", tx.receivedBy(token, to));
        // PLS is unwrapped by the router, so only the pair's WPLS payout shows up in the logs
        output.put("amountPLS", pairAddress(token, wpls).map(p -> tx.sentFrom(wpls, p)).orElse(BigInteger.ZERO));
        return NodeOutcome.of(output);
    }
}
