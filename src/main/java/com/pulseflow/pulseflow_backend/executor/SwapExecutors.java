package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.TransactionOutcome;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/*
 * Config shape shared by the swap nodes:
 * {
 *   "path":      ["0xTokenIn", "0xTokenOut"],
 *   "amountIn":  { "type": "static", "value": "1.5" },     // swap, swapToPLS
 *   "plsAmount": { "type": "static", "value": "1000" },    // swapFromPLS, or swap with usePLS
 *   "slippage":  0.01,
 *   "to":        "0x..."                                    // defaults to the workflow wallet
 * }
 */
abstract class SwapExecutor extends ChainNodeExecutor {

    protected SwapExecutor(ChainAdapter chain, AmountResolver amounts) {
        super(chain, amounts);
    }

    protected NodeOutcome swapFromPls(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String wpls = chain.wrappedNativeToken();
        List<String> path = new ArrayList<>(config.stringList("path"));
        if (path.isEmpty() || !path.get(0).equalsIgnoreCase(wpls)) {
            path.add(0, wpls);
        }
        requireRoute(path);
        BigInteger plsAmount = amount("plsAmount", node, context, workflowId);
        String to = recipient(config, workflowId);
        BigInteger amountOutMin = minimumOut(plsAmount, path, slippage(config));

        TransactionOutcome tx = chain.swapPlsForTokens(workflowId, plsAmount, amountOutMin, path, to);
        String tokenOut = path.get(path.size() - 1);
        return NodeOutcome.of(swapOutput(tx, tokenOut, tx.receivedBy(tokenOut, to)));
    }

    protected NodeOutcome swapTokens(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        List<String> path = config.stringList("path");
        requireRoute(path);
        BigInteger amountIn = amount("amountIn", node, context, workflowId);
        String to = recipient(config, workflowId);
        BigInteger amountOutMin = minimumOut(amountIn, path, slippage(config));

        TransactionOutcome tx = chain.swapTokensForTokens(workflowId, amountIn, amountOutMin, path, to);
        String tokenOut = path.get(path.size() - 1);
        return NodeOutcome.of(swapOutput(tx, tokenOut, tx.receivedBy(tokenOut, to)));
    }

    /** Router quote for the full path, less slippage. Zero when there is nothing to quote. */
    protected BigInteger minimumOut(BigInteger amountIn, List<String> path, BigDecimal slippage) {
        if (path.isEmpty() || amountIn.signum() <= 0) {
            return BigInteger.ZERO;
        }
        List<BigInteger> amountsOut = chain.getAmountsOut(amountIn, path);
        if (amountsOut.isEmpty()) {
            return BigInteger.ZERO;
        }
        return applySlippage(amountsOut.get(amountsOut.size() - 1), slippage);
    }

    protected static void requireRoute(List<String> path) {
        if (path.size() < 2) {
            throw new NodeConfigurationException("Swap path must contain at least two tokens");
        }
    }

    protected static Map<String, Object> swapOutput(TransactionOutcome tx, String tokenOut, BigInteger amountOut) {
        Map<String, Object> output = transactionOutput(tx);
        output.put("amountOut", amountOut);
        output.put("tokenOut", tokenOut);
        return output;
    }
}

@Component
class SwapTokensExecutor extends SwapExecutor {
    SwapTokensExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.SWAP; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        return NodeConfig.of(node.getConfig()).flag("usePLS")
                ? swapFromPls(node, context, workflowId)
                : swapTokens(node, context, workflowId);
    }
}

@Component
class SwapFromPlsExecutor extends SwapExecutor {
    SwapFromPlsExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.SWAP_FROM_PLS; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        return swapFromPls(node, context, workflowId);
    }
}

@Component
class SwapToPlsExecutor extends SwapExecutor {
    SwapToPlsExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.SWAP_TO_PLS; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String wpls = chain.wrappedNativeToken();
        List<String> path = new ArrayList<>(config.stringList("path"));
        if (path.isEmpty() || !path.get(path.size() - 1).equalsIgnoreCase(wpls)) {
            path.add(wpls);
        }
        requireRoute(path);
        BigInteger amountIn = amount("amountIn", node, context, workflowId);
        String to = recipient(config, workflowId);
        BigInteger amountOutMin = minimumOut(amountIn, path, slippage(config));

        TransactionOutcome tx = chain.swapTokensForPls(workflowId, amountIn, amountOutMin, path, to);
        // Native PLS leaves no Transfer log. Prefer WPLS paid to the recipient, else the pair's WPLS payout
        // to the router; relayed copies of the same payout are not added up.
        BigInteger amountOut = tx.firstReceivedBy(wpls, to)
                .or(() -> tx.firstOf(wpls))
                .orElse(BigInteger.ZERO);
        return NodeOutcome.of(swapOutput(tx, wpls, amountOut));
    }
}
