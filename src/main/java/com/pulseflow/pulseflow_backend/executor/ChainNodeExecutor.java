package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.TransactionOutcome;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared plumbing for nodes that talk to the chain: amount resolution, recipient defaults, slippage maths
 * and the gas fields every transaction output carries for a following gas guard.
 */
abstract class ChainNodeExecutor implements NodeExecutor {

    static final BigDecimal DEFAULT_SLIPPAGE = new BigDecimal("0.01");
    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    protected final ChainAdapter chain;
    protected final AmountResolver amounts;

    protected ChainNodeExecutor(ChainAdapter chain, AmountResolver amounts) {
        this.chain = chain;
        this.amounts = amounts;
    }

    protected BigInteger amount(String field, WorkflowNode node, ExecutionContext context, String workflowId) {
        return amounts.resolve(field, node.getConfig(), context, workflowId);
    }

    /** Explicit {@code to} address, else the workflow's own wallet. */
    protected String recipient(NodeConfig config, String workflowId) {
        return config.string("to").orElseGet(() -> chain.walletAddress(workflowId));
    }

    protected static BigDecimal slippage(NodeConfig config) {
        BigDecimal slippage = config.decimal("slippage", DEFAULT_SLIPPAGE);
        if (slippage.signum() < 0 || slippage.compareTo(BigDecimal.ONE) >= 0) {
            throw new NodeConfigurationException("Slippage must be between 0 and 1, got " + slippage.toPlainString());
        }
        return slippage;
    }

    /** {@code amount × floor((1 − slippage) × 10000) / 10000}, all in integers. */
    protected static BigInteger applySlippage(BigInteger amount, BigDecimal slippage) {
        BigInteger keep = BigDecimal.ONE.subtract(slippage)
                .multiply(BigDecimal.valueOf(10_000))
                .setScale(0, RoundingMode.FLOOR)
                .toBigInteger();
        return amount.multiply(keep).divide(BASIS_POINTS);
    }

    protected static Map<String, Object> transactionOutput(TransactionOutcome tx) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("txHash", tx.txHash());
        output.put("gasPrice", tx.gasPrice());
        output.put("gasUsed", tx.gasUsed());
        return output;
    }
}
