package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.LpPosition;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.Map;

/** Wallet balance, native PLS when no token (or "PLS") is configured. */
@Component
@RequiredArgsConstructor
class CheckBalanceExecutor implements NodeExecutor {

    private final ChainAdapter chain;

    @Override public NodeType supportedType() { return NodeType.CHECK_BALANCE; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        String token = NodeConfig.of(node.getConfig()).string("token").orElse("PLS");
        BigInteger balance = "PLS".equalsIgnoreCase(token)
                ? chain.nativeBalance(workflowId)
                : chain.tokenBalance(workflowId, token);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("balance", balance);
        output.put("token", token);
        return NodeOutcome.of(output);
    }
}

@Component
@RequiredArgsConstructor
class CheckTokenBalanceExecutor implements NodeExecutor {

    private final ChainAdapter chain;

    @Override public NodeType supportedType() { return NodeType.CHECK_TOKEN_BALANCE; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        String token = NodeConfig.of(node.getConfig()).string("token").orElseThrow(() ->
                new NodeConfigurationException("Token address is required for checkTokenBalance"));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("balance", chain.tokenBalance(workflowId, token));
        output.put("token", token);
        return NodeOutcome.of(output);
    }
}

/** The wallet's LP position in {@code pairAddress}, with the redeemable amount of each side. */
@Component
@RequiredArgsConstructor
class CheckLpTokenAmountsExecutor implements NodeExecutor {

    private final ChainAdapter chain;

    @Override public NodeType supportedType() { return NodeType.CHECK_LP_TOKEN_AMOUNTS; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        String pair = NodeConfig.of(node.getConfig()).requireString("pairAddress", "LP pair address");
        LpPosition position = chain.lpPosition(workflowId, pair);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("lpBalance", position.lpBalance());
        output.put("token0", position.token0());
        output.put("token1", position.token1());
        output.put("token0Amount", position.token0Amount());
        output.put("token1Amount", position.token1Amount());
        output.put("ratio", ratio(position));
        return NodeOutcome.of(output);
    }

    // token1 per token0, informational only
    private static double ratio(LpPosition position) {
        if (position.token0Amount().signum() == 0) {
            return 0d;
        }
        return new BigDecimal(position.token1Amount())
                .divide(new BigDecimal(position.token0Amount()), MathContext.DECIMAL64)
                .doubleValue();
    }
}
