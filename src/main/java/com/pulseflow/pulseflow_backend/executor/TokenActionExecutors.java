package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.TransactionOutcome;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/**
 * Burn and claim on playground tokens. Both take { "token": "0x...", "amount": {...} } and differ only in
 * the chain call.
 */
abstract class TokenActionExecutor extends ChainNodeExecutor {

    protected TokenActionExecutor(ChainAdapter chain, AmountResolver amounts) {
        super(chain, amounts);
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String token = config.requireString("token", "Token address");
        BigInteger amount = amount("amount", node, context, workflowId);

        TransactionOutcome tx = send(workflowId, token, amount);
        Map<String, Object> output = transactionOutput(tx);
        output.put("amount", amount);
        output.put("token", token);
        return NodeOutcome.of(output);
    }

    protected abstract TransactionOutcome send(String workflowId, String token, BigInteger amount);
}

@Component
class BurnTokenExecutor extends TokenActionExecutor {
    BurnTokenExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.BURN_TOKEN; }

    @Override
    protected TransactionOutcome send(String workflowId, String token, BigInteger amount) {
        return chain.burnToken(workflowId, token, amount);
    }
}

@Component
class ClaimTokenExecutor extends TokenActionExecutor {
    ClaimTokenExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.CLAIM_TOKEN; }

    @Override
    protected TransactionOutcome send(String workflowId, String token, BigInteger amount) {
        return chain.claimToken(workflowId, token, amount);
    }
}
