package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.TransactionOutcome;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/*
 * transfer:    { "token": "0x...", "to": "0x...", "amount": {...} }
 * transferPLS: { "to": "0x...", "plsAmount": {...} }
 */
@Component
class TransferTokenExecutor extends ChainNodeExecutor {
    TransferTokenExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.TRANSFER; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String token = config.requireString("token", "Token address");
        String to = config.requireString("to", "Recipient address");
        BigInteger amount = amount("amount", node, context, workflowId);

        TransactionOutcome tx = chain.transferToken(workflowId, token, to, amount);
        Map<String, Object> output = transactionOutput(tx);
        output.put("amount", amount);
        output.put("token", token);
        output.put("to", to);
        return NodeOutcome.of(output);
    }
}

@Component
class TransferPlsExecutor extends ChainNodeExecutor {
    TransferPlsExecutor(ChainAdapter chain, AmountResolver amounts) { super(chain, amounts); }

    @Override public NodeType supportedType() { return NodeType.TRANSFER_PLS; }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String to = config.requireString("to", "Recipient address");
        BigInteger amount = amount("plsAmount", node, context, workflowId);

        TransactionOutcome tx = chain.transferPls(workflowId, to, amount);
        Map<String, Object> output = transactionOutput(tx);
        output.put("amount", amount);
        output.put("token", "PLS");
        output.put("to", to);
        return NodeOutcome.of(output);
    }
}
