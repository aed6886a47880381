package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only router quote.
 *
 * Config: { "quoteMode": "amountsOut" | "amountsIn", "amount": {...}, "path": ["0xA", "0xB"] }
 *
 *   amountsOut → how much of the last token {@code amount} of the first token buys
 *   amountsIn  → how much of the first token is needed to receive {@code amount} of the last token
 */
@Component
class DexQuoteExecutor extends ChainNodeExecutor {

    DexQuoteExecutor(ChainAdapter chain, AmountResolver amounts) {
        super(chain, amounts);
    }

    @Override
    public NodeType supportedType() {
        return NodeType.DEX_QUOTE;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        List<String> path = config.stringList("path");
        if (path.size() < 2) {
            throw new NodeConfigurationException("Quote path must contain at least two tokens");
        }
        String mode = config.string("quoteMode").orElse("amountsOut");
        BigInteger amount = amount("amount", node, context, workflowId);

        BigInteger quote = switch (mode) {
            case "amountsOut" -> last(chain.getAmountsOut(amount, path));
            case "amountsIn" -> first(chain.getAmountsIn(amount, path));
            default -> throw new NodeConfigurationException("Unknown quote mode: " + mode);
        };

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("quoteAmount", quote);
        return NodeOutcome.of(output);
    }

    private static BigInteger last(List<BigInteger> amounts) {
        return amounts.isEmpty() ? BigInteger.ZERO : amounts.get(amounts.size() - 1);
    }

    private static BigInteger first(List<BigInteger> amounts) {
        return amounts.isEmpty() ? BigInteger.ZERO : amounts.get(0);
    }
}
