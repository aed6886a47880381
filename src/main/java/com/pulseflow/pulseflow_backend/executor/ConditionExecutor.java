package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.amount.AmountDescriptor;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes CONDITION nodes. Compares a left operand read from the chain or the previous node against a
 * threshold and reports the branch; the engine follows the matching edge.
 *
 * Config:
 * {
 *   "conditionType": "plsBalance" | "tokenBalance" | "lpAmount" | "previousOutput",
 *   "tokenAddress": "0x...",            // tokenBalance
 *   "lpPairAddress": "0x...",           // lpAmount
 *   "previousOutputField": "amountOut", // previousOutput
 *   "operator": ">",
 *   "value": "100"                      // whole tokens, or an amount object
 * }
 */
@Component
@RequiredArgsConstructor
public class ConditionExecutor implements NodeExecutor {

    public static final String TRUE_BRANCH = "true";
    public static final String FALSE_BRANCH = "false";

    private final ChainAdapter chain;
    private final AmountResolver amounts;

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITION;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        NodeConfig config = NodeConfig.of(node.getConfig());
        String conditionType = config.requireString("conditionType", "Condition type");
        String operator = config.string("operator").orElse(">");

        BigInteger left = leftOperand(conditionType, config, context, workflowId);
        BigInteger threshold = threshold(config, context, workflowId);
        boolean result = compare(left, operator, threshold);
        String branch = result ? TRUE_BRANCH : FALSE_BRANCH;

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", result);
        output.put("branch", branch);
        output.put("leftValue", left);
        output.put("threshold", threshold);
        output.put("operator", operator);
        output.put("conditionType", conditionType);
        return NodeOutcome.branch(output, branch);
    }

    private BigInteger leftOperand(String conditionType, NodeConfig config, ExecutionContext context, String workflowId) {
        return switch (conditionType) {
            case "plsBalance" -> chain.nativeBalance(workflowId);
            case "tokenBalance" -> chain.tokenBalance(workflowId,
                    config.requireString("tokenAddress", "Token address for the condition"));
            case "lpAmount" -> chain.lpPosition(workflowId,
                    config.requireString("lpPairAddress", "LP pair address for the condition")).lpBalance();
            case "previousOutput" -> {
                String field = config.requireString("previousOutputField", "Previous output field");
                yield amounts.resolve(new AmountDescriptor.PreviousOutput(field, BigDecimal.valueOf(100)),
                        "previousOutputField", config.asMap(), context, workflowId);
            }
            default -> throw new NodeConfigurationException("Unknown condition type: " + conditionType);
        };
    }

    private BigInteger threshold(NodeConfig config, ExecutionContext context, String workflowId) {
        Object raw = config.raw("value");
        if (raw == null || raw.toString().isBlank()) {
            throw new NodeConfigurationException("Condition value is required");
        }
        AmountDescriptor descriptor = raw instanceof Map<?, ?>
                ? amounts.parse(raw, "value")
                : new AmountDescriptor.Static(raw.toString());
        return amounts.resolve(descriptor, "value", config.asMap(), context, workflowId);
    }

    static boolean compare(BigInteger left, String operator, BigInteger right) {
        int cmp = left.compareTo(right);
        return switch (operator) {
            case ">" -> cmp > 0;
            case "<" -> cmp < 0;
            case ">=" -> cmp >= 0;
            case "<=" -> cmp <= 0;
            case "==" -> cmp == 0;
            default -> throw new NodeConfigurationException("Unknown condition operator: " + operator);
        };
    }
}
