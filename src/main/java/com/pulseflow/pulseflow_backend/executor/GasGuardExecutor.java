package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.exception.GuardViolationException;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import com.pulseflow.pulseflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stops the run when the transaction right before it paid more gas than allowed. Place it directly after
 * the transaction it should check.
 *
 * Config: { "maxGasPrice": 100 }   // gwei
 */
@Component
class GasGuardExecutor implements NodeExecutor {

    static final BigDecimal DEFAULT_MAX_GWEI = BigDecimal.valueOf(100);

    @Override
    public NodeType supportedType() {
        return NodeType.GAS_GUARD;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context, String workflowId) {
        BigDecimal maxGwei = NodeConfig.of(node.getConfig()).decimal("maxGasPrice", DEFAULT_MAX_GWEI);
        if (maxGwei.signum() <= 0) {
            maxGwei = DEFAULT_MAX_GWEI;
        }
        Map<String, Object> previous = context.previousOutput().orElseThrow(() ->
                new NodeConfigurationException("Gas Guard: No previous node to check gas from"));
        BigInteger gasPrice = gasPrice(previous.get("gasPrice"));

        BigDecimal gasPriceGwei = Convert.fromWei(new BigDecimal(gasPrice), Convert.Unit.GWEI);
        if (gasPriceGwei.compareTo(maxGwei) > 0) {
            throw new GuardViolationException(String.format(
                    "Gas Guard stopped automation: Gas price was %s gwei, threshold was %s gwei",
                    gasPriceGwei.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    maxGwei.stripTrailingZeros().toPlainString()));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("passed", true);
        output.put("gasPriceGwei", gasPriceGwei.stripTrailingZeros().toPlainString());
        output.put("threshold", maxGwei.stripTrailingZeros().toPlainString());
        return NodeOutcome.of(output);
    }

    private static BigInteger gasPrice(Object value) {
        if (value instanceof BigInteger b) return b;
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigInteger(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new NodeConfigurationException("Gas Guard: Previous node reported an invalid gas price: " + value);
            }
        }
        throw new NodeConfigurationException(
                "Gas Guard: Previous node did not produce a transaction with gas price data");
    }
}
