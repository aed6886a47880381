package com.pulseflow.pulseflow_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulseflow.pulseflow_backend.chain.ChainAdapter;
import com.pulseflow.pulseflow_backend.chain.PoolReserves;
import com.pulseflow.pulseflow_backend.exception.AmountResolutionException;
import com.pulseflow.pulseflow_backend.model.amount.AmountDescriptor;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves amount fields of a node's configuration to base units.
 *
 * Config shapes accepted for a field:
 *   { "type": "static", "value": "1.5" }                          → 1.5 × 10^18
 *   { "type": "previousOutput", "field": "amountOut", "percentage": 50 }
 *   { "type": "lpRatio", "baseAmountField": "plsAmount", "baseToken": "token", "pairedToken": "PLS" }
 *   { "type": "variable", "name": "budget" }
 *   "1000000" or 1000000                                           → legacy, already base units
 *   absent                                                         → 0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AmountResolver {

    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    private final ChainAdapter chain;
    private final ObjectMapper objectMapper;

    public BigInteger resolve(String field, Map<String, Object> nodeConfig, ExecutionContext context, String workflowId) {
        AmountDescriptor descriptor = parse(nodeConfig != null ? nodeConfig.get(field) : null, field);
        if (descriptor == null) {
            return BigInteger.ZERO;
        }
        return resolve(descriptor, field, nodeConfig, context, workflowId);
    }

    /** Reads a raw config value into a descriptor; null when the value is absent. */
    public AmountDescriptor parse(Object raw, String field) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof AmountDescriptor descriptor) {
            return descriptor;
        }
        if (raw instanceof Map<?, ?> map) {
            try {
                return objectMapper.convertValue(map, AmountDescriptor.class);
            } catch (IllegalArgumentException e) {
                throw new AmountResolutionException(field,
                        "Unknown amount config for '" + field + "': " + map.get("type"), e);
            }
        }
        if (raw instanceof String || raw instanceof Number) {
            return new AmountDescriptor.BaseUnits(raw.toString());
        }
        throw new AmountResolutionException(field, "Unsupported amount value for '" + field + "'");
    }

    public BigInteger resolve(AmountDescriptor descriptor, String field, Map<String, Object> nodeConfig,
                              ExecutionContext context, String workflowId) {
        if (descriptor instanceof AmountDescriptor.Static s) {
            return resolveStatic(s.value(), field);
        }
        if (descriptor instanceof AmountDescriptor.BaseUnits b) {
            return parseInteger(b.value(), field);
        }
        if (descriptor instanceof AmountDescriptor.PreviousOutput p) {
            return resolvePreviousOutput(p, field, context);
        }
        if (descriptor instanceof AmountDescriptor.Variable v) {
            return context.variable(v.name()).orElseThrow(() -> new AmountResolutionException(field,
                    "Variable '" + v.name() + "' used by '" + field + "' has not been set"));
        }
        if (descriptor instanceof AmountDescriptor.PoolRatio r) {
            return resolvePoolRatio(r, field, nodeConfig, context, workflowId);
        }
        if (descriptor instanceof AmountDescriptor.CurrentBalance) {
            throw new AmountResolutionException(field,
                    "Wallet balance option has been removed. Use \"Custom Amount\" or \"Previous Output\" instead.");
        }
        throw new AmountResolutionException(field, "Unknown amount config for '" + field + "'");
    }

    private BigInteger resolveStatic(String value, String field) {
        if (value == null || value.isBlank()) {
            return BigInteger.ZERO;
        }
        try {
            return Convert.toWei(value.trim(), Convert.Unit.ETHER).toBigIntegerExact();
        } catch (NumberFormatException | ArithmeticException e) {
            // Some stored definitions hold base units in a static field
            return parseInteger(value, field);
        }
    }

    private BigInteger resolvePreviousOutput(AmountDescriptor.PreviousOutput descriptor, String field,
                                             ExecutionContext context) {
        if (context.getPreviousNodeId() == null) {
            throw new AmountResolutionException(field, "No previous node output available for '" + field + "'");
        }
        Map<String, Object> previous = context.previousOutput().orElseThrow(() -> new AmountResolutionException(field,
                fieldMessage(field, "Previous node " + context.getPreviousNodeId() + " has no output")));
        Object value = previous.get(descriptor.field());
        if (value == null) {
            throw new AmountResolutionException(field,
                    fieldMessage(field, "Previous node output does not have field: " + descriptor.field()));
        }
        BigInteger amount = toBigInteger(value, field);
        BigDecimal percentage = descriptor.percentage() != null ? descriptor.percentage() : BigDecimal.valueOf(100);
        BigInteger scaled = percentage.multiply(BigDecimal.valueOf(100)).setScale(0, RoundingMode.FLOOR).toBigInteger();
        return amount.multiply(scaled).divide(BASIS_POINTS);
    }

    private BigInteger resolvePoolRatio(AmountDescriptor.PoolRatio descriptor, String field,
                                        Map<String, Object> nodeConfig, ExecutionContext context, String workflowId) {
        String baseAmountField = descriptor.baseAmountField();
        Object baseRaw = baseAmountField != null && nodeConfig != null ? nodeConfig.get(baseAmountField) : null;
        if (baseRaw == null) {
            throw new AmountResolutionException(field,
                    "LP ratio base amount field '" + baseAmountField + "' not found in node config");
        }
        AmountDescriptor baseDescriptor = parse(baseRaw, baseAmountField);
        if (baseDescriptor instanceof AmountDescriptor.PoolRatio) {
            throw new AmountResolutionException(field,
                    "LP ratio base amount '" + baseAmountField + "' cannot itself be an LP ratio");
        }
        BigInteger baseAmount = resolve(baseDescriptor, baseAmountField, nodeConfig, context, workflowId);
        if (baseAmount.signum() == 0) {
            return BigInteger.ZERO;
        }

        String baseToken = baseTokenAddress(descriptor.baseToken(), field, nodeConfig);
        boolean pairedIsNative = "PLS".equalsIgnoreCase(descriptor.pairedToken());
        String pairedToken = pairedIsNative ? chain.wrappedNativeToken() : descriptor.pairedToken();
        if (baseToken == null || pairedToken == null || pairedToken.isBlank()) {
            throw new AmountResolutionException(field,
                    fieldMessage(field, "LP ratio calculation requires both tokens to be specified"));
        }

        PoolReserves pool = chain.findPool(baseToken, pairedToken).orElseThrow(() ->
                new AmountResolutionException(field, fieldMessage(field, "No LP exists between the specified tokens")));
        BigInteger reserveBase = pool.reserveOf(baseToken);
        BigInteger reservePaired = pool.reserveOf(pairedToken);

        // Editor quirk: "plsAmount" paired with PLS means the base amount is already in PLS, so the
        // quote has to run the other way round.
        if (pairedIsNative && baseAmountField.toLowerCase(Locale.ROOT).contains("pls")) {
            log.debug("LP ratio for '{}' uses inverted reserves (base field '{}')", field, baseAmountField);
            BigInteger swap = reserveBase;
            reserveBase = reservePaired;
            reservePaired = swap;
        }
        if (reserveBase.signum() == 0) {
            throw new AmountResolutionException(field, fieldMessage(field, "LP between the specified tokens has no liquidity"));
        }
        return baseAmount.multiply(reservePaired).divide(reserveBase);
    }

    /**
     * The base token is normally the name of another config field holding the address. Definitions saved by
     * older editors store the address itself; for those the node's own {@code token} field wins when present,
     * since the literal may be stale after the user changed the token.
     */
    private static String baseTokenAddress(String reference, String field, Map<String, Object> nodeConfig) {
        if (reference == null || reference.isBlank()) {
            throw new AmountResolutionException(field,
                    fieldMessage(field, "LP ratio calculation requires both tokens to be specified"));
        }
        Map<String, Object> config = nodeConfig != null ? nodeConfig : Map.of();
        if (reference.startsWith("0x")) {
            Object override = config.get("token");
            return override instanceof String s && !s.isBlank() ? s : reference;
        }
        Object address = config.get(reference);
        if (!(address instanceof String s) || s.isBlank()) {
            throw new AmountResolutionException(field,
                    "LP ratio base token field '" + reference + "' is not set");
        }
        return s;
    }

    private static String fieldMessage(String field, String message) {
        return "'" + field + "': " + message;
    }

    private static BigInteger toBigInteger(Object value, String field) {
        if (value instanceof BigInteger b) return b;
        if (value instanceof Long || value instanceof Integer) return BigInteger.valueOf(((Number) value).longValue());
        return parseInteger(value.toString(), field);
    }

    private static BigInteger parseInteger(String value, String field) {
        if (value == null || value.isBlank()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new AmountResolutionException(field, "Invalid amount '" + value + "' for '" + field + "'", e);
        }
    }
}
