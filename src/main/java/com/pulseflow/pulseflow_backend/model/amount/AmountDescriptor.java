package com.pulseflow.pulseflow_backend.model.amount;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;

/**
 * Declarative description of a token amount as stored in a node's configuration.
 * Every variant resolves to an integer in base units (18 implied decimals).
 *
 * <pre>
 * { "type": "static",         "value": "1.5" }
 * { "type": "previousOutput", "field": "amountOut", "percentage": 50 }
 * { "type": "lpRatio",        "baseAmountField": "plsAmount", "baseToken": "token", "pairedToken": "PLS" }
 * { "type": "variable",       "name": "budget" }
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AmountDescriptor.Static.class,         name = "static"),
        @JsonSubTypes.Type(value = AmountDescriptor.PreviousOutput.class, name = "previousOutput"),
        @JsonSubTypes.Type(value = AmountDescriptor.CurrentBalance.class, name = "currentBalance"),
        @JsonSubTypes.Type(value = AmountDescriptor.PoolRatio.class,      name = "lpRatio"),
        @JsonSubTypes.Type(value = AmountDescriptor.Variable.class,       name = "variable"),
        @JsonSubTypes.Type(value = AmountDescriptor.BaseUnits.class,      name = "baseUnits")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface AmountDescriptor {

    /** Human-readable decimal, e.g. "1.5". */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Static(@JsonProperty("value") String value) implements AmountDescriptor {}

    /** A numeric field of the previous node's output, scaled by a percentage. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PreviousOutput(String field, BigDecimal percentage) implements AmountDescriptor {}

    /** Removed option; only kept so historical definitions still deserialize. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CurrentBalance(String token, BigDecimal percentage) implements AmountDescriptor {}

    /**
     * Amount derived from a pool's reserve ratio. {@code baseToken} is either the name of a config
     * field holding the token address, or (legacy) a literal address.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PoolRatio(String baseToken, String baseAmountField, String pairedToken) implements AmountDescriptor {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Variable(@JsonProperty("name") String name) implements AmountDescriptor {}

    /** Bare string or number from old definitions, already in base units. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record BaseUnits(@JsonProperty("value") String value) implements AmountDescriptor {}
}
