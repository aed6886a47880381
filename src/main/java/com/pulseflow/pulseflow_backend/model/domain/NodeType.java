package com.pulseflow.pulseflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Closed set of node types the editor can place on the canvas.
 * Wire names are the editor's camelCase type tags; some historical tags are kept as aliases.
 */
public enum NodeType {
    START("start"),

    // Swaps
    SWAP("swap"),
    SWAP_FROM_PLS("swapFromPLS", "swapPLS"),
    SWAP_TO_PLS("swapToPLS"),

    // Liquidity
    ADD_LIQUIDITY("addLiquidity"),
    ADD_LIQUIDITY_PLS("addLiquidityPLS"),
    REMOVE_LIQUIDITY("removeLiquidity"),
    REMOVE_LIQUIDITY_PLS("removeLiquidityPLS"),

    // Transfers and token actions
    TRANSFER("transfer"),
    TRANSFER_PLS("transferPLS"),
    BURN_TOKEN("burnToken", "burn"),
    CLAIM_TOKEN("claimToken", "claim"),

    // Read-only queries
    CHECK_BALANCE("checkBalance"),
    CHECK_TOKEN_BALANCE("checkTokenBalance"),
    CHECK_LP_TOKEN_AMOUNTS("checkLPTokenAmounts"),
    DEX_QUOTE("dexQuote"),

    // Control flow
    CONDITION("condition"),
    LOOP("loop"),
    GAS_GUARD("gasGuard"),
    WAIT("wait"),
    VARIABLE("variable");

    private final String wireName;
    private final List<String> aliases;

    NodeType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases  = List.of(aliases);
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static NodeType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node type is null");
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value) || t.aliases.contains(value) || t.name().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node type: " + value));
    }
}
