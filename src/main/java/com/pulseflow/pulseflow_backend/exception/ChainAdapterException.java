package com.pulseflow.pulseflow_backend.exception;

import lombok.Getter;

/**
 * Failure reported by the chain layer. The structured fields mirror what JSON-RPC nodes and
 * receipts expose and are fed to the error classifier alongside the message.
 */
@Getter
public class ChainAdapterException extends WorkflowExecutionException {

    private final String code;
    private final String shortMessage;
    private final String revertReason;
    private final String txHash;

    public ChainAdapterException(String message) {
        this(message, null, null, null, null, null);
    }

    public ChainAdapterException(String message, Throwable cause) {
        this(message, null, null, null, null, cause);
    }

    public ChainAdapterException(String message, String code, String shortMessage,
                                 String revertReason, String txHash, Throwable cause) {
        super(message, null, false, cause);
        this.code = code;
        this.shortMessage = shortMessage;
        this.revertReason = revertReason;
        this.txHash = txHash;
    }

    public static ChainAdapterException reverted(String txHash, String revertReason) {
        String message = revertReason != null
                ? "execution reverted: " + revertReason
                : "transaction " + txHash + " reverted";
        return new ChainAdapterException(message, "CALL_EXCEPTION", "transaction execution reverted",
                revertReason, txHash, null);
    }
}
