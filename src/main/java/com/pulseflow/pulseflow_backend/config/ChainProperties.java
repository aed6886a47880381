package com.pulseflow.pulseflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigInteger;

/**
 * Chain connection settings, bound from {@code pulseflow.chain.*}.
 */
@ConfigurationProperties(prefix = "pulseflow.chain")
public record ChainProperties(
        String rpcUrl,
        @DefaultValue("369") long chainId,
        String automationContract,
        String router,
        String wrappedNative,
        @DefaultValue("100000000000000000000") BigInteger executionFeeWei,
        @DefaultValue("120") int gasLimitMultiplierPercent,
        @DefaultValue("1500") long receiptPollIntervalMs,
        @DefaultValue("80") int receiptPollAttempts,
        @DefaultValue("1200") long deadlineSeconds,
        String walletEncryptionPassword
) {
}
