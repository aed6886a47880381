package com.pulseflow.pulseflow_backend.executor;

import com.pulseflow.pulseflow_backend.chain.FakeChainAdapter;
import com.pulseflow.pulseflow_backend.chain.TokenTransfer;
import com.pulseflow.pulseflow_backend.chain.TransactionOutcome;
import com.pulseflow.pulseflow_backend.exception.NodeConfigurationException;
import com.pulseflow.pulseflow_backend.model.context.ExecutionContext;
import com.pulseflow.pulseflow_backend.model.domain.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwapExecutorsTest {

    private static final String TOKEN_IN = "0x2222222222222222222222222222222222222222";
    private static final String TOKEN_OUT = "0x3333333333333333333333333333333333333333";
    private static final String PAIR = "0x4444444444444444444444444444444444444444";

    private FakeChainAdapter chain;
    private AmountResolver amounts;

    @BeforeEach
    void setUp() {
        chain = new FakeChainAdapter();
        amounts = ExecutorFixtures.amountResolver(chain);
        chain.amountsOut = (in, path) -> List.of(in, BigInteger.valueOf(10_000));
    }

    @Test
    void swapAppliesSlippageToRouterQuote() {
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP, Map.of(
                "path", List.of(TOKEN_IN, TOKEN_OUT),
                "amountIn", "500",
                "slippage", 0.05));

        new SwapTokensExecutor(chain, amounts).execute(node, ExecutionContext.create(), "wf-1");

        FakeChainAdapter.Call call = chain.calls("swapTokensForTokens").get(0);
        assertThat(call.arg(0)).isEqualTo(BigInteger.valueOf(500));
        assertThat(call.arg(1)).isEqualTo(BigInteger.valueOf(9_500));
        assertThat(call.arg(3)).isEqualTo(FakeChainAdapter.WALLET);
    }

    @Test
    void swapWithZeroAmountSkipsQuote() {
        chain.amountsOut = (in, path) -> {
            throw new AssertionError("quote should not be requested");
        };
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP, Map.of("path", List.of(TOKEN_IN, TOKEN_OUT)));

        new SwapTokensExecutor(chain, amounts).execute(node, ExecutionContext.create(), "wf-1");

        assertThat(chain.calls("swapTokensForTokens").get(0).arg(1)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void swapOutputReportsTokensReceivedByRecipient() {
        chain.outcomes.put("swapTokensForTokens", new TransactionOutcome("0xabc", BigInteger.valueOf(7), BigInteger.valueOf(9),
                List.of(new TokenTransfer(TOKEN_IN, FakeChainAdapter.WALLET, PAIR, BigInteger.valueOf(500)),
                        new TokenTransfer(TOKEN_OUT, PAIR, FakeChainAdapter.WALLET, BigInteger.valueOf(1_000)))));
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP, Map.of(
                "path", List.of(TOKEN_IN, TOKEN_OUT), "amountIn", "500"));

        Map<String, Object> output = new SwapTokensExecutor(chain, amounts)
                .execute(node, ExecutionContext.create(), "wf-1").output();

        assertThat(output)
                .containsEntry("amountOut", BigInteger.valueOf(1_000))
                .containsEntry("tokenOut", TOKEN_OUT)
                .containsEntry("gasPrice", BigInteger.valueOf(7))
                .containsEntry("gasUsed", BigInteger.valueOf(9))
                .containsEntry("txHash", "0xabc");
    }

    @Test
    void swapWithUsePlsRoutesThroughWrappedNative() {
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP, Map.of(
                "usePLS", true,
                "path", List.of(TOKEN_OUT),
                "plsAmount", Map.of("type", "static", "value", "1")));

        new SwapTokensExecutor(chain, amounts).execute(node, ExecutionContext.create(), "wf-1");

        FakeChainAdapter.Call call = chain.calls("swapPlsForTokens").get(0);
        assertThat(call.arg(0)).isEqualTo(BigInteger.TEN.pow(18));
        assertThat(call.arg(2)).isEqualTo(List.of(FakeChainAdapter.WPLS, TOKEN_OUT));
    }

    @Test
    void swapFromPlsKeepsPathAlreadyStartingWithWrappedNative() {
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP_FROM_PLS, Map.of(
                "path", List.of(FakeChainAdapter.WPLS, TOKEN_OUT), "plsAmount", "100"));

        new SwapFromPlsExecutor(chain, amounts).execute(node, ExecutionContext.create(), "wf-1");

        assertThat(chain.calls("swapPlsForTokens").get(0).arg(2)).isEqualTo(List.of(FakeChainAdapter.WPLS, TOKEN_OUT));
    }

    @Test
    void swapToPlsAppendsWrappedNativeAndReportsItsPayout() {
        chain.outcomes.put("swapTokensForPls", new TransactionOutcome("0xdef", BigInteger.ONE, BigInteger.ONE,
                List.of(new TokenTransfer(FakeChainAdapter.WPLS, PAIR, "0xrouter", BigInteger.valueOf(321)))));
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP_TO_PLS, Map.of(
                "path", List.of(TOKEN_IN), "amountIn", "100"));

        Map<String, Object> output = new SwapToPlsExecutor(chain, amounts)
                .execute(node, ExecutionContext.create(), "wf-1").output();

        assertThat(chain.calls("swapTokensForPls").get(0).arg(2)).isEqualTo(List.of(TOKEN_IN, FakeChainAdapter.WPLS));
        assertThat(output).containsEntry("amountOut", BigInteger.valueOf(321));
    }

    @Test
    void swapToPlsCountsRelayedPayoutOnce() {
        chain.outcomes.put("swapTokensForPls", new TransactionOutcome("0xdef", BigInteger.ONE, BigInteger.ONE, List.of(
                new TokenTransfer(TOKEN_IN, FakeChainAdapter.WALLET, PAIR, BigInteger.valueOf(100)),
                new TokenTransfer(FakeChainAdapter.WPLS, PAIR, "0xrouter", BigInteger.valueOf(321)),
                new TokenTransfer(FakeChainAdapter.WPLS, "0xrouter", FakeChainAdapter.WALLET, BigInteger.valueOf(321)))));
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP_TO_PLS, Map.of(
                "path", List.of(TOKEN_IN), "amountIn", "100"));

        Map<String, Object> output = new SwapToPlsExecutor(chain, amounts)
                .execute(node, ExecutionContext.create(), "wf-1").output();

        assertThat(output).containsEntry("amountOut", BigInteger.valueOf(321));
    }

    @Test
    void swapToPlsWithoutWrappedNativeLogsReportsZero() {
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP_TO_PLS, Map.of(
                "path", List.of(TOKEN_IN), "amountIn", "100"));

        Map<String, Object> output = new SwapToPlsExecutor(chain, amounts)
                .execute(node, ExecutionContext.create(), "wf-1").output();

        assertThat(output).containsEntry("amountOut", BigInteger.ZERO);
    }

    @Test
    void swapRejectsSingleTokenPath() {
        var node = ExecutorFixtures.node("swap-1", NodeType.SWAP, Map.of("path", List.of(TOKEN_IN), "amountIn", "1"));

        assertThatThrownBy(() -> new SwapTokensExecutor(chain, amounts).execute(node, ExecutionContext.create(), "wf-1"))
                .isInstanceOf(NodeConfigurationException.class)
                .hasMessageContaining("at least two tokens");
        assertThat(chain.calls).isEmpty();
    }

    @Test
    void slippageArithmeticFloorsBasisPoints() {
        assertThat(ChainNodeExecutor.applySlippage(BigInteger.valueOf(10_000), new BigDecimal("0.01")))
                .isEqualTo(BigInteger.valueOf(9_900));
        assertThat(ChainNodeExecutor.applySlippage(BigInteger.valueOf(10_000), new BigDecimal("0.00005")))
                .isEqualTo(BigInteger.valueOf(9_999));
        assertThat(ChainNodeExecutor.applySlippage(BigInteger.valueOf(999), BigDecimal.ZERO))
                .isEqualTo(BigInteger.valueOf(999));
    }
}
