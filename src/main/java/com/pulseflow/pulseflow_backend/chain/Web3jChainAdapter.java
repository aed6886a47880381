package com.pulseflow.pulseflow_backend.chain;

import com.pulseflow.pulseflow_backend.config.ChainProperties;
import com.pulseflow.pulseflow_backend.exception.ChainAdapterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ChainAdapter} backed by a JSON-RPC node through web3j. State-changing calls go through the
 * automation contract, which takes the execution fee as {@code msg.value}.
 */
@Slf4j
@Component
public class Web3jChainAdapter implements ChainAdapter {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final String TRANSFER_TOPIC = EventEncoder.encode(ContractFunctions.TRANSFER_EVENT);

    // Selector of Error(string), the payload nodes attach to reverted calls and gas estimates
    private static final String ERROR_SELECTOR = "0x08c379a0";
    private static final String REVERTED_PREFIX = "execution reverted:";
    @SuppressWarnings("rawtypes")
    private static final List<TypeReference<Type>> ERROR_STRING =
            Utils.convert(List.of(new TypeReference<Utf8String>() {}));

    private final Web3j web3j;
    private final ChainProperties props;
    private final WalletKeyService walletKeys;

    // One signer per workflow wallet at a time, otherwise overlapping runs race for the same nonce.
    // Entries live only while some thread holds or waits for the lock.
    private final Map<String, WalletLock> walletLocks = new ConcurrentHashMap<>();

    public Web3jChainAdapter(Web3j web3j, ChainProperties props, WalletKeyService walletKeys) {
        this.web3j = web3j;
        this.props = props;
        this.walletKeys = walletKeys;
    }

    @Override
    public String walletAddress(String workflowId) {
        return walletKeys.walletAddress(workflowId);
    }

    @Override
    public String wrappedNativeToken() {
        return props.wrappedNative();
    }

    @Override
    public BigInteger nativeBalance(String workflowId) {
        return rpc(web3j.ethGetBalance(walletAddress(workflowId), DefaultBlockParameterName.LATEST)).getBalance();
    }

    @Override
    public BigInteger tokenBalance(String workflowId, String token) {
        return uint(call(token, ContractFunctions.balanceOf(walletAddress(workflowId))), 0);
    }

    @Override
    @SuppressWarnings("rawtypes")
    public Optional<PoolReserves> findPool(String tokenA, String tokenB) {
        String factory = address(call(props.router(), ContractFunctions.factory()), 0);
        String pair = address(call(factory, ContractFunctions.getPair(tokenA, tokenB)), 0);
        if (pair == null || ZERO_ADDRESS.equalsIgnoreCase(pair)) {
            return Optional.empty();
        }
        List<Type> reserves = call(pair, ContractFunctions.getReserves());
        return Optional.of(new PoolReserves(
                pair,
                address(call(pair, ContractFunctions.token0()), 0),
                address(call(pair, ContractFunctions.token1()), 0),
                uint(reserves, 0),
                uint(reserves, 1),
                uint(call(pair, ContractFunctions.totalSupply()), 0)));
    }

    @Override
    public List<BigInteger> getAmountsOut(BigInteger amountIn, List<String> path) {
        return uintArray(call(props.router(), ContractFunctions.getAmountsOut(amountIn, path)));
    }

    @Override
    public List<BigInteger> getAmountsIn(BigInteger amountOut, List<String> path) {
        return uintArray(call(props.router(), ContractFunctions.getAmountsIn(amountOut, path)));
    }

    @Override
    @SuppressWarnings("rawtypes")
    public LpPosition lpPosition(String workflowId, String pairAddress) {
        List<Type> out = call(props.automationContract(),
                ContractFunctions.checkLpTokenAmounts(pairAddress, walletAddress(workflowId)));
        return new LpPosition(uint(out, 0), address(out, 1), address(out, 2), uint(out, 3), uint(out, 4));
    }

    // ── writes ────────────────────────────────────────────────────────────────

    @Override
    public TransactionOutcome swapTokensForTokens(String workflowId, BigInteger amountIn, BigInteger amountOutMin,
                                                  List<String> path, String to) {
        return submit(workflowId,
                ContractFunctions.swapExactTokensForTokens(amountIn, amountOutMin, path, to, deadline()),
                props.executionFeeWei(), approvalsFor(path, amountIn));
    }

    @Override
    public TransactionOutcome swapPlsForTokens(String workflowId, BigInteger plsAmount, BigInteger amountOutMin,
                                               List<String> path, String to) {
        return submit(workflowId,
                ContractFunctions.swapExactPlsForTokens(amountOutMin, path, to, deadline()),
                props.executionFeeWei().add(plsAmount), List.of());
    }

    @Override
    public TransactionOutcome swapTokensForPls(String workflowId, BigInteger amountIn, BigInteger amountOutMin,
                                               List<String> path, String to) {
        return submit(workflowId,
                ContractFunctions.swapExactTokensForPls(amountIn, amountOutMin, path, to, deadline()),
                props.executionFeeWei(), approvalsFor(path, amountIn));
    }

    @Override
    public TransactionOutcome addLiquidity(String workflowId, String tokenA, String tokenB,
                                           BigInteger amountADesired, BigInteger amountBDesired,
                                           BigInteger amountAMin, BigInteger amountBMin, String to) {
        return submit(workflowId,
                ContractFunctions.addLiquidity(tokenA, tokenB, amountADesired, amountBDesired,
                        amountAMin, amountBMin, to, deadline()),
                props.executionFeeWei(),
                List.of(new Approval(tokenA, amountADesired), new Approval(tokenB, amountBDesired)));
    }

    @Override
    public TransactionOutcome addLiquidityPls(String workflowId, String token, BigInteger amountTokenDesired,
                                              BigInteger amountTokenMin, BigInteger amountPlsMin,
                                              BigInteger plsAmount, String to) {
        return submit(workflowId,
                ContractFunctions.addLiquidityPls(token, amountTokenDesired, amountTokenMin, amountPlsMin,
                        to, deadline()),
                props.executionFeeWei().add(plsAmount),
                List.of(new Approval(token, amountTokenDesired)));
    }

    @Override
    public TransactionOutcome removeLiquidity(String workflowId, String tokenA, String tokenB, BigInteger liquidity,
                                              BigInteger amountAMin, BigInteger amountBMin, String to) {
        return submit(workflowId,
                ContractFunctions.removeLiquidity(tokenA, tokenB, liquidity, amountAMin, amountBMin, to, deadline()),
                props.executionFeeWei(), lpApproval(tokenA, tokenB, liquidity));
    }

    @Override
    public TransactionOutcome removeLiquidityPls(String workflowId, String token, BigInteger liquidity,
                                                 BigInteger amountTokenMin, BigInteger amountPlsMin, String to) {
        return submit(workflowId,
                ContractFunctions.removeLiquidityPls(token, liquidity, amountTokenMin, amountPlsMin, to, deadline()),
                props.executionFeeWei(), lpApproval(token, props.wrappedNative(), liquidity));
    }

    @Override
    public TransactionOutcome transferToken(String workflowId, String token, String to, BigInteger amount) {
        return submit(workflowId, ContractFunctions.transferToken(token, to, amount),
                props.executionFeeWei(), List.of(new Approval(token, amount)));
    }

    @Override
    public TransactionOutcome transferPls(String workflowId, String to, BigInteger amount) {
        return submit(workflowId, ContractFunctions.transferPls(to, amount),
                props.executionFeeWei().add(amount), List.of());
    }

    @Override
    public TransactionOutcome burnToken(String workflowId, String token, BigInteger amount) {
        requirePlaygroundToken(token);
        return submit(workflowId, ContractFunctions.burnToken(token, amount),
                props.executionFeeWei(), List.of(new Approval(token, amount)));
    }

    @Override
    public TransactionOutcome claimToken(String workflowId, String token, BigInteger amount) {
        requirePlaygroundToken(token);
        return submit(workflowId, ContractFunctions.claimToken(token, amount),
                props.executionFeeWei(), List.of());
    }

    // ── transaction plumbing ──────────────────────────────────────────────────

    private TransactionOutcome submit(String workflowId, Function function, BigInteger value, List<Approval> approvals) {
        WalletLock lock = acquireWalletLock(workflowId);
        try {
            Credentials credentials = walletKeys.credentials(workflowId);
            TransactionManager txManager = new RawTransactionManager(web3j, credentials, props.chainId());
            String owner = credentials.getAddress();
            for (Approval approval : approvals) {
                ensureAllowance(txManager, owner, approval);
            }
            return sendAndWait(txManager, owner, props.automationContract(), function, value);
        } finally {
            releaseWalletLock(workflowId, lock);
        }
    }

    private WalletLock acquireWalletLock(String workflowId) {
        WalletLock walletLock = walletLocks.compute(workflowId, (id, existing) -> {
            WalletLock held = existing != null ? existing : new WalletLock();
            held.users++;
            return held;
        });
        walletLock.lock.lock();
        return walletLock;
    }

    private void releaseWalletLock(String workflowId, WalletLock walletLock) {
        walletLock.lock.unlock();
        walletLocks.computeIfPresent(workflowId, (id, held) -> --held.users == 0 ? null : held);
    }

    int trackedWalletLocks() {
        return walletLocks.size();
    }

    private void ensureAllowance(TransactionManager txManager, String owner, Approval approval) {
        if (approval.amount().signum() <= 0) {
            return;
        }
        BigInteger allowance = uint(call(approval.token(),
                ContractFunctions.allowance(owner, props.automationContract())), 0);
        if (allowance.compareTo(approval.amount()) < 0) {
            log.info("Approving {} of token {} for automation contract", approval.amount(), approval.token());
            sendAndWait(txManager, owner, approval.token(),
                    ContractFunctions.approve(props.automationContract(), approval.amount()), BigInteger.ZERO);
        }
    }

    private TransactionOutcome sendAndWait(TransactionManager txManager, String from, String to,
                                           Function function, BigInteger value) {
        String data = FunctionEncoder.encode(function);
        BigInteger gasPrice = rpc(web3j.ethGasPrice()).getGasPrice();
        BigInteger gasLimit = estimateGas(from, to, data, value);

        EthSendTransaction sent;
        try {
            sent = txManager.sendTransaction(gasPrice, gasLimit, to, data, value);
        } catch (IOException e) {
            throw networkFailure(e);
        }
        if (sent.hasError()) {
            throw rpcFailure(sent.getError(), null);
        }
        String txHash = sent.getTransactionHash();
        log.info("Sent {} from {} as {}", function.getName(), from, txHash);

        TransactionReceipt receipt = waitForReceipt(txHash);
        log.info("Transaction {} mined with status {}", txHash, receipt.getStatus());
        if (!receipt.isStatusOK()) {
            throw ChainAdapterException.reverted(txHash, receipt.getRevertReason());
        }
        return new TransactionOutcome(txHash, effectiveGasPrice(receipt, gasPrice), receipt.getGasUsed(),
                decodeTransfers(receipt));
    }

    private BigInteger estimateGas(String from, String to, String data, BigInteger value) {
        EthEstimateGas estimate = rpc(web3j.ethEstimateGas(
                Transaction.createFunctionCallTransaction(from, null, null, null, to, value, data)));
        if (estimate.hasError()) {
            throw rpcFailure(estimate.getError(), null);
        }
        return estimate.getAmountUsed()
                .multiply(BigInteger.valueOf(props.gasLimitMultiplierPercent()))
                .divide(BigInteger.valueOf(100));
    }

    private TransactionReceipt waitForReceipt(String txHash) {
        TransactionReceiptProcessor processor = new PollingTransactionReceiptProcessor(
                web3j, props.receiptPollIntervalMs(), props.receiptPollAttempts());
        try {
            return processor.waitForTransactionReceipt(txHash);
        } catch (IOException e) {
            throw networkFailure(e);
        } catch (TransactionException e) {
            throw new ChainAdapterException("Receipt polling timed out: " + e.getMessage(),
                    "TIMEOUT", null, null, txHash, e);
        }
    }

    private static BigInteger effectiveGasPrice(TransactionReceipt receipt, BigInteger fallback) {
        String effective = receipt.getEffectiveGasPrice();
        return effective != null && !effective.isBlank() ? Numeric.decodeQuantity(effective) : fallback;
    }

    @SuppressWarnings("rawtypes")
    private static List<TokenTransfer> decodeTransfers(TransactionReceipt receipt) {
        List<TokenTransfer> transfers = new ArrayList<>();
        for (Log entry : receipt.getLogs()) {
            List<String> topics = entry.getTopics();
            // ERC-721 transfers share the signature but carry the id as a fourth topic and no data
            if (topics == null || topics.size() != 3 || !TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
                continue;
            }
            List<Type> data = FunctionReturnDecoder.decode(entry.getData(),
                    ContractFunctions.TRANSFER_EVENT.getNonIndexedParameters());
            if (data.isEmpty()) {
                continue;
            }
            transfers.add(new TokenTransfer(
                    entry.getAddress(),
                    indexedAddress(topics.get(1)),
                    indexedAddress(topics.get(2)),
                    (BigInteger) data.get(0).getValue()));
        }
        return transfers;
    }

    private static String indexedAddress(String topic) {
        return FunctionReturnDecoder.decodeIndexedValue(topic, new TypeReference<Address>() {}).toString();
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    @SuppressWarnings("rawtypes")
    private List<Type> call(String contract, Function function) {
        String data = FunctionEncoder.encode(function);
        EthCall response = rpc(web3j.ethCall(
                Transaction.createEthCallTransaction(null, contract, data), DefaultBlockParameterName.LATEST));
        if (response.isReverted()) {
            throw new ChainAdapterException("execution reverted calling " + function.getName(),
                    "CALL_EXCEPTION", "call reverted", response.getRevertReason(), null, null);
        }
        if (response.hasError()) {
            throw rpcFailure(response.getError(), null);
        }
        return FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
    }

    @SuppressWarnings("rawtypes")
    private void requirePlaygroundToken(String token) {
        String parent;
        try {
            List<Type> out = call(token, ContractFunctions.parent());
            parent = out.isEmpty() ? null : address(out, 0);
        } catch (ChainAdapterException e) {
            // Ordinary ERC-20s have no parent() and revert
            boolean reverted = "CALL_EXCEPTION".equals(e.getCode())
                    || (e.getMessage() != null && e.getMessage().toLowerCase(Locale.ROOT).contains("revert"));
            if (!reverted) {
                throw e;
            }
            log.debug("parent() lookup failed for {}: {}", token, e.getMessage());
            parent = null;
        }
        if (parent == null || ZERO_ADDRESS.equalsIgnoreCase(parent)) {
            throw new ChainAdapterException("Invalid token: " + token + " is not a playground token");
        }
    }

    private <T extends Response<?>> T rpc(Request<?, T> request) {
        try {
            return request.send();
        } catch (IOException e) {
            throw networkFailure(e);
        }
    }

    private static ChainAdapterException networkFailure(IOException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ChainAdapterException("Network error: " + message, e);
    }

    private static ChainAdapterException rpcFailure(Response.Error error, String txHash) {
        return new ChainAdapterException(error.getMessage(), String.valueOf(error.getCode()),
                error.getMessage(), revertReason(error), txHash, null);
    }

    /**
     * Reason string of a JSON-RPC revert: the ABI-encoded Error(string) in the error data when present,
     * otherwise whatever follows "execution reverted:" in the message. Custom errors stay as raw hex.
     */
    @SuppressWarnings("rawtypes")
    static String revertReason(Response.Error error) {
        String data = error.getData();
        if (data != null && data.regionMatches(true, 0, ERROR_SELECTOR, 0, ERROR_SELECTOR.length())) {
            try {
                List<Type> decoded = FunctionReturnDecoder.decode(data.substring(ERROR_SELECTOR.length()), ERROR_STRING);
                if (!decoded.isEmpty()) {
                    return decoded.get(0).getValue().toString();
                }
            } catch (RuntimeException e) {
                log.debug("Undecodable revert data {}: {}", data, e.getMessage());
            }
        }
        String message = error.getMessage();
        if (message != null) {
            int marker = message.toLowerCase(Locale.ROOT).indexOf(REVERTED_PREFIX);
            if (marker >= 0) {
                String reason = message.substring(marker + REVERTED_PREFIX.length()).trim();
                if (!reason.isEmpty()) {
                    return reason;
                }
            }
        }
        return data;
    }

    private BigInteger deadline() {
        return BigInteger.valueOf(Instant.now().getEpochSecond() + props.deadlineSeconds());
    }

    private static List<Approval> approvalsFor(List<String> path, BigInteger amount) {
        return path.isEmpty() ? List.of() : List.of(new Approval(path.get(0), amount));
    }

    private List<Approval> lpApproval(String tokenA, String tokenB, BigInteger liquidity) {
        return findPool(tokenA, tokenB)
                .map(pool -> List.of(new Approval(pool.pairAddress(), liquidity)))
                .orElseGet(List::of);
    }

    @SuppressWarnings("rawtypes")
    private static BigInteger uint(List<Type> values, int index) {
        if (values.size() <= index) {
            throw new ChainAdapterException("Empty result from contract call");
        }
        return (BigInteger) values.get(index).getValue();
    }

    @SuppressWarnings("rawtypes")
    private static String address(List<Type> values, int index) {
        if (values.size() <= index) {
            throw new ChainAdapterException("Empty result from contract call");
        }
        return values.get(index).toString();
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static List<BigInteger> uintArray(List<Type> values) {
        if (values.isEmpty()) {
            throw new ChainAdapterException("Empty result from contract call");
        }
        List<Type> items = (List<Type>) values.get(0).getValue();
        return items.stream().map(item -> (BigInteger) item.getValue()).toList();
    }

    private record Approval(String token, BigInteger amount) {}

    private static final class WalletLock {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's compute on this wallet's key
        private int users;
    }
}
