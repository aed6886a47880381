package com.pulseflow.pulseflow_backend.chain;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * ABI function descriptors for the automation contract, the DEX router and its pairs, and plain ERC-20s.
 */
final class ContractFunctions {

    static final Event TRANSFER_EVENT = new Event("Transfer", List.of(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>(false) {}));

    private ContractFunctions() {
    }

    // ── automation contract ───────────────────────────────────────────────────

    static Function swapExactTokensForTokens(BigInteger amountIn, BigInteger amountOutMin, List<String> path,
                                             String to, BigInteger deadline) {
        return write("swapExactTokensForTokens",
                uint(amountIn), uint(amountOutMin), addressArray(path), new Address(to), uint(deadline));
    }

    static Function swapExactPlsForTokens(BigInteger amountOutMin, List<String> path, String to, BigInteger deadline) {
        return write("swapExactPLSForTokens",
                uint(amountOutMin), addressArray(path), new Address(to), uint(deadline));
    }

    static Function swapExactTokensForPls(BigInteger amountIn, BigInteger amountOutMin, List<String> path,
                                          String to, BigInteger deadline) {
        return write("swapExactTokensForPLS",
                uint(amountIn), uint(amountOutMin), addressArray(path), new Address(to), uint(deadline));
    }

    static Function addLiquidity(String tokenA, String tokenB, BigInteger amountADesired, BigInteger amountBDesired,
                                 BigInteger amountAMin, BigInteger amountBMin, String to, BigInteger deadline) {
        return write("addLiquidity",
                new Address(tokenA), new Address(tokenB), uint(amountADesired), uint(amountBDesired),
                uint(amountAMin), uint(amountBMin), new Address(to), uint(deadline));
    }

    static Function addLiquidityPls(String token, BigInteger amountTokenDesired, BigInteger amountTokenMin,
                                    BigInteger amountPlsMin, String to, BigInteger deadline) {
        return write("addLiquidityPLS",
                new Address(token), uint(amountTokenDesired), uint(amountTokenMin), uint(amountPlsMin),
                new Address(to), uint(deadline));
    }

    static Function removeLiquidity(String tokenA, String tokenB, BigInteger liquidity, BigInteger amountAMin,
                                    BigInteger amountBMin, String to, BigInteger deadline) {
        return write("removeLiquidity",
                new Address(tokenA), new Address(tokenB), uint(liquidity), uint(amountAMin), uint(amountBMin),
                new Address(to), uint(deadline));
    }

    static Function removeLiquidityPls(String token, BigInteger liquidity, BigInteger amountTokenMin,
                                       BigInteger amountPlsMin, String to, BigInteger deadline) {
        return write("removeLiquidityPLS",
                new Address(token), uint(liquidity), uint(amountTokenMin), uint(amountPlsMin),
                new Address(to), uint(deadline));
    }

    static Function transferToken(String token, String to, BigInteger amount) {
        return write("transferToken", new Address(token), new Address(to), uint(amount));
    }

    static Function transferPls(String to, BigInteger amount) {
        return write("transferPLS", new Address(to), uint(amount));
    }

    static Function burnToken(String token, BigInteger amount) {
        return write("burnToken", new Address(token), uint(amount));
    }

    static Function claimToken(String token, BigInteger amount) {
        return write("claimToken", new Address(token), uint(amount));
    }

    static Function checkLpTokenAmounts(String pairAddress, String user) {
        return new Function("checkLPTokenAmounts",
                List.of(new Address(pairAddress), new Address(user)),
                List.of(new TypeReference<Uint256>() {}, new TypeReference<Address>() {},
                        new TypeReference<Address>() {}, new TypeReference<Uint256>() {},
                        new TypeReference<Uint256>() {}));
    }

    // ── router / factory / pair ───────────────────────────────────────────────

    static Function getAmountsOut(BigInteger amountIn, List<String> path) {
        return new Function("getAmountsOut", List.of(uint(amountIn), addressArray(path)),
                List.of(new TypeReference<DynamicArray<Uint256>>() {}));
    }

    static Function getAmountsIn(BigInteger amountOut, List<String> path) {
        return new Function("getAmountsIn", List.of(uint(amountOut), addressArray(path)),
                List.of(new TypeReference<DynamicArray<Uint256>>() {}));
    }

    static Function factory() {
        return new Function("factory", List.of(), List.of(new TypeReference<Address>() {}));
    }

    static Function getPair(String tokenA, String tokenB) {
        return new Function("getPair", List.of(new Address(tokenA), new Address(tokenB)),
                List.of(new TypeReference<Address>() {}));
    }

    static Function getReserves() {
        return new Function("getReserves", List.of(),
                List.of(new TypeReference<Uint112>() {}, new TypeReference<Uint112>() {},
                        new TypeReference<Uint32>() {}));
    }

    static Function token0() {
        return new Function("token0", List.of(), List.of(new TypeReference<Address>() {}));
    }

    static Function token1() {
        return new Function("token1", List.of(), List.of(new TypeReference<Address>() {}));
    }

    /** Playground tokens expose their parent; other tokens revert or return the zero address. */
    static Function parent() {
        return new Function("parent", List.of(), List.of(new TypeReference<Address>() {}));
    }

    // ── ERC-20 ────────────────────────────────────────────────────────────────

    static Function balanceOf(String owner) {
        return new Function("balanceOf", List.of(new Address(owner)), List.of(new TypeReference<Uint256>() {}));
    }

    static Function totalSupply() {
        return new Function("totalSupply", List.of(), List.of(new TypeReference<Uint256>() {}));
    }

    static Function allowance(String owner, String spender) {
        return new Function("allowance", List.of(new Address(owner), new Address(spender)),
                List.of(new TypeReference<Uint256>() {}));
    }

    static Function approve(String spender, BigInteger amount) {
        return write("approve", new Address(spender), uint(amount));
    }

    @SuppressWarnings("rawtypes")
    private static Function write(String name, Type... inputs) {
        return new Function(name, Arrays.asList(inputs), Collections.emptyList());
    }

    private static Uint256 uint(BigInteger value) {
        return new Uint256(value);
    }

    private static DynamicArray<Address> addressArray(List<String> path) {
        return new DynamicArray<>(Address.class, path.stream().map(Address::new).toList());
    }
}
