package com.pulseflow.pulseflow_backend.engine;

import com.pulseflow.pulseflow_backend.exception.ChainAdapterException;
import com.pulseflow.pulseflow_backend.exception.WorkflowExecutionException;
import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;
import com.pulseflow.pulseflow_backend.model.error.ParsedError;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns a node failure into a {@link ParsedError}. Exceptions that already know their category are taken
 * at their word; everything else is matched against an ordered pattern table, first match wins.
 */
@Component
public class ErrorClassifier {

    static final String UNKNOWN_MESSAGE = "An unexpected error occurred.";

    private record Rule(Pattern pattern, ErrorCategory category, boolean retryable, String userMessage) {
        static Rule of(String regex, ErrorCategory category, boolean retryable, String userMessage) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category, retryable, userMessage);
        }
    }

    private static final Rule REVERT = Rule.of("execution reverted|revert|CALL_EXCEPTION",
            ErrorCategory.BLOCKCHAIN, false, "Transaction would revert - check your parameters.");

    private static final List<Rule> RULES = List.of(
            Rule.of("504 Gateway|502 Bad Gateway|503 Service",
                    ErrorCategory.NETWORK, true, "RPC server is temporarily unavailable. Try again in a moment."),
            Rule.of("ETIMEDOUT|ECONNREFUSED|ENOTFOUND|timeout|timed out",
                    ErrorCategory.NETWORK, true, "Request timed out. The network may be congested."),
            Rule.of("rate limit|429|too many requests",
                    ErrorCategory.NETWORK, true, "Too many requests. Please wait and try again."),
            Rule.of("network error|fetch failed|failed to fetch|failed to connect",
                    ErrorCategory.NETWORK, true, "Network connection failed. Check your internet connection."),
            Rule.of("insufficient funds",
                    ErrorCategory.BLOCKCHAIN, false, "Wallet has insufficient funds for this transaction."),
            Rule.of("gas required exceeds|exceeds block gas limit",
                    ErrorCategory.BLOCKCHAIN, false, "Transaction would fail - gas estimation exceeded."),
            Rule.of("nonce too low|nonce has already been used",
                    ErrorCategory.BLOCKCHAIN, true, "Transaction conflict - nonce already used. Try again."),
            REVERT,
            Rule.of("user rejected|user denied",
                    ErrorCategory.BLOCKCHAIN, false, "Transaction was rejected."),
            Rule.of("replacement.*underpriced",
                    ErrorCategory.BLOCKCHAIN, true, "Gas price too low for replacement transaction."),
            Rule.of("not found|does not exist",
                    ErrorCategory.CONFIG, false, "Resource not found. Check your configuration."),
            Rule.of("invalid address|invalid token",
                    ErrorCategory.CONFIG, false, "Invalid address provided. Check your configuration.")
    );

    public ParsedError classify(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (cause instanceof WorkflowExecutionException wee && wee.getCategoryHint() != null) {
            return ParsedError.of(wee.getCategoryHint(), wee.isRetryable(), message, message);
        }

        String code = null;
        String shortMessage = null;
        String revertReason = null;
        String txHash = null;
        if (cause instanceof ChainAdapterException chain) {
            code = chain.getCode();
            shortMessage = chain.getShortMessage();
            revertReason = chain.getRevertReason();
            txHash = chain.getTxHash();
        }

        String details = Stream.of(message, shortMessage, revertReason, code)
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .collect(Collectors.joining(" | "));

        for (Rule rule : RULES) {
            if (rule.pattern().matcher(details).find()) {
                String userMessage = rule == REVERT && revertReason != null && !revertReason.isBlank()
                        ? "Transaction reverted: " + revertReason
                        : rule.userMessage();
                return new ParsedError(rule.category(), rule.retryable(), userMessage, details,
                        code, revertReason, txHash);
            }
        }
        return new ParsedError(ErrorCategory.UNKNOWN, false, UNKNOWN_MESSAGE, details, code, revertReason, txHash);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
