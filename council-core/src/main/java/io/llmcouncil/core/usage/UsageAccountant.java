package io.llmcouncil.core.usage;

import java.math.BigDecimal;
import java.math.RoundingMode;

/// Running total of token usage and cost across the calls of one council run.
///
/// Each call's cost is already rounded to 6 decimals by the cost calculator; the
/// accumulated total is reported rounded to 4 decimals.
///
/// @implNote Not thread-safe. The orchestrator folds results only after each stage's
/// join barrier, on a single thread.
public final class UsageAccountant {

    private TokenUsage tokens = TokenUsage.ZERO;
    private double cost;

    /// Adds one call (or one merged record) to the totals.
    ///
    /// @param usage token usage of the call, not null
    /// @param callCost cost of the call in USD
    /// @return this accountant for chaining
    public UsageAccountant add(TokenUsage usage, double callCost) {
        tokens = tokens.plus(usage);
        cost += callCost;
        return this;
    }

    public TokenUsage totalTokens() {
        return tokens;
    }

    /// Returns the accumulated cost rounded to 4 decimals.
    public double totalCost() {
        return BigDecimal.valueOf(cost).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
