package com.rangerewards.claim;

import com.rangerewards.domain.PositionKey;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/** Amounts taken from an owner's positions by one claim, per token and per position. */
@Getter
public class ClaimBatch {

    private final String owner;
    private final Map<String, BigInteger> totals = new LinkedHashMap<>();
    private final Map<PositionKey, Map<String, BigInteger>> settled = new LinkedHashMap<>();

    public ClaimBatch(String owner) {
        this.owner = owner;
    }

    void add(PositionKey key, Map<String, BigInteger> amounts) {
        settled.put(key, amounts);
        amounts.forEach((token, amount) -> totals.merge(token, amount, BigInteger::add));
    }

    public BigInteger total(String token) {
        return totals.getOrDefault(token, BigInteger.ZERO);
    }

    public boolean isEmpty() {
        return totals.values().stream().allMatch(amount -> amount.signum() == 0);
    }
}
