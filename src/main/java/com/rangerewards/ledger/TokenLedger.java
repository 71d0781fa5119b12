package com.rangerewards.ledger;

import java.math.BigInteger;

/**
 * Token balances and transfers. A transfer is a suspension point: implementations may run
 * external code (token callbacks) that re-enters the caller before returning.
 */
public interface TokenLedger {

    BigInteger balanceOf(String token, String account);

    /**
     * Moves {@code amount} of {@code token} from one account to another.
     *
     * @throws com.rangerewards.exception.InsufficientRewardBalanceException if {@code from}
     *     holds less than {@code amount}
     */
    void transfer(String token, String from, String to, BigInteger amount);
}
