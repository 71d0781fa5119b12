package com.rangerewards.ledger;

import java.math.BigInteger;

/**
 * Callback run by {@link InMemoryTokenLedger} after a transfer, standing in for token hooks.
 * Throwing reverts the transfer.
 */
@FunctionalInterface
public interface TransferHook {

    void onTransfer(String token, String from, String to, BigInteger amount);
}
