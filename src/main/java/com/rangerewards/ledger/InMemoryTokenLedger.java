package com.rangerewards.ledger;

import com.rangerewards.exception.BusinessException;
import com.rangerewards.exception.ErrorCode;
import com.rangerewards.exception.InsufficientRewardBalanceException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local token ledger. Balances live in memory; {@link #mint} funds accounts for local
 * runs and tests. Registered {@link TransferHook}s run after every transfer, in registration
 * order, and may call back into the distributors. A hook that throws reverts the transfer.
 */
@Component
public class InMemoryTokenLedger implements TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTokenLedger.class);

    private final Map<String, Map<String, BigInteger>> balances = new ConcurrentHashMap<>();
    private final List<TransferHook> hooks = new CopyOnWriteArrayList<>();

    @Override
    public BigInteger balanceOf(String token, String account) {
        Map<String, BigInteger> byAccount = balances.get(token);
        return byAccount != null ? byAccount.getOrDefault(account, BigInteger.ZERO) : BigInteger.ZERO;
    }

    @Override
    public void transfer(String token, String from, String to, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Transfer amount must not be negative");
        }
        synchronized (balances) {
            BigInteger available = balanceOf(token, from);
            if (available.compareTo(amount) < 0) {
                throw new InsufficientRewardBalanceException(token, amount, available);
            }
            Map<String, BigInteger> byAccount = balances.computeIfAbsent(token, t -> new ConcurrentHashMap<>());
            byAccount.put(from, available.subtract(amount));
            byAccount.merge(to, amount, BigInteger::add);
        }
        log.debug("Transferred {} {} from {} to {}", amount, token, from, to);
        try {
            for (TransferHook hook : hooks) {
                hook.onTransfer(token, from, to, amount);
            }
        } catch (RuntimeException e) {
            synchronized (balances) {
                Map<String, BigInteger> byAccount = balances.get(token);
                byAccount.merge(to, amount.negate(), BigInteger::add);
                byAccount.merge(from, amount, BigInteger::add);
            }
            log.warn("Transfer of {} {} from {} to {} reverted by hook: {}", amount, token, from, to, e.getMessage());
            throw e;
        }
    }

    public void mint(String token, String account, BigInteger amount) {
        balances.computeIfAbsent(token, t -> new ConcurrentHashMap<>()).merge(account, amount, BigInteger::add);
        log.info("Minted {} {} to {}", amount, token, account);
    }

    public void addHook(TransferHook hook) {
        hooks.add(hook);
    }

    public void removeHook(TransferHook hook) {
        hooks.remove(hook);
    }
}
