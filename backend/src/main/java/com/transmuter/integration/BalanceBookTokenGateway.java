package com.transmuter.integration;

import com.transmuter.domain.TokenBalance;
import com.transmuter.domain.TokenBalanceRepository;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Balance book for standalone deployments, one document per token and holder. Balances are written through
 * the same repositories as the ledger, so a settlement that is rolled back leaves them untouched.
 */
@Slf4j
public class BalanceBookTokenGateway implements TokenGateway {

    private final TokenBalanceRepository repository;
    private final String stablecoin;
    private final String reserve;

    public BalanceBookTokenGateway(TokenBalanceRepository repository, String stablecoin, String reserve) {
        this.repository = repository;
        this.stablecoin = stablecoin;
        this.reserve = reserve;
    }

    @Override
    public void transferCollateral(String asset, String managerTarget, String counterparty, BigInteger amount, boolean isMint) {
        String holder = holderOf(managerTarget);
        if (isMint) {
            transfer(asset, counterparty, holder, amount);
        } else {
            transfer(asset, holder, counterparty, amount);
        }
    }

    @Override
    public void mint(String to, BigInteger amount) {
        credit(stablecoin, to, amount);
    }

    @Override
    public void burnSelf(BigInteger amount, String from) {
        debit(stablecoin, from, amount);
    }

    @Override
    public BigInteger balanceOf(String token, String holder) {
        return repository.findById(TokenBalance.idOf(token, holder))
                .map(TokenBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Override
    public BigInteger collateralHeld(String asset, String managerTarget) {
        return balanceOf(asset, holderOf(managerTarget));
    }

    @Override
    public void deposit(String token, String holder, BigInteger amount) {
        credit(token, holder, amount);
        log.info("Deposited {} of {} to {}", amount, token, holder);
    }

    public void transfer(String token, String from, String to, BigInteger amount) {
        debit(token, from, amount);
        credit(token, to, amount);
        log.debug("Moved {} of {} from {} to {}", amount, token, from, to);
    }

    private String holderOf(String managerTarget) {
        return managerTarget != null ? managerTarget : reserve;
    }

    private void credit(String token, String holder, BigInteger amount) {
        TokenBalance entry = load(token, holder);
        entry.setBalance(entry.getBalance().add(amount));
        repository.save(entry);
    }

    private void debit(String token, String holder, BigInteger amount) {
        TokenBalance entry = load(token, holder);
        BigInteger balance = entry.getBalance();
        if (balance.compareTo(amount) < 0) {
            throw new TokenTransferException("Insufficient " + token + " balance for " + holder
                    + ": " + balance + " < " + amount);
        }
        entry.setBalance(balance.subtract(amount));
        repository.save(entry);
    }

    private TokenBalance load(String token, String holder) {
        return repository.findById(TokenBalance.idOf(token, holder))
                .orElseGet(() -> new TokenBalance(token, holder));
    }
}
