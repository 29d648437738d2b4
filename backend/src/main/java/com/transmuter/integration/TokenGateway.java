package com.transmuter.integration;

import java.math.BigInteger;

/**
 * Token movements triggered by a settlement. Called only while the transmuter state is locked.
 */
public interface TokenGateway {

    /**
     * Moves collateral between {@code counterparty} and the reserve, or the manager target when one is given.
     * On a mint the collateral comes in from the counterparty; otherwise it goes out to it.
     */
    void transferCollateral(String asset, String managerTarget, String counterparty, BigInteger amount, boolean isMint);

    void mint(String to, BigInteger amount);

    void burnSelf(BigInteger amount, String from);

    BigInteger balanceOf(String token, String holder);

    /**
     * Collateral held where {@link #transferCollateral} pays burns from: the manager target, or the reserve.
     */
    BigInteger collateralHeld(String asset, String managerTarget);

    /**
     * Credits {@code amount} of {@code token} received from outside the transmuter to {@code holder}.
     */
    void deposit(String token, String holder, BigInteger amount);
}
