package com.transmuter.api.dto;

/**
 * {@code stablecoinsFromCollateral} is null on the ledger-wide endpoint.
 */
public record IssuedResponse(String stablecoinsFromCollateral, String stablecoinsIssued) {
}
