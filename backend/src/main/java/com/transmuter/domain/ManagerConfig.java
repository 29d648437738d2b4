package com.transmuter.domain;

/**
 * Manager linkage of a collateral: the address idle collateral is deployed to and the strategy in charge.
 */
public record ManagerConfig(String target, String strategy) {
}
