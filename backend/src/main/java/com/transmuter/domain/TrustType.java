package com.transmuter.domain;

public enum TrustType {
    /** May rebase the normalizer. */
    TRUSTED,
    SELLER
}
