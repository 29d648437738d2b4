package com.transmuter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for collaterals. Accessed only through the state store.
 */
public interface CollateralRepository extends MongoRepository<Collateral, String> {
}
