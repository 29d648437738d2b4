package com.transmuter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface TransmuterLedgerRepository extends MongoRepository<TransmuterLedger, String> {
}
