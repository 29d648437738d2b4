package com.transmuter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface TokenBalanceRepository extends MongoRepository<TokenBalance, String> {
}
