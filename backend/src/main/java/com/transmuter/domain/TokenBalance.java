package com.transmuter.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;

/**
 * Balance of one token held by one address in the standalone balance book. Id is {@code token:holder}.
 */
@Document(collection = "token_balances")
@NoArgsConstructor
@Getter
@Setter
public class TokenBalance {

    @Id
    private String id;
    private String token;
    private String holder;
    private BigInteger balance = BigInteger.ZERO;

    public TokenBalance(String token, String holder) {
        this.id = idOf(token, holder);
        this.token = token;
        this.holder = holder;
    }

    public static String idOf(String token, String holder) {
        return token + ":" + holder;
    }
}
