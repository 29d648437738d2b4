package com.transmuter.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigInteger;

/**
 * Writes uint256 amounts as base-10 strings; they do not fit in a BSON Int64.
 */
@WritingConverter
public class BigIntegerToStringConverter implements Converter<BigInteger, String> {

    @Override
    public String convert(BigInteger source) {
        return source == null ? null : source.toString();
    }
}
