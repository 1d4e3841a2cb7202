package com.fundradar.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes BigDecimal as Decimal128. Values with more than 34 significant digits (long divisions) are rounded
 * to DECIMAL128 precision first.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        if (source == null) {
            return null;
        }
        BigDecimal value = source.precision() > MathContext.DECIMAL128.getPrecision()
                ? source.round(MathContext.DECIMAL128)
                : source;
        return new Decimal128(value);
    }
}
