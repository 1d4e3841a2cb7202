package com.fundradar.fund;

import lombok.Getter;

/**
 * Thrown when a fund-accounting request is invalid or violates a business rule.
 * An API layer maps {@link #getErrorCode()} to its own status codes.
 */
@Getter
public class FundAccountingException extends RuntimeException {

    /** Error codes: FEE_NOT_FOUND, INVESTOR_NOT_FOUND, INVALID_CASH_FLOW, plus those of the subclasses. */
    private final String errorCode;

    public FundAccountingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
