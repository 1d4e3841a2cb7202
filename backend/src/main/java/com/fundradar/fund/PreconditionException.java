package com.fundradar.fund;

/**
 * A required input is not there yet, e.g. NAV_UNDEFINED when a fee period boundary has no NAV snapshot,
 * or INVESTOR_INACTIVE for a deposit by a deactivated investor.
 */
public class PreconditionException extends FundAccountingException {

    public static final String NAV_UNDEFINED = "NAV_UNDEFINED";
    public static final String INVESTOR_INACTIVE = "INVESTOR_INACTIVE";

    public PreconditionException(String errorCode, String message) {
        super(errorCode, message);
    }
}
