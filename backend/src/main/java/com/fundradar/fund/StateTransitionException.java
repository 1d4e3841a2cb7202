package com.fundradar.fund;

/**
 * Illegal fee lifecycle transition: ALREADY_PAID, NOT_CALCULATED, PERIOD_ALREADY_CALCULATED.
 */
public class StateTransitionException extends FundAccountingException {

    public static final String ALREADY_PAID = "ALREADY_PAID";
    public static final String NOT_CALCULATED = "NOT_CALCULATED";
    public static final String PERIOD_ALREADY_CALCULATED = "PERIOD_ALREADY_CALCULATED";

    public StateTransitionException(String errorCode, String message) {
        super(errorCode, message);
    }
}
