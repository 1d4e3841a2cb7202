package com.fundradar.ledger;

/**
 * What a sell larger than the held quantity does.
 */
public enum OversellPolicy {
    /** The sell is rejected and the position is left untouched. */
    REJECT,
    /**
     * The position goes short at the sell price. A later buy realizes P&amp;L on the quantity it covers; if it
     * turns the quantity positive again the average cost re-bases at its price.
     */
    ALLOW_SHORT
}
