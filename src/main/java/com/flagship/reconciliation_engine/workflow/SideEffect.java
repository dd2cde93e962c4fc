package com.flagship.reconciliation_engine.workflow;

/**
 * Work a transition asks for beyond the status change itself.
 */
public enum SideEffect {
    NONE,
    /** Debit withholding-tax payable, credit bank, for the deposited amount. */
    POST_WHT_DEPOSIT
}
