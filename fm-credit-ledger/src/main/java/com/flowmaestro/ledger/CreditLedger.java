package com.flowmaestro.ledger;

/**
 * Resource ledger collaborator. Storage is up to the implementation.
 * <p>
 * A hold reduces available credits until it is either settled (debited with the actual amount)
 * or released (returned in full). Implementations must reject settling or releasing a handle
 * that is no longer held.
 */
public interface CreditLedger {

    /** Whether the subject can currently afford {@code amount} credits. */
    boolean checkAllowance(String subjectId, long amount);

    /**
     * Places a hold.
     *
     * @throws InsufficientBudgetException when available credits are below {@code amount}
     */
    ReservationHandle hold(String subjectId, long amount);

    /** Converts the hold into a debit of {@code actualAmount} credits. */
    void settle(ReservationHandle handle, long actualAmount);

    /** Returns the full hold without debiting. */
    void release(ReservationHandle handle);
}
