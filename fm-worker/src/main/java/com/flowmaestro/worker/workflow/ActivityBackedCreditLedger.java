package com.flowmaestro.worker.workflow;

import com.flowmaestro.ledger.CreditLedger;
import com.flowmaestro.ledger.InsufficientBudgetException;
import com.flowmaestro.ledger.ReservationHandle;
import com.flowmaestro.worker.activity.FlowActivities;

import java.util.Objects;

/**
 * Workflow-side view of the ledger: each call is a ledger activity, so holds and settlements are
 * recorded in history and not repeated on replay.
 */
final class ActivityBackedCreditLedger implements CreditLedger {

    private final FlowActivities activities;

    ActivityBackedCreditLedger(FlowActivities activities) {
        this.activities = Objects.requireNonNull(activities, "activities");
    }

    @Override
    public boolean checkAllowance(String subjectId, long amount) {
        return activities.checkAllowance(subjectId, amount);
    }

    @Override
    public ReservationHandle hold(String subjectId, long amount) {
        ReservationHandle handle = activities.holdCredits(subjectId, amount);
        if (handle == null) {
            throw new InsufficientBudgetException(subjectId, amount);
        }
        return handle;
    }

    @Override
    public void settle(ReservationHandle handle, long actualAmount) {
        activities.settleCredits(handle, actualAmount);
    }

    @Override
    public void release(ReservationHandle handle) {
        activities.releaseCredits(handle);
    }
}
