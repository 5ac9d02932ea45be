package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.execution.model.valobj.StepLedgerEntry;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;

/**
 * Observer of a run's progress. Called from the thread driving the run.
 */
public interface IExecutionProgressListener {

    IExecutionProgressListener NOOP = new IExecutionProgressListener() {
    };

    default void onRunStarted(ExecutionPlan plan) {
    }

    default void onStepRecorded(PlanStep step, StepLedgerEntry entry) {
    }
}
