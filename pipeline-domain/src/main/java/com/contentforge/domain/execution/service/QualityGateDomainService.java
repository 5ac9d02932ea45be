package com.contentforge.domain.execution.service;

import com.contentforge.domain.content.model.valobj.GateResult;
import com.contentforge.domain.content.model.valobj.Validatable;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Quality gate evaluation: runs the artifact's invariant check and applies the enforcement policy.
 */
@Service
public class QualityGateDomainService {

    public GateDecision evaluate(PlanStep step, Validatable artifact, boolean strictQualityGates) {
        if (step == null || !step.hasGate() || artifact == null) {
            return GateDecision.pass();
        }
        GateResult result = artifact.checkInvariants();
        if (result.ok()) {
            return GateDecision.pass();
        }
        String message = step.gate().getLabel() + " quality gate failed: " + result.problems();
        return new GateDecision(false, result.problems(), message, strictQualityGates);
    }

    /**
     * @param runEnding the failure must end the run (strict mode)
     */
    public record GateDecision(boolean passed, List<String> problems, String message, boolean runEnding) {

        public static GateDecision pass() {
            return new GateDecision(true, List.of(), null, false);
        }
    }
}
