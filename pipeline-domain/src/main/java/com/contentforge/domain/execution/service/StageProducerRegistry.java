package com.contentforge.domain.execution.service;

import com.contentforge.domain.execution.adapter.gateway.IStageProducer;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.types.enums.ProducerRoleEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Producer lookup by role: exactly one producer per role.
 */
@Slf4j
@Service
public class StageProducerRegistry {

    private final Map<ProducerRoleEnum, IStageProducer<?, ?>> producers = new EnumMap<>(ProducerRoleEnum.class);

    public StageProducerRegistry(List<IStageProducer<?, ?>> stageProducers) {
        if (stageProducers != null) {
            for (IStageProducer<?, ?> producer : stageProducers) {
                if (producer == null) {
                    continue;
                }
                IStageProducer<?, ?> previous = producers.putIfAbsent(producer.role(), producer);
                if (previous != null) {
                    throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                            "More than one producer registered for role: " + producer.role().getCode());
                }
            }
        }
        log.info("Stage producers registered. roles={}", producers.keySet());
    }

    public boolean isRegistered(ProducerRoleEnum role) {
        return role != null && producers.containsKey(role);
    }

    public Set<ProducerRoleEnum> registeredRoles() {
        return Collections.unmodifiableSet(producers.keySet());
    }

    /**
     * Every role referenced by the plan must be registered.
     */
    public void ensureRegistered(ExecutionPlan plan) {
        for (PlanStep step : plan.steps()) {
            if (!isRegistered(step.producerRole())) {
                throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                        "No producer registered for role: " + step.producerRole().getCode()
                                + " (step " + step.stepName() + ")");
            }
        }
    }

    public <P extends IStageProducer<?, ?>> P require(ProducerRoleEnum role, Class<P> type) {
        IStageProducer<?, ?> producer = producers.get(role);
        if (producer == null) {
            throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                    "No producer registered for role: " + role.getCode());
        }
        if (!type.isInstance(producer)) {
            throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                    "Producer for role " + role.getCode() + " is not a " + type.getSimpleName());
        }
        return type.cast(producer);
    }
}
