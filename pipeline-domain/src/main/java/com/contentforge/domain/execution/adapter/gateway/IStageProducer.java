package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.content.model.valobj.Validatable;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.types.enums.ProducerRoleEnum;

/**
 * Producer contract: turn one input artifact into one output artifact.
 * <p>
 * An invocation may block on an external collaborator and may raise; the executor treats any
 * raised exception as an operational failure of the run and never retries.
 * </p>
 *
 * @param <I> input artifact type
 * @param <O> output artifact type
 */
public interface IStageProducer<I, O extends Validatable> {

    ProducerRoleEnum role();

    O invoke(I input, StageContext context);
}
