package projectoasis.policy.food.impl;

import projectoasis.domain.farm.ProcessingSplit;
import projectoasis.policy.food.FoodProcessingContext;
import projectoasis.policy.i.IFoodProcessingPolicy;

import java.util.Objects;

/**
 * Reparto constante, independiente del precio del día.
 * Da soporte a {@code maximize_storage} y {@code balanced_mix}.
 */
public class FixedSplitPolicy implements IFoodProcessingPolicy {

    private final String name;
    private final ProcessingSplit split;

    public FixedSplitPolicy(String name, ProcessingSplit split) {
        this.name = Objects.requireNonNull(name);
        this.split = Objects.requireNonNull(split);
    }

    @Override
    public ProcessingSplit allocate(FoodProcessingContext context) {
        return split;
    }

    @Override
    public String getName() {
        return name;
    }
}
