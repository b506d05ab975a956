package projectoasis.policy.food.impl;

import projectoasis.domain.farm.ProcessingSplit;
import projectoasis.policy.food.FoodPolicyType;
import projectoasis.policy.food.FoodProcessingContext;
import projectoasis.policy.i.IFoodProcessingPolicy;

public class AllFreshPolicy implements IFoodProcessingPolicy {

    @Override
    public ProcessingSplit allocate(FoodProcessingContext context) {
        return ProcessingSplit.ALL_FRESH;
    }

    @Override
    public String getName() {
        return FoodPolicyType.ALL_FRESH.getCode();
    }
}
