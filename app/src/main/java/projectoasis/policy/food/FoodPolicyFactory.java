package projectoasis.policy.food;

import projectoasis.config.FoodPolicyParameters;
import projectoasis.config.FoodPolicySpec;
import projectoasis.domain.farm.ProcessingSplit;
import projectoasis.policy.food.impl.AllFreshPolicy;
import projectoasis.policy.food.impl.FixedSplitPolicy;
import projectoasis.policy.food.impl.MarketResponsivePolicy;
import projectoasis.policy.i.IFoodProcessingPolicy;

/**
 * Construye políticas de procesado. Sin especificación, toda la cosecha se vende en fresco.
 */
public class FoodPolicyFactory {

    public static final ProcessingSplit MAXIMIZE_STORAGE_SPLIT = new ProcessingSplit(0.20, 0.10, 0.35, 0.35);
    public static final ProcessingSplit BALANCED_MIX_SPLIT = new ProcessingSplit(0.50, 0.20, 0.15, 0.15);

    public IFoodProcessingPolicy create(FoodPolicySpec spec) {
        if (spec == null || spec.name() == null) {
            return new AllFreshPolicy();
        }
        FoodPolicyParameters params = spec.parameters();
        switch (FoodPolicyType.fromCode(spec.name())) {
            case MAXIMIZE_STORAGE:
                return new FixedSplitPolicy(FoodPolicyType.MAXIMIZE_STORAGE.getCode(),
                        splitOrDefault(params, MAXIMIZE_STORAGE_SPLIT));
            case BALANCED_MIX:
                return new FixedSplitPolicy(FoodPolicyType.BALANCED_MIX.getCode(),
                        splitOrDefault(params, BALANCED_MIX_SPLIT));
            case MARKET_RESPONSIVE:
                return new MarketResponsivePolicy(params);
            case ALL_FRESH:
            default:
                return new AllFreshPolicy();
        }
    }

    private static ProcessingSplit splitOrDefault(FoodPolicyParameters params, ProcessingSplit fallback) {
        return params.getCustomSplit() != null ? params.getCustomSplit() : fallback;
    }
}
