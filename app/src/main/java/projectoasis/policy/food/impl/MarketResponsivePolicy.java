package projectoasis.policy.food.impl;

import projectoasis.config.FoodPolicyParameters;
import projectoasis.domain.farm.ProcessingSplit;
import projectoasis.policy.food.FoodPolicyType;
import projectoasis.policy.food.FoodProcessingContext;
import projectoasis.policy.i.IFoodProcessingPolicy;

/**
 * Procesa más cuando el precio en fresco cae por debajo de una fracción del precio de referencia.
 * <p>
 * El precio de referencia sale del proveedor de datos si lo aporta; si no, de la tabla
 * configurada por cultivo y, en último término, del valor por defecto.
 */
public class MarketResponsivePolicy implements IFoodProcessingPolicy {

    private final FoodPolicyParameters params;

    public MarketResponsivePolicy(FoodPolicyParameters params) {
        this.params = params;
    }

    public double referencePrice(FoodProcessingContext context) {
        if (context.referencePricePerKg() != null) {
            return context.referencePricePerKg();
        }
        return params.getReferencePricesPerKg()
                .getOrDefault(context.cropName(), params.getDefaultReferencePricePerKg());
    }

    @Override
    public ProcessingSplit allocate(FoodProcessingContext context) {
        double threshold = referencePrice(context) * params.getPriceThresholdFraction();
        return context.freshPricePerKg() < threshold
                ? params.getLowPriceSplit()
                : params.getNormalPriceSplit();
    }

    @Override
    public String getName() {
        return FoodPolicyType.MARKET_RESPONSIVE.getCode();
    }
}
