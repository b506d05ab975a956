package projectoasis.policy.i;

import projectoasis.domain.farm.ProcessingSplit;
import projectoasis.policy.food.FoodProcessingContext;

/**
 * Estrategia de reparto de una cosecha entre venta en fresco y las vías de procesado.
 */
public interface IFoodProcessingPolicy {

    ProcessingSplit allocate(FoodProcessingContext context);

    String getName();
}
