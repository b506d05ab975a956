package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Selección de la política de procesado de alimentos de una granja.
 */
@Builder
@With
public record FoodPolicySpec(String name, FoodPolicyParameters parameters) {

    public FoodPolicySpec {
        if (parameters == null) {
            parameters = FoodPolicyParameters.defaults();
        }
    }

    public static FoodPolicySpec of(String name) {
        return new FoodPolicySpec(name, FoodPolicyParameters.defaults());
    }
}
