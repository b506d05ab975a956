package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import projectoasis.domain.farm.ProcessingSplit;

import java.util.Map;

/**
 * Parámetros de las políticas de procesado de alimentos.
 */
@Value
@Builder
@With
public class FoodPolicyParameters {

    /** Reparto fijo que sustituye al predeterminado de la política (opcional). */
    ProcessingSplit customSplit;

    /** MarketResponsive: fracción del precio de referencia por debajo de la cual se procesa más. */
    @Builder.Default
    double priceThresholdFraction = 0.80;

    @Builder.Default
    double defaultReferencePricePerKg = 0.30;

    /** Precios de referencia por cultivo [USD/kg] usados si el proveedor no aporta uno. */
    @Builder.Default
    Map<String, Double> referencePricesPerKg = Map.of(
            "tomato", 0.30,
            "potato", 0.25,
            "onion", 0.20,
            "kale", 0.40,
            "cucumber", 0.35);

    @Builder.Default
    ProcessingSplit lowPriceSplit = new ProcessingSplit(0.30, 0.20, 0.25, 0.25);

    @Builder.Default
    ProcessingSplit normalPriceSplit = new ProcessingSplit(0.65, 0.15, 0.10, 0.10);

    public static FoodPolicyParameters defaults() {
        return FoodPolicyParameters.builder().build();
    }
}
