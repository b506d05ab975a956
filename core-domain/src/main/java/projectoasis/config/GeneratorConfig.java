package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Generador diésel de respaldo con curva de consumo de Willans
 * {@code fuel_L = (a·P_nominal + b·P_salida) · horas}.
 */
@Value
@Builder
@With
public class GeneratorConfig {

    double capacityKw;

    /** Coeficiente de consumo en vacío [L/kWh nominal]. */
    @Builder.Default
    double fuelCoefficientA = 0.06;

    /** Coeficiente de consumo proporcional a la carga [L/kWh]. */
    @Builder.Default
    double fuelCoefficientB = 0.20;

    @Builder.Default
    double minLoadFraction = 0.30;

    @Builder.Default
    FinancingStatus financing = FinancingStatus.EXISTING_OWNED;
}
