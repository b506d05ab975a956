package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros de las políticas de asignación de agua. Cada política lee solo los suyos.
 */
@Value
@Builder
@With
public class WaterPolicyParameters {

    /** CheapestSource: si es falso, la decisión compara solo el coste de mantenimiento. */
    @Builder.Default
    boolean includeEnergyCost = true;

    /** ConserveGroundwater: múltiplo del coste subterráneo que activa su uso. */
    @Builder.Default
    double priceThresholdMultiplier = 1.5;

    /** ConserveGroundwater: fracción máxima de la demanda servida con agua subterránea. */
    @Builder.Default
    double maxGroundwaterRatio = 0.30;

    /** QuotaEnforced: cuota anual de extracción [m³]. Obligatoria para esa política. */
    Double annualQuotaM3;

    /** QuotaEnforced: margen mensual sobre la cuota prorrateada. */
    @Builder.Default
    double monthlyVariance = 0.15;

    public static WaterPolicyParameters defaults() {
        return WaterPolicyParameters.builder().build();
    }
}
