package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Aerogeneradores. El tipo de turbina selecciona la curva de producción diaria.
 */
@Builder
@With
public record WindConfig(double capacityKw, String turbineType, FinancingStatus financing) {
}
