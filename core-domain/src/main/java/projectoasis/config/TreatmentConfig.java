package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Planta de desalinización/tratamiento del agua subterránea.
 *
 * @param capacityM3Day Capacidad de tratamiento [m³/día].
 * @param salinityLevel Nivel de salinidad del agua bruta (clave de la tabla de energía específica).
 * @param financing     Perfil de financiación.
 */
@Builder
@With
public record TreatmentConfig(double capacityM3Day, String salinityLevel, FinancingStatus financing) {
}
