package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Planta fotovoltaica.
 *
 * @param capacityKw Potencia pico instalada [kW].
 * @param density    Densidad de instalación (determina el factor de sombreado).
 * @param financing  Perfil de financiación.
 */
@Builder
@With
public record PvConfig(double capacityKw, PvDensity density, FinancingStatus financing) {
}
