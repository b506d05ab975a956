package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Campo de pozos compartido por la comunidad.
 *
 * @param count          Número de pozos.
 * @param depthM         Profundidad base de bombeo [m].
 * @param flowRateM3Day  Caudal nominal por pozo [m³/día].
 * @param financing      Perfil de financiación.
 */
@Builder
@With
public record WellConfig(int count, double depthM, double flowRateM3Day, FinancingStatus financing) {

    public double totalCapacityM3Day() {
        return count * flowRateM3Day;
    }
}
