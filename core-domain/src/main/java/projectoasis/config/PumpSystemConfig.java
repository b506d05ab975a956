package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Geometría del bombeo desde el pozo hasta la planta de tratamiento.
 */
@Value
@Builder
@With
public class PumpSystemConfig {

    /** Distancia horizontal de la tubería [km]. */
    @Builder.Default
    double horizontalDistanceKm = 0.3;

    /** Diámetro interior de la tubería [m]. */
    @Builder.Default
    double pipeDiameterM = 0.1;

    @Builder.Default
    double pumpEfficiency = 0.60;

    public static PumpSystemConfig defaults() {
        return PumpSystemConfig.builder().build();
    }
}
