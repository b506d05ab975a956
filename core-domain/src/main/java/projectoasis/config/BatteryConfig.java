package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Banco de baterías comunitario.
 * <p>
 * Los límites de estado de carga (SOC) protegen la vida útil del banco; el SOC inicial
 * se aplica una sola vez al comienzo de la simulación.
 */
@Value
@Builder
@With
public class BatteryConfig {

    double capacityKwh;

    @Builder.Default
    double initialSoc = 0.50;

    @Builder.Default
    double socMin = 0.10;

    @Builder.Default
    double socMax = 0.90;

    @Builder.Default
    double chargeEfficiency = 0.95;

    @Builder.Default
    double dischargeEfficiency = 0.95;

    @Builder.Default
    FinancingStatus financing = FinancingStatus.EXISTING_OWNED;
}
