package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Costes unitarios de referencia para estimar el capital y el O&amp;M de cada subsistema.
 * Los porcentajes de O&amp;M se expresan sobre el coste de capital.
 */
@Value
@Builder
@With
public class ReferenceCosts {

    @Builder.Default double wellCostPerMeterDepth = 150.0;
    @Builder.Default double wellOmPerWellYear = 1_500.0;

    @Builder.Default double treatmentCostPerM3Day = 1_000.0;
    @Builder.Default double treatmentOmPct = 5.0;

    @Builder.Default double storageCostPerM3 = 50.0;
    @Builder.Default double storageOmPct = 1.0;

    @Builder.Default double irrigationCostPerHa = 3_000.0;
    @Builder.Default double irrigationOmPct = 3.0;

    @Builder.Default double pvCostPerKw = 800.0;
    @Builder.Default double pvOmPerKwYear = 15.0;

    @Builder.Default double windCostPerKw = 1_500.0;
    @Builder.Default double windOmPerKwYear = 40.0;

    @Builder.Default double batteryCostPerKwh = 400.0;
    @Builder.Default double batteryOmPct = 2.0;

    @Builder.Default double generatorCostPerKw = 300.0;
    @Builder.Default double generatorOmPerKwYear = 10.0;

    @Builder.Default double freshPackagingLineCost = 50_000.0;
    @Builder.Default double dryingLineCost = 30_000.0;
    @Builder.Default double canningLineCost = 80_000.0;
    @Builder.Default double packagingLineCost = 40_000.0;
    @Builder.Default double processingOmPct = 5.0;

    public static ReferenceCosts defaults() {
        return ReferenceCosts.builder().build();
    }
}
