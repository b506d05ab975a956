package projectoasis.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Configuración estática de una granja durante toda la simulación.
 */
@Value
@Builder
@With
public class FarmConfig {

    String id;
    String name;

    /** Superficie total de la granja [ha]. */
    double areaHa;

    /** Multiplicador sobre el rendimiento esperado de las tablas (calidad del suelo, manejo). */
    @Builder.Default
    double yieldFactor = 1.0;

    /** Capital inicial que la granja aporta a la caja común [USD]. */
    double startingCapitalUsd;

    @Singular
    List<CropScheduleEntry> crops;

    WaterPolicySpec waterPolicy;

    /** Opcional: sin política se vende toda la cosecha en fresco. */
    FoodPolicySpec foodPolicy;
}
