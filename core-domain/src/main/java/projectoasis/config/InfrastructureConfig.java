package projectoasis.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Infraestructura compartida de agua y energía de la comunidad.
 */
@Value
@Builder
@With
public class InfrastructureConfig {

    WellConfig wells;
    TreatmentConfig treatment;
    StorageConfig storage;
    IrrigationSystemConfig irrigation;

    PvConfig pv;
    WindConfig wind;
    BatteryConfig battery;
    GeneratorConfig generator;

    /** Sin conexión a red no hay importación ni exportación: el déficit pasa al generador. */
    @Builder.Default
    boolean gridConnected = true;

    @Builder.Default
    PumpSystemConfig pumpSystem = PumpSystemConfig.defaults();

    @Singular
    List<FoodProcessingLineConfig> processingLines;
}
