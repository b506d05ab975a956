package projectoasis.physics.i;

import java.time.LocalDate;

/**
 * Producción renovable diaria de una planta instalada.
 */
public interface IGenerationModel {

    /** Energía producida el día {@code date} [kWh]. Cero sin potencia instalada. */
    double dailyKwh(LocalDate date);

    double getCapacityKw();
}
