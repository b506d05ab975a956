package projectoasis.physics.i;

import projectoasis.domain.energy.DailyEnergyRecord;
import projectoasis.domain.energy.EnergyState;

import java.time.LocalDate;

/**
 * Balance diario de la demanda eléctrica comunitaria frente a la generación disponible.
 * <p>
 * Muta el estado de carga persistente de la batería y los acumuladores anuales del
 * {@link EnergyState}, y devuelve el registro del día.
 */
public interface IEnergyDispatcher {

    DailyEnergyRecord dispatch(EnergyState state, LocalDate date, double demandKwh);
}
