package projectoasis.domain.water;

import java.time.LocalDate;

/**
 * Movimientos diarios del depósito de agua tratada.
 */
public record DailyStorageRecord(LocalDate date,
                                 double inflowM3,
                                 double outflowM3,
                                 double householdM3,
                                 double buildingM3,
                                 double irrigationM3,
                                 double levelM3,
                                 double utilizationPct) {
}
