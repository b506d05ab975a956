package projectoasis.domain.simulation;

import lombok.Getter;
import lombok.Setter;
import projectoasis.domain.economics.EconomicState;
import projectoasis.domain.energy.EnergyState;
import projectoasis.domain.energy.YearlyEnergyMetrics;
import projectoasis.domain.farm.FarmState;
import projectoasis.domain.farm.YearlyFarmMetrics;
import projectoasis.domain.water.AquiferState;
import projectoasis.domain.water.DailyStorageRecord;
import projectoasis.domain.water.FarmCapacityShare;
import projectoasis.domain.water.WaterStorageState;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Estado completo y mutable de una ejecución. Cada ejecución posee su propia instancia:
 * solo las tablas del proveedor de datos se comparten entre ejecuciones.
 */
@Getter
public class SimulationState {

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final List<FarmState> farms;
    private final Map<String, FarmCapacityShare> capacityShares;
    private final AquiferState aquifer;
    private final WaterStorageState storage;
    private final EnergyState energy;
    private final EconomicState economics;

    /** Energía específica de tratamiento según la salinidad del agua bruta [kWh/m³]. */
    private final double treatmentKwhPerM3;

    @Setter
    private LocalDate currentDate;

    private final List<YearlyFarmMetrics> yearlyFarmMetrics = new ArrayList<>();
    private final List<YearlyEnergyMetrics> yearlyEnergyMetrics = new ArrayList<>();
    private final List<DailyStorageRecord> storageRecords = new ArrayList<>();

    public SimulationState(LocalDate startDate, LocalDate endDate, List<FarmState> farms,
                           Map<String, FarmCapacityShare> capacityShares, AquiferState aquifer,
                           WaterStorageState storage, EnergyState energy, EconomicState economics,
                           double treatmentKwhPerM3) {
        this.startDate = startDate;
        this.endDate = endDate;
        this.farms = List.copyOf(farms);
        this.capacityShares = Map.copyOf(capacityShares);
        this.aquifer = aquifer;
        this.storage = storage;
        this.energy = energy;
        this.economics = economics;
        this.treatmentKwhPerM3 = treatmentKwhPerM3;
        this.currentDate = startDate;
    }

    public FarmCapacityShare capacityShareOf(String farmId) {
        FarmCapacityShare share = capacityShares.get(farmId);
        if (share == null) {
            throw new IllegalStateException("Sin reparto de capacidad para la granja " + farmId);
        }
        return share;
    }

    /** Años transcurridos desde el inicio hasta {@code date}, con año medio de 365.25 días. */
    public double yearsElapsed(LocalDate date) {
        return ChronoUnit.DAYS.between(startDate, date) / 365.25;
    }

    public long daysSimulated() {
        return ChronoUnit.DAYS.between(startDate, currentDate);
    }
}
