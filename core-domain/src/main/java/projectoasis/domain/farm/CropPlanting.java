package projectoasis.domain.farm;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Una siembra concreta de un cultivo en una granja.
 * <p>
 * Acumula el agua recibida día a día hasta su fecha de cosecha. Tras cosecharse se conserva
 * como histórico: las siembras nunca se eliminan durante la simulación.
 */
@Getter
public class CropPlanting {

    private final String cropName;
    private final LocalDate plantingDate;
    private final LocalDate harvestDate;
    private final double areaHa;
    private final double expectedYieldKgPerHa;
    private final double expectedTotalWaterM3;

    private double cumulativeWaterM3;
    private boolean harvested;
    private HarvestOutcome harvestOutcome;

    public CropPlanting(String cropName, LocalDate plantingDate, LocalDate harvestDate, double areaHa,
                        double expectedYieldKgPerHa, double expectedTotalWaterM3) {
        this.cropName = Objects.requireNonNull(cropName, "El cultivo no puede ser nulo.");
        this.plantingDate = Objects.requireNonNull(plantingDate, "La fecha de siembra no puede ser nula.");
        this.harvestDate = Objects.requireNonNull(harvestDate, "La fecha de cosecha no puede ser nula.");
        if (harvestDate.isBefore(plantingDate)) {
            throw new IllegalArgumentException("La cosecha de " + cropName + " es anterior a su siembra.");
        }
        if (areaHa < 0) {
            throw new IllegalArgumentException("La superficie sembrada no puede ser negativa.");
        }
        this.areaHa = areaHa;
        this.expectedYieldKgPerHa = expectedYieldKgPerHa;
        this.expectedTotalWaterM3 = expectedTotalWaterM3;
    }

    /** Sembrada en o antes de {@code date} y todavía sin cosechar. */
    public boolean isActiveOn(LocalDate date) {
        return !harvested && !plantingDate.isAfter(date);
    }

    public boolean isHarvestDue(LocalDate date) {
        return !harvested && !harvestDate.isAfter(date);
    }

    public void addWater(double volumeM3) {
        if (volumeM3 < 0) {
            throw new IllegalArgumentException("No se puede retirar agua de una siembra.");
        }
        cumulativeWaterM3 += volumeM3;
    }

    public double getExpectedTotalYieldKg() {
        return expectedYieldKgPerHa * areaHa;
    }

    public void markHarvested(HarvestOutcome outcome) {
        if (harvested) {
            throw new IllegalStateException("La siembra de " + cropName + " del " + plantingDate + " ya fue cosechada.");
        }
        this.harvestOutcome = Objects.requireNonNull(outcome);
        this.harvested = true;
    }

    public Optional<HarvestOutcome> harvestOutcome() {
        return Optional.ofNullable(harvestOutcome);
    }
}
