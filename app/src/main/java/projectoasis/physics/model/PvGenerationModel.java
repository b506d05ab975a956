package projectoasis.physics.model;

import lombok.Getter;
import projectoasis.config.PvDensity;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.physics.i.IGenerationModel;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Producción fotovoltaica diaria.
 * <p>
 * {@code E = P · kWh/kW(día, densidad) · (1 − degradación)^años · sombreado(densidad)}.
 * Los años se cuentan desde el inicio de la simulación con año medio de 365.25 días.
 */
public class PvGenerationModel implements IGenerationModel {

    @Getter
    private final double capacityKw;
    private final PvDensity density;
    private final double annualDegradation;
    private final LocalDate referenceDate;
    private final ISimulationDataProvider dataProvider;

    public PvGenerationModel(double capacityKw, PvDensity density, double annualDegradation,
                             LocalDate referenceDate, ISimulationDataProvider dataProvider) {
        this.capacityKw = capacityKw;
        this.density = density;
        this.annualDegradation = annualDegradation;
        this.referenceDate = referenceDate;
        this.dataProvider = dataProvider;
    }

    public double degradationFactor(LocalDate date) {
        double years = ChronoUnit.DAYS.between(referenceDate, date) / 365.25;
        return Math.pow(1.0 - annualDegradation, Math.max(0.0, years));
    }

    @Override
    public double dailyKwh(LocalDate date) {
        if (capacityKw <= 0) {
            return 0.0;
        }
        double specificYield = dataProvider.pvKwhPerKw(date, density);
        return capacityKw * specificYield * degradationFactor(date) * density.getShadingFactor();
    }
}
