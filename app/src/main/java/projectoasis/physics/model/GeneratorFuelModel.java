package projectoasis.physics.model;

/**
 * Curva de consumo lineal de Willans para el generador diésel:
 * {@code fuel_L = (a·P_nominal + b·P_salida) · horas}.
 * <p>
 * El generador siempre trabaja a plena carga (punto de mejor rendimiento) durante las
 * horas mínimas necesarias, con un tope de 24 horas por día.
 */
public class GeneratorFuelModel {

    public static final double HOURS_PER_DAY = 24.0;

    /** Energía entregada, horas de marcha y litros consumidos. */
    public record GeneratorRun(double energyKwh, double hours, double fuelLiters) {
        public static final GeneratorRun IDLE = new GeneratorRun(0.0, 0.0, 0.0);
    }

    private final double capacityKw;
    private final double coefficientA;
    private final double coefficientB;

    public GeneratorFuelModel(double capacityKw, double coefficientA, double coefficientB) {
        this.capacityKw = capacityKw;
        this.coefficientA = coefficientA;
        this.coefficientB = coefficientB;
    }

    public GeneratorRun cover(double deficitKwh) {
        if (capacityKw <= 0 || deficitKwh <= 0) {
            return GeneratorRun.IDLE;
        }
        double energy = Math.min(deficitKwh, capacityKw * HOURS_PER_DAY);
        double hours = energy / capacityKw;
        double fuel = (coefficientA * capacityKw + coefficientB * capacityKw) * hours;
        return new GeneratorRun(energy, hours, fuel);
    }
}
