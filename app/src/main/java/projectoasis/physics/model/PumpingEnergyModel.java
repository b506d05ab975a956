package projectoasis.physics.model;

import projectoasis.config.PumpSystemConfig;

/**
 * Energía específica de bombeo de agua subterránea [kWh/m³].
 * <p>
 * Suma la elevación desde la altura efectiva del pozo y las pérdidas por fricción de
 * Darcy–Weisbach en la conducción horizontal hasta la planta de tratamiento:
 * <pre>
 *   E_elev     = ρ · g · h / (η · 3.6e6)
 *   h_fricción = f · (L / d) · v² / (2g),   v = Q / (π d² / 4)
 * </pre>
 * Se usa agua salobre (ρ = 1025 kg/m³) y un factor de fricción fijo de 0.02.
 */
public class PumpingEnergyModel {

    public static final double WATER_DENSITY_KG_M3 = 1025.0;
    public static final double GRAVITY_M_S2 = 9.81;
    public static final double FRICTION_FACTOR = 0.02;
    private static final double JOULES_PER_KWH = 3.6e6;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double pipeLengthM;
    private final double pipeDiameterM;
    private final double pumpEfficiency;

    public PumpingEnergyModel(PumpSystemConfig config) {
        this.pipeLengthM = config.getHorizontalDistanceKm() * 1000.0;
        this.pipeDiameterM = config.getPipeDiameterM();
        this.pumpEfficiency = config.getPumpEfficiency();
    }

    public double liftEnergyKwhPerM3(double headM) {
        return energyForHead(headM);
    }

    /** Pérdida por fricción con el caudal diario de un pozo [m³/día]. */
    public double frictionEnergyKwhPerM3(double flowM3Day) {
        double area = Math.PI * Math.pow(pipeDiameterM / 2.0, 2);
        double velocity = (flowM3Day / SECONDS_PER_DAY) / area;
        double headLoss = FRICTION_FACTOR * (pipeLengthM / pipeDiameterM)
                * velocity * velocity / (2.0 * GRAVITY_M_S2);
        return energyForHead(headLoss);
    }

    /** Energía total de bombeo redondeada a 4 decimales. */
    public double pumpingEnergyKwhPerM3(double effectiveHeadM, double flowM3Day) {
        double total = liftEnergyKwhPerM3(effectiveHeadM) + frictionEnergyKwhPerM3(flowM3Day);
        return Math.round(total * 10_000.0) / 10_000.0;
    }

    private double energyForHead(double headM) {
        return WATER_DENSITY_KG_M3 * GRAVITY_M_S2 * headM / (pumpEfficiency * JOULES_PER_KWH);
    }
}
