package projectoasis.domain.water;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Depósito de agua tratada con nivel acotado en [0, capacidad].
 * <p>
 * Hoy toda el agua que entra sale el mismo día, pero entradas y salidas se registran
 * por separado para poder desacoplarlas entre días. Los contadores diarios registran el
 * volumen tratado completo; solo el nivel queda acotado por la capacidad.
 */
@Getter
public class WaterStorageState {

    private final double capacityM3;
    private double levelM3;
    private double dailyInflowM3;
    private double dailyOutflowM3;

    public WaterStorageState(double capacityM3, double initialLevelM3) {
        if (capacityM3 < 0) {
            throw new IllegalArgumentException("La capacidad del depósito no puede ser negativa.");
        }
        this.capacityM3 = capacityM3;
        this.levelM3 = Math.max(0.0, Math.min(capacityM3, initialLevelM3));
    }

    /** Registra el agua tratada que entra al depósito. El nivel no supera la capacidad. */
    public void addInflow(double volumeM3) {
        double volume = Math.max(0.0, volumeM3);
        dailyInflowM3 += volume;
        levelM3 = Math.min(capacityM3, levelM3 + volume);
    }

    /** Registra el agua entregada desde el depósito. El nivel no baja de cero. */
    public void drawOutflow(double volumeM3) {
        double volume = Math.max(0.0, volumeM3);
        dailyOutflowM3 += volume;
        levelM3 = Math.max(0.0, levelM3 - volume);
    }

    public double utilizationPct() {
        return capacityM3 > 0 ? levelM3 / capacityM3 * 100.0 : 0.0;
    }

    /** Cierra el día: genera el registro y reinicia los contadores diarios. */
    public DailyStorageRecord closeDay(LocalDate date, double householdM3, double buildingM3) {
        double irrigation = Math.max(0.0, dailyOutflowM3 - householdM3 - buildingM3);
        DailyStorageRecord record = new DailyStorageRecord(date, dailyInflowM3, dailyOutflowM3,
                householdM3, buildingM3, irrigation, levelM3, utilizationPct());
        dailyInflowM3 = 0.0;
        dailyOutflowM3 = 0.0;
        return record;
    }
}
