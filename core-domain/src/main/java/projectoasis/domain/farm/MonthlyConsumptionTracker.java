package projectoasis.domain.farm;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Consumo del mes natural en curso. Se reinicia solo al cambiar de mes o de año.
 */
@Getter
public class MonthlyConsumptionTracker {

    private int year;
    private int month;
    private double groundwaterM3;

    public void record(LocalDate date, double groundwaterM3) {
        rollTo(date);
        this.groundwaterM3 += groundwaterM3;
    }

    /** Agua subterránea consumida en el mes de {@code date}; cero si el contador pertenece a otro mes. */
    public double groundwaterFor(LocalDate date) {
        return isSameMonth(date) ? groundwaterM3 : 0.0;
    }

    private void rollTo(LocalDate date) {
        if (!isSameMonth(date)) {
            year = date.getYear();
            month = date.getMonthValue();
            groundwaterM3 = 0.0;
        }
    }

    private boolean isSameMonth(LocalDate date) {
        return date.getYear() == year && date.getMonthValue() == month;
    }
}
