package projectoasis.config;

import lombok.Builder;
import lombok.With;

import java.time.MonthDay;
import java.util.List;
import java.util.Objects;

/**
 * Calendario de siembra de un cultivo dentro de una granja.
 *
 * @param cropName       Nombre del cultivo (clave de las tablas de datos).
 * @param areaFraction   Fracción de la superficie de la granja asignada al cultivo.
 * @param plantingDates  Fechas de siembra (mes-día) que se repiten cada año.
 * @param percentPlanted Fracción efectivamente sembrada en cada fecha.
 */
@Builder
@With
public record CropScheduleEntry(String cropName,
                                double areaFraction,
                                List<MonthDay> plantingDates,
                                double percentPlanted) {

    public CropScheduleEntry {
        Objects.requireNonNull(cropName, "El nombre del cultivo no puede ser nulo.");
        plantingDates = plantingDates == null ? List.of() : List.copyOf(plantingDates);
    }
}
