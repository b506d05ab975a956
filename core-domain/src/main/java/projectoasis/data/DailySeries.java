package projectoasis.data;

import projectoasis.exception.MissingDataException;

import java.time.LocalDate;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Serie temporal escalonada: el valor de un día es el último registrado en o antes de esa fecha.
 * Sirve tanto para series diarias completas como para precios que cambian por tramos.
 */
public final class DailySeries {

    private final String name;
    private final NavigableMap<LocalDate, Double> values;

    private DailySeries(String name, NavigableMap<LocalDate, Double> values) {
        this.name = name;
        this.values = values;
    }

    public static DailySeries constant(String name, double value) {
        NavigableMap<LocalDate, Double> map = new TreeMap<>();
        map.put(LocalDate.MIN, value);
        return new DailySeries(name, map);
    }

    public static DailySeries of(String name, Map<LocalDate, Double> values) {
        return new DailySeries(name, new TreeMap<>(values));
    }

    public double valueAt(LocalDate date) {
        Map.Entry<LocalDate, Double> entry = values.floorEntry(date);
        if (entry == null) {
            throw new MissingDataException("Sin datos de '" + name + "' para el " + date);
        }
        return entry.getValue();
    }

    public String getName() {
        return name;
    }
}
