package projectoasis.data;

import java.time.LocalDate;

/**
 * Rendimiento esperado y fecha de cosecha de un cultivo sembrado en una fecha concreta.
 */
public record YieldInfo(double expectedYieldKgPerHa, LocalDate harvestDate) {
}
