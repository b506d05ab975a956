package projectoasis.domain.farm;

import lombok.Builder;
import projectoasis.exception.ScenarioConfigurationException;

/**
 * Reparto de una cosecha entre las cuatro vías de procesado.
 *
 * @param fresh    Fracción vendida en fresco.
 * @param packaged Fracción envasada.
 * @param canned   Fracción enlatada.
 * @param dried    Fracción deshidratada.
 */
@Builder
public record ProcessingSplit(double fresh, double packaged, double canned, double dried) {

    public static final double SUM_TOLERANCE = 0.001;

    public static final ProcessingSplit ALL_FRESH = new ProcessingSplit(1.0, 0.0, 0.0, 0.0);

    public ProcessingSplit {
        if (fresh < 0 || packaged < 0 || canned < 0 || dried < 0) {
            throw new ScenarioConfigurationException("Las fracciones de procesado no pueden ser negativas.");
        }
        double total = fresh + packaged + canned + dried;
        if (Math.abs(total - 1.0) > SUM_TOLERANCE) {
            throw new ScenarioConfigurationException(
                    String.format("Las fracciones de procesado deben sumar 1.0 (suman %.4f).", total));
        }
    }

    public double fractionFor(ProcessingPathway pathway) {
        switch (pathway) {
            case FRESH: return fresh;
            case PACKAGED: return packaged;
            case CANNED: return canned;
            case DRIED: return dried;
            default: throw new IllegalArgumentException("Vía no soportada: " + pathway);
        }
    }
}
