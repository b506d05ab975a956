package projectoasis.config;

import lombok.Builder;
import lombok.With;
import projectoasis.domain.farm.ProcessingPathway;

/**
 * Líneas de procesado de alimentos de la cooperativa para una vía concreta.
 *
 * @param pathway   Vía atendida (FRESH corresponde al envasado en fresco).
 * @param lineCount Número de líneas instaladas.
 * @param financing Perfil de financiación.
 */
@Builder
@With
public record FoodProcessingLineConfig(ProcessingPathway pathway, int lineCount, FinancingStatus financing) {
}
