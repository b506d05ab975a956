package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Red de riego de las granjas. Su coste de capital escala con la superficie total cultivada.
 */
@Builder
@With
public record IrrigationSystemConfig(String type, FinancingStatus financing) {
}
