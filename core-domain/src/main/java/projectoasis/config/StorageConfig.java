package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Depósito de agua tratada.
 */
@Builder
@With
public record StorageConfig(double capacityM3, FinancingStatus financing) {
}
