package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros del acuífero explotado.
 *
 * @param exploitableVolumeM3 Volumen explotable total [m³].
 * @param rechargeRateM3Yr    Recarga natural anual [m³/año].
 * @param maxDrawdownM        Descenso máximo del nivel al agotar el volumen explotable [m].
 */
@Builder
@With
public record AquiferConfig(double exploitableVolumeM3, double rechargeRateM3Yr, double maxDrawdownM) {
}
