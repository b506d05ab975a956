package projectoasis.domain.water;

import lombok.Getter;

/**
 * Estado del acuífero comunitario a lo largo de toda la simulación.
 * <p>
 * La extracción acumulada solo crece y nunca se reinicia en los cambios de año.
 * El descenso de nivel es lineal con la fracción explotada y se suma a la profundidad
 * base del pozo para obtener la altura de bombeo efectiva del día.
 */
@Getter
public class AquiferState {

    private final double exploitableVolumeM3;
    private final double rechargeRateM3Yr;
    private final double maxDrawdownM;
    private double cumulativeExtractionM3;

    public AquiferState(double exploitableVolumeM3, double rechargeRateM3Yr, double maxDrawdownM) {
        this.exploitableVolumeM3 = exploitableVolumeM3;
        this.rechargeRateM3Yr = rechargeRateM3Yr;
        this.maxDrawdownM = maxDrawdownM;
    }

    public void recordExtraction(double volumeM3) {
        if (volumeM3 < 0) {
            throw new IllegalArgumentException("La extracción no puede ser negativa: " + volumeM3);
        }
        cumulativeExtractionM3 += volumeM3;
    }

    /** Agotamiento neto descontando la recarga natural del periodo: {@code max(0, extraído − recarga·años)}. */
    public double netDepletionM3(double yearsElapsed) {
        return Math.max(0.0, cumulativeExtractionM3 - rechargeRateM3Yr * yearsElapsed);
    }

    /**
     * Años hasta agotar el volumen explotable al ritmo medio observado.
     *
     * @return {@code +∞} si la extracción media no supera la recarga (explotación sostenible).
     */
    public double yearsRemaining(double yearsElapsed) {
        if (yearsElapsed <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        double netAnnualDepletion = cumulativeExtractionM3 / yearsElapsed - rechargeRateM3Yr;
        if (netAnnualDepletion <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        double remaining = exploitableVolumeM3 - netDepletionM3(yearsElapsed);
        if (remaining <= 0) {
            return 0.0;
        }
        return remaining / netAnnualDepletion;
    }

    public double currentDrawdownM() {
        if (exploitableVolumeM3 <= 0 || maxDrawdownM <= 0) {
            return 0.0;
        }
        double fractionDepleted = Math.min(1.0, cumulativeExtractionM3 / exploitableVolumeM3);
        return maxDrawdownM * fractionDepleted;
    }

    /** Profundidad de bombeo efectiva: base + descenso actual. Debe recalcularse cada día. */
    public double effectiveHeadM(double baseDepthM) {
        return baseDepthM + currentDrawdownM();
    }
}
