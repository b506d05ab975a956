package projectoasis.physics.model;

/**
 * Función de producción FAO-33 de respuesta del rendimiento al agua.
 * <pre>
 *   ETa/ETc ≈ min(1, agua recibida / agua esperada)
 *   estrés  = clamp(1 − Ky · (1 − ETa/ETc), 0, 1)
 * </pre>
 */
public class WaterStressYieldModel {

    /** Proporción de agua recibida; 1.0 si no se esperaba agua. */
    public double waterRatio(double receivedM3, double expectedM3) {
        if (expectedM3 <= 0) {
            return 1.0;
        }
        return Math.min(1.0, receivedM3 / expectedM3);
    }

    public double stressFactor(double waterRatio, double ky) {
        double stress = 1.0 - ky * (1.0 - waterRatio);
        return Math.max(0.0, Math.min(1.0, stress));
    }

    public double harvestYieldKg(double expectedTotalYieldKg, double receivedM3, double expectedM3, double ky) {
        return expectedTotalYieldKg * stressFactor(waterRatio(receivedM3, expectedM3), ky);
    }
}
