package projectoasis.domain.water;

import lombok.Builder;

import java.time.LocalDate;

/**
 * Registro de auditoría inmutable de la asignación de agua de una granja en un día.
 *
 * @param date                Día simulado.
 * @param farmId              Granja.
 * @param demandM3            Demanda de riego del día [m³].
 * @param groundwaterM3       Volumen servido desde pozos tratados [m³].
 * @param municipalM3         Volumen servido por la red municipal [m³].
 * @param costUsd             Coste total del agua del día [USD].
 * @param energyKwh           Energía de bombeo, conducción y tratamiento [kWh].
 * @param energyCostUsd       Energía valorada a la tarifa agrícola [USD].
 * @param decisionReason      Etiqueta de la decisión de la política.
 * @param groundwaterCostPerM3 Coste unitario subterráneo usado por la política [USD/m³].
 * @param municipalCostPerM3  Precio municipal del día [USD/m³].
 * @param constraintHit       Límite físico activo, o {@code null} si ninguno recortó.
 * @param limitingFactor      Factor limitante de la decisión (restricción física, tope de ratio...).
 */
@Builder
public record DailyWaterRecord(LocalDate date,
                               String farmId,
                               double demandM3,
                               double groundwaterM3,
                               double municipalM3,
                               double costUsd,
                               double energyKwh,
                               double energyCostUsd,
                               String decisionReason,
                               double groundwaterCostPerM3,
                               double municipalCostPerM3,
                               ConstraintType constraintHit,
                               String limitingFactor) {

    public double totalWaterM3() {
        return groundwaterM3 + municipalM3;
    }
}
