package projectoasis.physics.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.physics.i.IGenerationModel;

import java.time.LocalDate;

/**
 * Producción eólica diaria: potencia instalada por la producción específica de la turbina.
 */
@RequiredArgsConstructor
public class WindGenerationModel implements IGenerationModel {

    @Getter
    private final double capacityKw;
    private final String turbineType;
    private final ISimulationDataProvider dataProvider;

    @Override
    public double dailyKwh(LocalDate date) {
        if (capacityKw <= 0) {
            return 0.0;
        }
        return capacityKw * dataProvider.windKwhPerKw(date, turbineType);
    }
}
