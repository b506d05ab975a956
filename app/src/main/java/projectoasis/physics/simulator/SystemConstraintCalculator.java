package projectoasis.physics.simulator;

import projectoasis.config.FarmConfig;
import projectoasis.config.InfrastructureConfig;
import projectoasis.domain.water.FarmCapacityShare;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reparte la capacidad de pozos y de tratamiento entre granjas en proporción a su superficie.
 * Con superficie total nula el reparto es a partes iguales.
 */
public class SystemConstraintCalculator {

    public Map<String, FarmCapacityShare> calculate(List<FarmConfig> farms, InfrastructureConfig infra) {
        double totalWell = infra.getWells().totalCapacityM3Day();
        double totalTreatment = infra.getTreatment().capacityM3Day();
        double totalArea = farms.stream().mapToDouble(FarmConfig::getAreaHa).sum();

        Map<String, FarmCapacityShare> shares = new LinkedHashMap<>();
        for (FarmConfig farm : farms) {
            double fraction = totalArea > 0 ? farm.getAreaHa() / totalArea : 1.0 / farms.size();
            shares.put(farm.getId(), new FarmCapacityShare(farm.getId(),
                    totalWell * fraction, totalTreatment * fraction));
        }
        return shares;
    }
}
