package projectoasis.economics;

import lombok.extern.slf4j.Slf4j;
import projectoasis.config.FinancingStatus;
import projectoasis.config.FoodProcessingLineConfig;
import projectoasis.config.InfrastructureConfig;
import projectoasis.config.ReferenceCosts;
import projectoasis.domain.economics.SubsystemCost;

import java.util.ArrayList;
import java.util.List;

/**
 * Estima capital y O&amp;M anual de cada subsistema a partir de costes unitarios de referencia
 * y aplica su perfil de financiación. Se ejecuta una única vez al inicio de la simulación.
 */
@Slf4j
public class InfrastructureCostEstimator {

    private final ReferenceCosts costs;
    private final FinancingCalculator financing;

    public InfrastructureCostEstimator(ReferenceCosts costs, FinancingCalculator financing) {
        this.costs = costs;
        this.financing = financing;
    }

    public List<SubsystemCost> estimate(InfrastructureConfig infra, double totalFarmAreaHa) {
        List<SubsystemCost> result = new ArrayList<>();

        if (infra.getWells() != null && infra.getWells().count() > 0) {
            double capital = infra.getWells().count() * infra.getWells().depthM() * costs.getWellCostPerMeterDepth();
            double om = infra.getWells().count() * costs.getWellOmPerWellYear();
            result.add(financing.cost("wells", capital, om, infra.getWells().financing()));
        }
        if (infra.getTreatment() != null && infra.getTreatment().capacityM3Day() > 0) {
            double capital = infra.getTreatment().capacityM3Day() * costs.getTreatmentCostPerM3Day();
            result.add(financing.cost("treatment", capital, pct(capital, costs.getTreatmentOmPct()),
                    infra.getTreatment().financing()));
        }
        if (infra.getStorage() != null && infra.getStorage().capacityM3() > 0) {
            double capital = infra.getStorage().capacityM3() * costs.getStorageCostPerM3();
            result.add(financing.cost("storage", capital, pct(capital, costs.getStorageOmPct()),
                    infra.getStorage().financing()));
        }
        if (infra.getIrrigation() != null && totalFarmAreaHa > 0) {
            double capital = totalFarmAreaHa * costs.getIrrigationCostPerHa();
            result.add(financing.cost("irrigation", capital, pct(capital, costs.getIrrigationOmPct()),
                    infra.getIrrigation().financing()));
        }
        if (infra.getPv() != null && infra.getPv().capacityKw() > 0) {
            double kw = infra.getPv().capacityKw();
            result.add(financing.cost("pv", kw * costs.getPvCostPerKw(), kw * costs.getPvOmPerKwYear(),
                    infra.getPv().financing()));
        }
        if (infra.getWind() != null && infra.getWind().capacityKw() > 0) {
            double kw = infra.getWind().capacityKw();
            result.add(financing.cost("wind", kw * costs.getWindCostPerKw(), kw * costs.getWindOmPerKwYear(),
                    infra.getWind().financing()));
        }
        if (infra.getBattery() != null && infra.getBattery().getCapacityKwh() > 0) {
            double capital = infra.getBattery().getCapacityKwh() * costs.getBatteryCostPerKwh();
            result.add(financing.cost("battery", capital, pct(capital, costs.getBatteryOmPct()),
                    infra.getBattery().getFinancing()));
        }
        if (infra.getGenerator() != null && infra.getGenerator().getCapacityKw() > 0) {
            double kw = infra.getGenerator().getCapacityKw();
            result.add(financing.cost("generator", kw * costs.getGeneratorCostPerKw(),
                    kw * costs.getGeneratorOmPerKwYear(), infra.getGenerator().getFinancing()));
        }
        for (FoodProcessingLineConfig line : infra.getProcessingLines()) {
            if (line.lineCount() <= 0) {
                continue;
            }
            double capital = line.lineCount() * lineCost(line);
            FinancingStatus status = line.financing();
            result.add(financing.cost("processing_" + line.pathway().getCode(), capital,
                    pct(capital, costs.getProcessingOmPct()), status));
        }

        log.info("Infraestructura estimada: {} subsistemas, coste anual {} USD.", result.size(),
                String.format("%.2f", result.stream().mapToDouble(SubsystemCost::totalAnnualUsd).sum()));
        return result;
    }

    private double lineCost(FoodProcessingLineConfig line) {
        switch (line.pathway()) {
            case FRESH: return costs.getFreshPackagingLineCost();
            case PACKAGED: return costs.getPackagingLineCost();
            case CANNED: return costs.getCanningLineCost();
            case DRIED: return costs.getDryingLineCost();
            default: throw new IllegalArgumentException("Vía sin coste de referencia: " + line.pathway());
        }
    }

    private static double pct(double capital, double pct) {
        return capital * pct / 100.0;
    }
}
