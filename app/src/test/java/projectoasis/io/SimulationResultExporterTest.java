package projectoasis.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectoasis.domain.energy.YearlyEnergyMetrics;
import projectoasis.domain.farm.YearlyFarmMetrics;
import projectoasis.domain.simulation.SimulationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationResultExporterTest {

    @TempDir
    Path tempDir;

    private final SimulationResultExporter exporter = new SimulationResultExporter();

    private static SimulationResult sampleResult() {
        return SimulationResult.builder()
                .startDate(LocalDate.of(2025, 1, 1))
                .endDate(LocalDate.of(2025, 12, 31))
                .daysSimulated(365)
                .yearlyFarmMetrics(List.of(YearlyFarmMetrics.builder()
                        .year(2025)
                        .farmId("farm_1")
                        .groundwaterM3(9_000.0)
                        .municipalM3(1_000.0)
                        .yieldKg(500_000.0)
                        .cropWaterM3(Map.of("tomato", 10_000.0))
                        .cropYieldKg(Map.of("tomato", 500_000.0))
                        .cropRevenueUsd(Map.of("tomato", 250_000.0))
                        .build()))
                .yearlyEnergyMetrics(List.of(YearlyEnergyMetrics.builder()
                        .year(2025)
                        .demandKwh(12_000.0)
                        .gridImportKwh(12_000.0)
                        .endOfYearSoc(0.5)
                        .build()))
                .economics(SimulationResult.EconomicSummary.builder()
                        .cashReservesUsd(320_000.0)
                        .cumulativeRevenueUsd(250_000.0)
                        .build())
                .aquifer(SimulationResult.AquiferSummary.builder()
                        .cumulativeExtractionM3(9_000.0)
                        .netDepletionM3(0.0)
                        .yearsRemaining(null)
                        .build())
                .finalBatterySoc(0.5)
                .build();
    }

    @Test
    @DisplayName("Escribe y vuelve a leer el resultado sin pérdidas")
    void writeAndRead_preservesResult() throws IOException {
        // --- 1. Arrange ---
        Path file = tempDir.resolve("out/result.json");
        SimulationResult result = sampleResult();

        // --- 2. Act ---
        exporter.writeToFile(result, file);
        SimulationResult read = exporter.readFromFile(file);

        // --- 3. Assert ---
        assertThat(Files.exists(file)).isTrue();
        assertThat(read).isEqualTo(result);
    }

    @Test
    @DisplayName("Fechas ISO y años restantes nulos para un acuífero que no se agota")
    void toJson_writesIsoDatesAndNullYearsRemaining() throws IOException {
        String json = exporter.toJson(sampleResult());

        assertThat(json).contains("\"startDate\" : \"2025-01-01\"");
        assertThat(json).contains("\"yearsRemaining\" : null");
        assertThat(json).contains("\"tomato\" : 500000.0");
    }

    @Test
    @DisplayName("Leer un archivo inexistente lanza IOException")
    void readFromFile_missingFile() {
        assertThatThrownBy(() -> exporter.readFromFile(tempDir.resolve("missing.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no existe");
    }
}
