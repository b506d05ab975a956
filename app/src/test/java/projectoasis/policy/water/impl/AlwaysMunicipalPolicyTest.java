package projectoasis.policy.water.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectoasis.policy.water.WaterAllocation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AlwaysMunicipalPolicyTest {

    @Test
    @DisplayName("Toda la demanda se sirve desde la red municipal sin consumo energético")
    void allocate_servesEverythingFromMunicipal() {
        // --- 1. Arrange ---
        AlwaysMunicipalPolicy policy = new AlwaysMunicipalPolicy();

        // --- 2. Act ---
        WaterAllocation allocation = policy.allocate(WaterPolicyTestContexts.base());

        // --- 3. Assert ---
        assertEquals(0.0, allocation.groundwaterM3());
        assertEquals(100.0, allocation.municipalM3(), 1e-9);
        assertEquals(0.0, allocation.energyUsedKwh());
        assertEquals(50.0, allocation.costUsd(), 1e-9);
        assertEquals("muni_only", allocation.decision().reason());
        assertNull(allocation.decision().constraintHit());
        assertEquals("always_municipal", policy.getName());
    }
}
