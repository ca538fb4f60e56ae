package projectapogee.physics.model;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectapogee.domain.flight.AtmosphereProperties;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class IsaAtmosphereModelTest {

    private final IsaAtmosphereModel atmosphere = new IsaAtmosphereModel();

    @Test
    @DisplayName("Nivel del mar: valores estándar de presión, temperatura, densidad y velocidad del sonido")
    void properties_seaLevel_shouldMatchStandardValues() {
        AtmosphereProperties air = atmosphere.properties(0.0);

        assertEquals(101_325.0, air.pressure(), 1e-9);
        assertEquals(288.15, air.temperature(), 1e-12);
        assertEquals(1.225, air.density(), 1e-3, "La densidad ISA a nivel del mar es 1.225 kg/m³");
        assertEquals(340.3, air.speedOfSound(), 0.1);
    }

    @Test
    @DisplayName("Tropopausa: 216.65 K y ~22.63 kPa a 11 km")
    void properties_tropopause_shouldMatchTables() {
        AtmosphereProperties air = atmosphere.properties(11_000.0);

        assertEquals(216.65, air.temperature(), 1e-9);
        assertEquals(22_632.0, air.pressure(), 20.0);
    }

    @Test
    @DisplayName("Continuidad: presión y densidad coinciden a ambos lados de cada frontera de capa")
    void properties_layerBoundaries_shouldBeContinuous() {
        for (int layer = 1; layer < IsaAtmosphereModel.layerCount(); layer++) {
            double boundary = IsaAtmosphereModel.layerBaseAltitude(layer);

            AtmosphereProperties below = atmosphere.propertiesInLayer(layer - 1, boundary);
            AtmosphereProperties above = atmosphere.propertiesInLayer(layer, boundary);
            log.info("Frontera {} m: P={} / {}", boundary, below.pressure(), above.pressure());

            assertEquals(below.pressure(), above.pressure(), 1e-6 * below.pressure(), "Salto de presión en " + boundary + " m");
            assertEquals(below.density(), above.density(), 1e-6 * below.density(), "Salto de densidad en " + boundary + " m");
            assertEquals(below.temperature(), above.temperature(), 1e-9, "Salto de temperatura en " + boundary + " m");
        }
    }

    @Test
    @DisplayName("La densidad decrece monótonamente con la altitud")
    void densityAt_shouldDecreaseWithAltitude() {
        double previous = atmosphere.densityAt(0.0);
        for (double h = 250.0; h <= 45_000.0; h += 250.0) {
            double current = atmosphere.densityAt(h);
            assertTrue(current < previous, "La densidad debe decrecer en " + h + " m");
            previous = current;
        }
    }

    @Test
    @DisplayName("Altitud negativa: se satura al nivel del mar")
    void properties_belowSeaLevel_shouldClampToZero() {
        assertEquals(atmosphere.pressureAt(0.0), atmosphere.pressureAt(-500.0));
        assertEquals(atmosphere.densityAt(0.0), atmosphere.densityAt(-1.0));
    }

    @Test
    @DisplayName("Por encima del techo tabulado se extrapola la última capa con valores finitos y positivos")
    void properties_aboveCeiling_shouldExtrapolate() {
        AtmosphereProperties at47 = atmosphere.properties(47_000.0);
        AtmosphereProperties at60 = atmosphere.properties(60_000.0);

        assertTrue(Double.isFinite(at60.density()) && at60.density() > 0);
        assertTrue(at60.pressure() < at47.pressure());
        assertTrue(at60.temperature() > at47.temperature(), "La última capa tiene gradiente positivo");
    }
}
