package work.labsim.simulator.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LabwareDefinitionTest {
    @Test
    void uriDefaultsNamespaceAndVersion() {
        var definition = new LabwareDefinition(Map.of("parameters", Map.of("loadName", "plain")));
        assertEquals("opentrons/plain/1", definition.uri());
        assertEquals("plain", definition.displayName());
        assertFalse(definition.isTipRack());
    }

    @Test
    void wellsAreColumnMajor() {
        var definition = new LabwareDefinition(Map.of(
            "parameters", Map.of("loadName", "small"),
            "grid", Map.of("rows", 2, "columns", 2)));
        assertEquals(List.of("A1", "B1", "A2", "B2"), definition.wellNames());
    }

    @Test
    void builtInLibraryMatchesNamespaceAndVersion() {
        assertTrue(LabwareLibrary.find("opentrons_96_tiprack_300ul", "opentrons", 1).isPresent());
        assertTrue(LabwareLibrary.find("opentrons_96_tiprack_300ul", "custom_beta", null).isEmpty());
        assertTrue(LabwareLibrary.find("opentrons_96_tiprack_300ul", null, 2).isEmpty());
        assertTrue(LabwareLibrary.find("../etc/passwd", null, null).isEmpty());
        assertTrue(LabwareLibrary.find("opentrons_96_tiprack_300ul", null, null).orElseThrow().isTipRack());
    }

    @Test
    void definitionNeedsALoadName() {
        assertThrows(IllegalArgumentException.class, () -> new LabwareDefinition(Map.of("metadata", Map.of())));
    }
}
