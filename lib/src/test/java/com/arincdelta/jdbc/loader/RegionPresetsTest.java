package com.arincdelta.jdbc.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Set;
import org.junit.jupiter.api.Test;

final class RegionPresetsTest {

    @Test
    void bundledAliasesAreLoadedFromClasspath() {
        RegionPresets presets = RegionPresets.defaults();
        assertEquals(Set.of("EUR", "EEU"), presets.getAliases().get("EU"));
        assertEquals(Set.of("MES"), presets.getAliases().get("ME"));
    }

    @Test
    void areaCodesPassThrough() throws Exception {
        assertEquals(Set.of("EUR", "EEU", "MES"), RegionPresets.defaults().expand(Set.of("EUR", "EEU", "MES")));
        assertEquals(Set.of("AFR", "MES"), RegionPresets.defaults().expand(Set.of("AFR", "ME")));
    }

    @Test
    void rejectsUnknownToken() {
        assertThrows(DeltaRequestException.class, () -> RegionPresets.defaults().expand(Set.of("XYZ")));
    }
}
