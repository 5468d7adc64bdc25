package com.goerdes.cfrecovery.services;

import com.goerdes.cfrecovery.arch.ArmArchitecture;
import com.goerdes.cfrecovery.arch.X86Architecture;
import com.goerdes.cfrecovery.exception.AnalysisException;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.ArchitectureType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchitectureRegistryTest {

    private final ArchitectureRegistry registry =
            new ArchitectureRegistry(List.of(new X86Architecture(), new ArmArchitecture()), ArchitectureType.ARM);

    @Test
    void testLookup() {
        assertEquals(ArchitectureType.X86, registry.getArchitecture(info(ArchitectureType.X86)).type());
        assertEquals(ArchitectureType.ARM, registry.getArchitecture(info(ArchitectureType.ARM)).type());
    }

    @Test
    void testUnknownUsesFallback() {
        assertEquals(ArchitectureType.ARM, registry.getArchitecture(ArchitectureInfo.unknown()).type());
    }

    @Test
    void testUnsupported() {
        ArchitectureRegistry x86Only = new ArchitectureRegistry(List.of(new X86Architecture()), ArchitectureType.X86);
        AnalysisException e = assertThrows(AnalysisException.class, () -> x86Only.getArchitecture(info(ArchitectureType.ARM)));
        assertTrue(e.getMessage().contains("ARM"));
    }

    private static ArchitectureInfo info(ArchitectureType type) {
        return new ArchitectureInfo(type, false, false, false, true);
    }
}
