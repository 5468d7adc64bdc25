package com.goerdes.cfrecovery.services;

import com.goerdes.cfrecovery.arch.Architecture;
import com.goerdes.cfrecovery.exception.AnalysisException;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.ArchitectureType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ArchitectureRegistry {

    /** All available architecture implementations to choose from. */
    private final List<Architecture> architectures;

    /** Used for binaries whose architecture is {@link ArchitectureType#UNKNOWN}. */
    private final ArchitectureType fallback;

    public ArchitectureRegistry(List<Architecture> architectures,
                                @Value("${analysis.default-architecture:X86}") ArchitectureType fallback) {
        this.architectures = architectures;
        this.fallback = fallback;
    }

    /**
     * Finds the {@link Architecture} handling the instruction set described by {@code info}.
     * An unknown instruction set is treated as the configured default.
     *
     * @param info the architecture descriptor of the analysed binary
     * @return the matching architecture
     * @throws AnalysisException if no registered architecture supports the instruction set
     */
    public Architecture getArchitecture(ArchitectureInfo info) {
        ArchitectureType type = info.arch() == ArchitectureType.UNKNOWN ? fallback : info.arch();
        return architectures.stream()
                .filter(a -> a.type() == type)
                .findFirst()
                .orElseThrow(() -> new AnalysisException("No registered Architecture supports: " + type, null));
    }

}
