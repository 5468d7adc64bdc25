package com.goerdes.cfrecovery.model;

/**
 * Describes the binary a function was disassembled from. Produced by the
 * loader and only carried through the analysis.
 *
 * @param arch      the instruction set
 * @param bigEndian whether multi-byte values are stored big endian
 * @param hasCanary whether the binary was compiled with stack canaries
 * @param stripped  whether symbols were stripped
 * @param is64bit   whether the binary targets a 64-bit machine
 */
public record ArchitectureInfo(
        ArchitectureType arch,
        boolean bigEndian,
        boolean hasCanary,
        boolean stripped,
        boolean is64bit
) {

    private static final ArchitectureInfo UNKNOWN = new ArchitectureInfo(ArchitectureType.UNKNOWN, false, false, false, false);

    public ArchitectureInfo {
        if (arch == null) {
            arch = ArchitectureType.UNKNOWN;
        }
    }

    /**
     * @return the descriptor used when nothing is known about the binary
     */
    public static ArchitectureInfo unknown() {
        return UNKNOWN;
    }
}
