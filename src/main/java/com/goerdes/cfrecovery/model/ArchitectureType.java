package com.goerdes.cfrecovery.model;

/**
 * Target instruction set of the analysed binary.
 */
public enum ArchitectureType {
    UNKNOWN,
    X86,
    ARM
}
