package com.goerdes.cfrecovery.blocks;

/**
 * Kinds of nodes in the structured block tree.
 */
public enum BlockType {
    BASIC,
    SEQUENCE,
    IF_THEN,
    IF_ELSE
}
