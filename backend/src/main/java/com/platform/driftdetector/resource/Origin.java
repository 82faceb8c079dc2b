package com.platform.driftdetector.resource;

/**
 * Which side of the comparison a resource was read from.
 */
public enum Origin {
    DECLARED,   // IaC template
    OBSERVED    // live state
}
