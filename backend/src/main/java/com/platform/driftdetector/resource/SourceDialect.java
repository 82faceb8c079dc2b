package com.platform.driftdetector.resource;

/**
 * Front-end that produced a raw record.
 * Selects how kind and address are derived when the record carries no hints.
 */
public enum SourceDialect {
    TERRAFORM,
    CLOUDFORMATION,
    KUBERNETES,
    GENERIC
}
