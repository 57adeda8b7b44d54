package com.cinematic.core.model;

/**
 * Worker pool a stage must be dispatched onto.
 */
public enum ResourceClass {
    GPU,
    CPU
}
