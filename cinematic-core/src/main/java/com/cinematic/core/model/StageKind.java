package com.cinematic.core.model;

/**
 * Kinds of stage in a project's graph.
 * The weight reflects typical cost and drives the progress percentage.
 */
public enum StageKind {
    SAFETY_CHECK(ResourceClass.CPU, 1),
    IMAGE_GEN(ResourceClass.GPU, 5),
    ANIMATE(ResourceClass.GPU, 8),
    AUDIO_MIX(ResourceClass.CPU, 2),
    COMPOSITION(ResourceClass.CPU, 4);

    private final ResourceClass resourceClass;
    private final int weight;

    StageKind(ResourceClass resourceClass, int weight) {
        this.resourceClass = resourceClass;
        this.weight = weight;
    }

    public ResourceClass resourceClass() {
        return resourceClass;
    }

    public int weight() {
        return weight;
    }

    /**
     * Slug used when building stage ids, e.g. {@code image-gen}.
     */
    public String slug() {
        return name().toLowerCase().replace('_', '-');
    }
}
