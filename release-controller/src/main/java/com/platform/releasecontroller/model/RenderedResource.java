package com.platform.releasecontroller.model;

/**
 * One document of a rendered release manifest.
 */
public record RenderedResource(
    String kind,
    String name,
    String body
) {}
