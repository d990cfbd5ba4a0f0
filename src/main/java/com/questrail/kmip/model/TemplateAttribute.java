package com.questrail.kmip.model;

import java.util.List;
import java.util.Objects;

/**
 * Caller-supplied attributes parameterizing object creation.
 */
public record TemplateAttribute(List<Attribute> attributes)
{
    public TemplateAttribute {
        attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
    }

    public static TemplateAttribute of(Attribute... attributes) {
        return new TemplateAttribute(List.of(attributes));
    }
}
