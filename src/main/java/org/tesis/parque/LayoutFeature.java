package org.tesis.parque;

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exported layout element: stable id, type string and geometry, with a few
 * descriptive properties for the renderer.
 */
public final class LayoutFeature {

    private final String id;
    private final String type;
    private final Geometry geometry;
    private final Map<String, String> properties;

    public LayoutFeature(String id, String type, Geometry geometry, Map<String, String> properties) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String getId() {
        return id;
    }

    /** {@code road-primary}, {@code road-secondary}, {@code road-access}, {@code lot}, {@code open-space} or {@code infrastructure-<kind>}. */
    public String getType() {
        return type;
    }

    public Geometry getGeometry() {
        return geometry;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
