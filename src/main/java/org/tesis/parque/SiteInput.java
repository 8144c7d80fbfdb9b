package org.tesis.parque;

import org.locationtech.jts.geom.LineString;

import java.util.Objects;
import java.util.Optional;

/** A site as handed over by the upload step: boundary plus optional highway line. */
public final class SiteInput {

    private final Boundary boundary;
    private final LineString reference;

    public SiteInput(Boundary boundary, LineString reference) {
        this.boundary = Objects.requireNonNull(boundary, "boundary");
        this.reference = reference;
    }

    public Boundary getBoundary() {
        return boundary;
    }

    public Optional<LineString> getReference() {
        return Optional.ofNullable(reference);
    }
}
