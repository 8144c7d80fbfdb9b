package org.tesis.parque;

/**
 * Road hierarchy. Access roads are the connectors from an entrance on the
 * site boundary to the internal network.
 */
public enum RoadClass {
    PRIMARY("road-primary"),
    SECONDARY("road-secondary"),
    ACCESS("road-access");

    private final String featureType;

    RoadClass(String featureType) {
        this.featureType = featureType;
    }

    public String featureType() {
        return featureType;
    }
}
