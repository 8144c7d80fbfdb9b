package org.tesis.parque;

/**
 * Unit prices behind the financial score. Currency is whatever the caller uses.
 */
public final class CostModel {

    private final double pricePerSalableM2;
    private final double roadCostPerM2;
    private final double utilityCostPerRoadM;
    private final double facilityCostPerM2;

    public CostModel(double pricePerSalableM2, double roadCostPerM2,
                     double utilityCostPerRoadM, double facilityCostPerM2) {
        if (pricePerSalableM2 <= 0) throw new IllegalArgumentException("price per salable m2 must be positive");
        if (roadCostPerM2 < 0 || utilityCostPerRoadM < 0 || facilityCostPerM2 < 0)
            throw new IllegalArgumentException("costs must not be negative");
        this.pricePerSalableM2 = pricePerSalableM2;
        this.roadCostPerM2 = roadCostPerM2;
        this.utilityCostPerRoadM = utilityCostPerRoadM;
        this.facilityCostPerM2 = facilityCostPerM2;
    }

    public static CostModel defaults() {
        return new CostModel(120.0, 45.0, 350.0, 200.0);
    }

    public double getPricePerSalableM2() {
        return pricePerSalableM2;
    }

    public double getRoadCostPerM2() {
        return roadCostPerM2;
    }

    public double getUtilityCostPerRoadM() {
        return utilityCostPerRoadM;
    }

    public double getFacilityCostPerM2() {
        return facilityCostPerM2;
    }
}
