package com.ordermatcher.pricing;

/**
 * Outcome of one tolerance filter and reprice pass.
 */
public class RepriceResult {

    private final int productId;
    private final double referencePrice;
    private final double newPrice;
    private final int retainedBuys;
    private final int retainedSells;
    private final int droppedBuys;
    private final int droppedSells;

    public RepriceResult(int productId, double referencePrice, double newPrice,
                         int retainedBuys, int retainedSells,
                         int droppedBuys, int droppedSells) {
        this.productId = productId;
        this.referencePrice = referencePrice;
        this.newPrice = newPrice;
        this.retainedBuys = retainedBuys;
        this.retainedSells = retainedSells;
        this.droppedBuys = droppedBuys;
        this.droppedSells = droppedSells;
    }

    public int getProductId() {
        return productId;
    }

    public double getReferencePrice() {
        return referencePrice;
    }

    public double getNewPrice() {
        return newPrice;
    }

    public int getRetainedBuys() {
        return retainedBuys;
    }

    public int getRetainedSells() {
        return retainedSells;
    }

    public int getDroppedBuys() {
        return droppedBuys;
    }

    public int getDroppedSells() {
        return droppedSells;
    }

    public int getDroppedCount() {
        return droppedBuys + droppedSells;
    }
}
