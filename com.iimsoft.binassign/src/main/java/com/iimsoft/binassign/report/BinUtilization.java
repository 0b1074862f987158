package com.iimsoft.binassign.report;

public final class BinUtilization {

    private final String binId;
    private final double used;
    private final double capacity;
    private final int materialCount;

    BinUtilization(String binId, double used, double capacity, int materialCount) {
        this.binId = binId;
        this.used = used;
        this.capacity = capacity;
        this.materialCount = materialCount;
    }

    public String getBinId() { return binId; }
    public double getUsed() { return used; }
    public double getCapacity() { return capacity; }
    public int getMaterialCount() { return materialCount; }

    public double getUtilization() {
        return used / capacity;
    }

    @Override
    public String toString() {
        return binId + ": " + used + "/" + capacity;
    }
}
