package com.iimsoft.binassign.domain;

import java.util.Objects;

/**
 * 库位：有限容量，带放置成本（如到出库口的距离）。加载后不可变。
 */
public final class Bin {

    private final String id;
    private final double capacity;
    private final double cost;
    private final String slotType;

    public Bin(String id, double capacity, double cost, String slotType) {
        this.id = id;
        this.capacity = capacity;
        this.cost = cost;
        this.slotType = slotType;
    }

    public String getId() { return id; }
    public double getCapacity() { return capacity; }
    public double getCost() { return cost; }
    public String getSlotType() { return slotType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bin)) return false;
        Bin bin = (Bin) o;
        return Objects.equals(id, bin.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Bin{id='" + id + "', capacity=" + capacity + ", cost=" + cost + ", slotType='" + slotType + "'}";
    }
}
