package com.iimsoft.binassign.domain;

import java.util.Objects;

/**
 * 物料：待放入库位的货物。加载后不可变。
 */
public final class Material {

    private final String id;
    // 出库频次，越高越紧急
    private final int frequency;
    private final double size;
    private final String category;

    public Material(String id, int frequency, double size, String category) {
        this.id = id;
        this.frequency = frequency;
        this.size = size;
        this.category = category;
    }

    public String getId() { return id; }
    public int getFrequency() { return frequency; }
    public double getSize() { return size; }
    public String getCategory() { return category; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Material)) return false;
        Material material = (Material) o;
        return Objects.equals(id, material.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Material{id='" + id + "', frequency=" + frequency + ", size=" + size + ", category='" + category + "'}";
    }
}
