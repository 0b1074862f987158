package com.iimsoft.binassign.domain;

import com.iimsoft.binassign.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 物料与库位目录。由 {@link #load} 一次性构建，之后只读。
 * <p>
 * 保留输入顺序，同时提供按标识 O(1) 查找和下标查找（兼容矩阵按下标寻址）。
 */
public final class Catalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(Catalog.class);

    private final List<Material> materials;
    private final List<Bin> bins;
    private final Map<String, Integer> materialIndexById;
    private final Map<String, Integer> binIndexById;

    private Catalog(List<Material> materials, List<Bin> bins,
                    Map<String, Integer> materialIndexById, Map<String, Integer> binIndexById) {
        this.materials = materials;
        this.bins = bins;
        this.materialIndexById = materialIndexById;
        this.binIndexById = binIndexById;
    }

    public static Catalog load(List<Material> materials, List<Bin> bins) {
        return load(materials, bins, CatalogRules.warehouseDefaults());
    }

    /**
     * 校验并构建目录，遇到第一个违规即抛出 {@link ValidationException}。
     */
    public static Catalog load(List<Material> materials, List<Bin> bins, CatalogRules rules) {
        Objects.requireNonNull(materials, "materials");
        Objects.requireNonNull(bins, "bins");
        Objects.requireNonNull(rules, "rules");

        Map<String, Integer> materialIndexById = new HashMap<>();
        for (Material m : materials) {
            if (m == null) {
                throw new ValidationException("物料列表中存在 null 元素", null);
            }
            String id = m.getId();
            requireId(id, "material");
            if (materialIndexById.containsKey(id)) {
                throw new ValidationException("物料标识重复: " + id, id);
            }
            if (m.getFrequency() <= 0) {
                throw new ValidationException("物料 " + id + " 的 frequency 必须 > 0，实际为 " + m.getFrequency(), id);
            }
            requirePositive(m.getSize(), "size", id);
            if (!rules.isAllowedCategory(m.getCategory())) {
                throw new ValidationException("物料 " + id + " 的类别未配置: " + m.getCategory()
                        + "，允许值 " + rules.getAllowedCategories(), id);
            }
            materialIndexById.put(id, materialIndexById.size());
        }

        Map<String, Integer> binIndexById = new HashMap<>();
        for (Bin b : bins) {
            if (b == null) {
                throw new ValidationException("库位列表中存在 null 元素", null);
            }
            String id = b.getId();
            requireId(id, "bin");
            if (binIndexById.containsKey(id)) {
                throw new ValidationException("库位标识重复: " + id, id);
            }
            requirePositive(b.getCapacity(), "capacity", id);
            if (!Double.isFinite(b.getCost()) || b.getCost() < 0) {
                throw new ValidationException("库位 " + id + " 的 cost 必须 >= 0，实际为 " + b.getCost(), id);
            }
            if (!rules.isAllowedSlotType(b.getSlotType())) {
                throw new ValidationException("库位 " + id + " 的类型未配置: " + b.getSlotType()
                        + "，允许值 " + rules.getAllowedSlotTypes(), id);
            }
            binIndexById.put(id, binIndexById.size());
        }

        LOGGER.info("Catalog loaded: {} materials, {} bins", materials.size(), bins.size());
        return new Catalog(
                Collections.unmodifiableList(new ArrayList<>(materials)),
                Collections.unmodifiableList(new ArrayList<>(bins)),
                Collections.unmodifiableMap(materialIndexById),
                Collections.unmodifiableMap(binIndexById));
    }

    private static void requireId(String id, String kind) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(kind + " 标识不能为空", id);
        }
    }

    private static void requirePositive(double value, String field, String id) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ValidationException(id + " 的 " + field + " 必须 > 0，实际为 " + value, id);
        }
    }

    public List<Material> getMaterials() { return materials; }
    public List<Bin> getBins() { return bins; }

    public int materialCount() { return materials.size(); }
    public int binCount() { return bins.size(); }

    public boolean isEmpty() {
        return materials.isEmpty() || bins.isEmpty();
    }

    public Material findMaterial(String id) {
        Integer idx = materialIndexById.get(id);
        return idx == null ? null : materials.get(idx);
    }

    public Bin findBin(String id) {
        Integer idx = binIndexById.get(id);
        return idx == null ? null : bins.get(idx);
    }

    /**
     * @return 物料下标，不存在时为 -1
     */
    public int indexOfMaterial(String id) {
        return materialIndexById.getOrDefault(id, -1);
    }

    /**
     * @return 库位下标，不存在时为 -1
     */
    public int indexOfBin(String id) {
        return binIndexById.getOrDefault(id, -1);
    }
}
