package com.iimsoft.binassign.compat;

import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Catalog;
import com.iimsoft.binassign.domain.Material;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 对目录中每个 (物料, 库位) 求一次规则集，得到兼容矩阵。无副作用。
 */
public class CompatibilityResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompatibilityResolver.class);

    public CompatibilityMatrix resolve(Catalog catalog, CompatibilityRuleSet rules) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(rules, "rules");

        List<Material> materials = catalog.getMaterials();
        List<Bin> bins = catalog.getBins();
        boolean[][] compatible = new boolean[materials.size()][bins.size()];
        for (int i = 0; i < materials.size(); i++) {
            String category = materials.get(i).getCategory();
            for (int j = 0; j < bins.size(); j++) {
                compatible[i][j] = rules.isCompatible(category, bins.get(j).getSlotType());
            }
        }
        CompatibilityMatrix matrix = new CompatibilityMatrix(compatible, bins.size());
        LOGGER.debug("Compatibility resolved: {} compatible pairs, density {} (default policy {})",
                matrix.compatiblePairCount(), String.format("%.3f", matrix.density()), rules.getDefaultPolicy());
        return matrix;
    }
}
