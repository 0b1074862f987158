package com.iimsoft.binassign.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.iimsoft.binassign.compat.DefaultPolicy;
import com.iimsoft.binassign.config.RuleDefinition;
import com.iimsoft.binassign.solver.SolveConfig;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SolveRequest {

    public List<MaterialDto> materials;
    public List<BinDto> bins;

    /** 可选：为空时使用引擎默认规则 */
    public List<RuleDefinition> rules;

    /** 可选：为空时使用引擎默认策略 */
    public DefaultPolicy defaultPolicy;

    /** 可选：为空时使用引擎默认求解参数 */
    public SolveConfig config;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MaterialDto {
        public String id;
        /** 按小数读入，整数性由服务端校验 */
        public Double frequency;
        public Double size;
        public String category;

        public MaterialDto() {}

        public MaterialDto(String id, double frequency, double size, String category) {
            this.id = id;
            this.frequency = frequency;
            this.size = size;
            this.category = category;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BinDto {
        public String id;
        public Double capacity;
        public Double cost;
        public String slotType; // safe/special/regular

        public BinDto() {}

        public BinDto(String id, double capacity, double cost, String slotType) {
            this.id = id;
            this.capacity = capacity;
            this.cost = cost;
            this.slotType = slotType;
        }
    }
}
