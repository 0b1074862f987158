package com.iimsoft.binassign.service;

import com.iimsoft.binassign.api.dto.SolveRequest;
import com.iimsoft.binassign.api.dto.SolveResponse;
import com.iimsoft.binassign.compat.CompatibilityMatrix;
import com.iimsoft.binassign.compat.CompatibilityResolver;
import com.iimsoft.binassign.compat.CompatibilityRuleSet;
import com.iimsoft.binassign.compat.DefaultPolicy;
import com.iimsoft.binassign.config.EngineConfig;
import com.iimsoft.binassign.domain.Bin;
import com.iimsoft.binassign.domain.Catalog;
import com.iimsoft.binassign.domain.CatalogRules;
import com.iimsoft.binassign.domain.Material;
import com.iimsoft.binassign.exception.ValidationException;
import com.iimsoft.binassign.model.ModelBuilder;
import com.iimsoft.binassign.model.OptimizationModel;
import com.iimsoft.binassign.report.AssignmentLine;
import com.iimsoft.binassign.report.AssignmentReport;
import com.iimsoft.binassign.report.BinUtilization;
import com.iimsoft.binassign.report.ResultReporter;
import com.iimsoft.binassign.solver.AssignmentSolver;
import com.iimsoft.binassign.solver.AssignmentSolvers;
import com.iimsoft.binassign.solver.SearchBudget;
import com.iimsoft.binassign.solver.Solution;
import com.iimsoft.binassign.solver.SolveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 分配流水线：load -> resolve -> build -> solve -> report。
 * <p>
 * 无可变共享状态，可被多个线程同时调用。
 */
public class BinAssignmentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinAssignmentService.class);

    private final EngineConfig engineConfig;
    private final CatalogRules catalogRules;
    private final CompatibilityRuleSet defaultRuleSet;
    private final CompatibilityResolver resolver = new CompatibilityResolver();
    private final ResultReporter reporter = new ResultReporter();

    public BinAssignmentService() {
        this(EngineConfig.loadDefault());
    }

    public BinAssignmentService(EngineConfig engineConfig) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        this.catalogRules = engineConfig.toCatalogRules();
        this.defaultRuleSet = engineConfig.toRuleSet();
    }

    public AssignmentReport solve(List<Material> materials, List<Bin> bins, SolveConfig config) {
        return solve(materials, bins, defaultRuleSet, config);
    }

    public AssignmentReport solve(List<Material> materials, List<Bin> bins, CompatibilityRuleSet rules, SolveConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return solve(materials, bins, rules, config, SearchBudget.start(config));
    }

    /**
     * @param budget 调用方持有，可在其它线程上 cancel()
     */
    public AssignmentReport solve(List<Material> materials, List<Bin> bins, CompatibilityRuleSet rules,
                                  SolveConfig config, SearchBudget budget) {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(budget, "budget");

        // 1) 目录
        Catalog catalog = Catalog.load(materials, bins, catalogRules);
        // 2) 兼容矩阵
        CompatibilityMatrix matrix = resolver.resolve(catalog, rules);
        // 3) 模型
        OptimizationModel model = new ModelBuilder(config.isAllowUnassigned()).build(catalog, matrix);
        // 4) 求解
        AssignmentSolver solver = AssignmentSolvers.forStrategy(config.getStrategy());
        Solution solution = solver.solve(model, config, budget);
        // 5) 报告（独立复算）
        AssignmentReport report = reporter.report(solution, catalog, matrix);

        LOGGER.info("Solved {} materials into {} bins with {}: status {}, objective {}, unassigned {}, {} ms",
                catalog.materialCount(), catalog.binCount(), report.getStrategy(), report.getStatus(),
                report.getObjectiveValue(), report.getUnassigned().size(), report.getElapsedMillis());
        return report;
    }

    public SolveResponse solve(SolveRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequest(request);

        List<Material> materials = new ArrayList<>(request.materials.size());
        for (SolveRequest.MaterialDto m : request.materials) {
            materials.add(new Material(m.id, m.frequency.intValue(), m.size, m.category));
        }
        List<Bin> bins = new ArrayList<>(request.bins.size());
        for (SolveRequest.BinDto b : request.bins) {
            bins.add(new Bin(b.id, b.capacity, b.cost, b.slotType));
        }

        CompatibilityRuleSet rules;
        if (request.rules == null && request.defaultPolicy == null) {
            rules = defaultRuleSet;
        } else {
            DefaultPolicy policy = request.defaultPolicy == null ? engineConfig.getDefaultPolicy() : request.defaultPolicy;
            try {
                rules = EngineConfig.toRuleSet(request.rules == null ? engineConfig.getRules() : request.rules, policy);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("request.rules 不合法: " + e.getMessage(), null, e);
            }
        }
        SolveConfig config = request.config == null ? engineConfig.getSolver().copy() : request.config;
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("request.config 不合法: " + e.getMessage(), null, e);
        }

        return buildResponse(solve(materials, bins, rules, config));
    }

    private static void validateRequest(SolveRequest request) {
        if (request.materials == null) {
            throw new ValidationException("request.materials 不能为空", null);
        }
        if (request.bins == null) {
            throw new ValidationException("request.bins 不能为空", null);
        }
        for (SolveRequest.MaterialDto m : request.materials) {
            if (m == null) {
                throw new ValidationException("request.materials 中存在 null 元素", null);
            }
            requireField(m.frequency, "frequency", "物料", m.id);
            requireField(m.size, "size", "物料", m.id);
            double f = m.frequency;
            // JSON 中的 2.5 不能截断成 2
            if (f != Math.rint(f) || Math.abs(f) > Integer.MAX_VALUE) {
                throw new ValidationException("物料 " + m.id + " 的 frequency 必须是整数，实际为 " + m.frequency, m.id);
            }
        }
        for (SolveRequest.BinDto b : request.bins) {
            if (b == null) {
                throw new ValidationException("request.bins 中存在 null 元素", null);
            }
            requireField(b.capacity, "capacity", "库位", b.id);
            requireField(b.cost, "cost", "库位", b.id);
        }
    }

    private static void requireField(Object value, String field, String kind, String id) {
        if (value == null) {
            throw new ValidationException(kind + " " + id + " 缺少字段 " + field, id);
        }
    }

    private static SolveResponse buildResponse(AssignmentReport report) {
        SolveResponse resp = new SolveResponse();
        resp.status = report.getStatus().name();
        resp.strategy = report.getStrategy().name();
        resp.objectiveValue = report.getObjectiveValue();
        resp.nodesExplored = report.getNodesExplored();
        resp.elapsedMillis = report.getElapsedMillis();
        resp.unassigned = new ArrayList<>(report.getUnassigned());

        List<SolveResponse.AssignmentResult> assignments = new ArrayList<>();
        for (AssignmentLine line : report.getLines()) {
            SolveResponse.AssignmentResult r = new SolveResponse.AssignmentResult();
            r.materialId = line.getMaterialId();
            r.binId = line.getBinIdOrMarker();
            r.contribution = line.getContribution();
            assignments.add(r);
        }
        resp.assignments = assignments;

        List<SolveResponse.BinUsage> usages = new ArrayList<>();
        for (BinUtilization u : report.getBinUtilizations()) {
            SolveResponse.BinUsage bu = new SolveResponse.BinUsage();
            bu.binId = u.getBinId();
            bu.used = u.getUsed();
            bu.capacity = u.getCapacity();
            bu.materialCount = u.getMaterialCount();
            usages.add(bu);
        }
        resp.binUsages = usages;
        return resp;
    }

    public EngineConfig getEngineConfig() {
        return engineConfig;
    }
}
