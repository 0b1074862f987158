package com.iimsoft.binassign.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolveResponse {

    /** OPTIMAL/FEASIBLE/UNSOLVED，或出错时的错误类型 */
    public String status;
    public String strategy;
    public Double objectiveValue;

    public List<AssignmentResult> assignments;
    public List<String> unassigned;
    public List<BinUsage> binUsages;

    public Long nodesExplored;
    public Long elapsedMillis;

    /** 出错时的说明 */
    public String error;
    /** 出错时相关的物料/库位标识 */
    public String subjectId;

    public static class AssignmentResult {
        public String materialId;
        public String binId; // 未分配时为 UNASSIGNED
        public double contribution;
    }

    public static class BinUsage {
        public String binId;
        public double used;
        public double capacity;
        public int materialCount;
    }

    public static SolveResponse failure(String status, String error, String subjectId) {
        SolveResponse resp = new SolveResponse();
        resp.status = status;
        resp.error = error;
        resp.subjectId = subjectId;
        return resp;
    }
}
