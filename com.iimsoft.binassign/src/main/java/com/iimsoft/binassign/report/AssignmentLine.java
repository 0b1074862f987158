package com.iimsoft.binassign.report;

/**
 * 报告中的一行：物料 -> 库位（或未分配）。
 */
public final class AssignmentLine {

    public static final String UNASSIGNED_MARKER = "UNASSIGNED";

    private final String materialId;
    private final String binId;
    private final double contribution;

    AssignmentLine(String materialId, String binId, double contribution) {
        this.materialId = materialId;
        this.binId = binId;
        this.contribution = contribution;
    }

    public String getMaterialId() { return materialId; }

    /**
     * @return 库位标识，未分配时为 null
     */
    public String getBinId() { return binId; }

    public boolean isAssigned() { return binId != null; }

    /**
     * 库位标识，未分配时为 {@link #UNASSIGNED_MARKER}。
     */
    public String getBinIdOrMarker() {
        return binId == null ? UNASSIGNED_MARKER : binId;
    }

    /** frequency * cost，未分配为 0 */
    public double getContribution() { return contribution; }

    @Override
    public String toString() {
        return materialId + " -> " + getBinIdOrMarker() + " (" + contribution + ")";
    }
}
