package com.iimsoft.binassign.exception;

/**
 * 分配引擎异常基类。
 * <p>
 * subjectId 为出错的物料/库位标识，整体性错误（如总容量不足）时为 null。
 */
public class AssignmentException extends RuntimeException {

    private final String subjectId;

    public AssignmentException(String message, String subjectId) {
        super(message);
        this.subjectId = subjectId;
    }

    public AssignmentException(String message, String subjectId, Throwable cause) {
        super(message, cause);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
