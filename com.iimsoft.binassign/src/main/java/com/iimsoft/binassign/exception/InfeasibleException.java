package com.iimsoft.binassign.exception;

/**
 * 已证明不存在满足容量与兼容性约束的完整分配。
 */
public class InfeasibleException extends AssignmentException {

    public InfeasibleException(String message, String subjectId) {
        super(message, subjectId);
    }
}
