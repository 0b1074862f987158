package com.iimsoft.binassign.exception;

/**
 * 模型在结构上不可行（在调用求解器之前即可判定）。
 */
public class ModelException extends AssignmentException {

    public ModelException(String message, String subjectId) {
        super(message, subjectId);
    }
}
