package com.iimsoft.binassign.exception;

/**
 * 求解结果与独立复算结果不一致，属于内部缺陷，不重试。
 */
public class ConsistencyException extends AssignmentException {

    public ConsistencyException(String message, String subjectId) {
        super(message, subjectId);
    }
}
