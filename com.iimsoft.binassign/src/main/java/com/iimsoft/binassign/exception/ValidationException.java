package com.iimsoft.binassign.exception;

/**
 * 输入不合法：重复标识、非正数值、未知类别/类型，以及请求中缺失的字段、错误的规则或求解参数。
 */
public class ValidationException extends AssignmentException {

    public ValidationException(String message, String subjectId) {
        super(message, subjectId);
    }

    public ValidationException(String message, String subjectId, Throwable cause) {
        super(message, subjectId, cause);
    }
}
