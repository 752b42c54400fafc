package com.tastream.exception;

import java.util.Map;

public class DataItemException extends BaseException {

    public DataItemException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public DataItemException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static DataItemException incomplete(String field) {
        return new DataItemException(
                ErrorCode.DATA_ITEM_INCOMPLETE, "Bar field '" + field + "' is missing", Map.of("field", field));
    }

    public static DataItemException invalid(String message, Map<String, Object> details) {
        return new DataItemException(ErrorCode.DATA_ITEM_INVALID, message, details);
    }
}
