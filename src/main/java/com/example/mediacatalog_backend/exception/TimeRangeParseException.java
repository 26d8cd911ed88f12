package com.example.mediacatalog_backend.exception;

public class TimeRangeParseException extends CatalogException {
    public TimeRangeParseException(String reason) {
        super(ErrorKind.PARSE_ERROR, reason);
    }
}
