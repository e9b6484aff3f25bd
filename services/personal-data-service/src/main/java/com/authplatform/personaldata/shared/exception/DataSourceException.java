package com.authplatform.personaldata.shared.exception;

public final class DataSourceException extends PersonalDataException {

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "DATA_SOURCE_ERROR";
    }
}
