package com.authplatform.personaldata.shared.exception;

/**
 * Base sealed exception for all Personal Data Service exceptions.
 */
public sealed abstract class PersonalDataException extends RuntimeException
        permits ConfigurationException, DataSourceException {

    protected PersonalDataException(String message) {
        super(message);
    }

    protected PersonalDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
}
