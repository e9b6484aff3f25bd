package com.authplatform.personaldata.shared.exception;

import lombok.Getter;

/**
 * Raised while components are being constructed: empty or malformed field sets,
 * invalid schema identifiers, missing required environment values.
 */
@Getter
public final class ConfigurationException extends PersonalDataException {

    private final String setting;

    public ConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }

    @Override
    public String getErrorCode() {
        return "CONFIGURATION_ERROR";
    }
}
