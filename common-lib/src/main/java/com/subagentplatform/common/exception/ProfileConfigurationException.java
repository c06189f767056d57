package com.subagentplatform.common.exception;

/**
 * Deployment defect detected while loading the tool table or agent profiles.
 * Raised at startup so a misconfigured agent never reaches call time.
 */
public class ProfileConfigurationException extends RuntimeException {

    public ProfileConfigurationException(String message) {
        super(message);
    }

    public ProfileConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
