package com.lyshra.open.template.core.exception.version;

import com.lyshra.open.template.core.exception.codes.TemplateVersionErrorCodes;

/**
 * Base exception for template versioning errors.
 */
public class TemplateVersionException extends RuntimeException {

    private final TemplateVersionErrorCodes errorCode;
    private final String templateId;

    public TemplateVersionException(String message, TemplateVersionErrorCodes errorCode, String templateId) {
        super(message);
        this.errorCode = errorCode;
        this.templateId = templateId;
    }

    public TemplateVersionException(String message, TemplateVersionErrorCodes errorCode, String templateId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.templateId = templateId;
    }

    public TemplateVersionErrorCodes getErrorCode() {
        return errorCode;
    }

    public String getTemplateId() {
        return templateId;
    }
}
