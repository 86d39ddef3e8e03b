package com.lyshra.open.template.core.exception.codes;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum TemplateVersionErrorCodes {

    MIGRATION_FAILED(
            "LYSHRA_TPL_0001",
            "Template migration failed"
    ),

    VERSION_NOT_FOUND(
            "LYSHRA_TPL_0002",
            "Template version is not registered"
    )

    ;

    private final String errorCode;
    private final String description;
}
