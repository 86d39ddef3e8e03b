package com.lyshra.open.template.integration.contract.version.migration;

import com.lyshra.open.template.integration.document.TemplateDocument;
import reactor.core.publisher.Mono;

/**
 * Forward transformation applied by a migration step.
 * Reports business failures as an unsuccessful {@link IMigrationResult} rather than an error signal.
 */
@FunctionalInterface
public interface IMigrationFunction {

    Mono<IMigrationResult> apply(TemplateDocument template);
}
