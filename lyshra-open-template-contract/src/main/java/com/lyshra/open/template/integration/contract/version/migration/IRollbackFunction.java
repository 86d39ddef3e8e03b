package com.lyshra.open.template.integration.contract.version.migration;

import com.lyshra.open.template.integration.document.TemplateDocument;
import reactor.core.publisher.Mono;

/**
 * Reverse transformation declared by a reversible migration step.
 */
@FunctionalInterface
public interface IRollbackFunction {

    Mono<TemplateDocument> apply(TemplateDocument template);
}
