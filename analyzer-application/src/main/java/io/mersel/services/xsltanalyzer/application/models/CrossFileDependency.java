package io.mersel.services.xsltanalyzer.application.models;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;

import java.util.List;

/**
 * Birden fazla dosyadan çağrılan şablon.
 *
 * @param template   Çağrılan şablon hedefi
 * @param callers    Tüm çağıranlar
 * @param complexity 3'ten fazla çağıran varsa high, aksi halde medium
 */
public record CrossFileDependency(
        String template,
        List<TemplateCaller> callers,
        PriorityLevel complexity
) {
}
