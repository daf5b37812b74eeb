package com.quire.parameterize;

import com.quire.document.Cell;
import com.quire.document.Notebook;
import com.quire.parameterize.translate.ParameterDeclaration;
import com.quire.parameterize.translate.TranslatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Reads declared names from the {@code parameters} cell using the language translator's inspection.
 */
public final class TranslatorParameterInspector implements ParameterInspector {

    private static final Logger log = LoggerFactory.getLogger(TranslatorParameterInspector.class);

    private final TranslatorRegistry translators;

    public TranslatorParameterInspector() {
        this(TranslatorRegistry.getInstance());
    }

    public TranslatorParameterInspector(TranslatorRegistry translators) {
        this.translators = Objects.requireNonNull(translators, "translators");
    }

    @Override
    public Set<String> inferDeclaredParameters(Notebook notebook, String kernelHint, String languageHint) {
        Set<String> names = new LinkedHashSet<>();
        Cell cell = ParameterInjector.findParametersCell(notebook);
        if (cell == null) {
            log.debug("No parameters cell found; declared parameters unknown");
            return names;
        }
        String language = TranslatorRegistry.resolveLanguage(notebook, languageHint);
        for (ParameterDeclaration declaration : translators.get(language).inspect(cell.getSource())) {
            names.add(declaration.name());
        }
        return names;
    }
}
