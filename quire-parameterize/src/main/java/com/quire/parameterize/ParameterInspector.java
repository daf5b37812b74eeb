package com.quire.parameterize;

import com.quire.document.Notebook;

import java.util.Set;

/** Infers which parameter names a notebook declares. */
@FunctionalInterface
public interface ParameterInspector {

    /**
     * @param notebook     notebook to inspect
     * @param kernelHint   kernel name requested for execution (may be null)
     * @param languageHint language requested for execution (may be null)
     * @return declared names, in declaration order; empty when nothing can be inferred
     */
    Set<String> inferDeclaredParameters(Notebook notebook, String kernelHint, String languageHint);
}
