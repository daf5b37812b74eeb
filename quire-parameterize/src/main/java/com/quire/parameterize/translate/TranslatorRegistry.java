package com.quire.parameterize.translate;

import com.quire.document.Notebook;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Translators by language name. The shared registry knows python, r, scala and bash; more can be
 * registered at startup.
 */
public final class TranslatorRegistry {

    public static final String DEFAULT_LANGUAGE = "python";

    private static final TranslatorRegistry INSTANCE = withDefaults();

    private final Map<String, ParameterTranslator> translators = new ConcurrentHashMap<>();

    public static TranslatorRegistry getInstance() {
        return INSTANCE;
    }

    public static TranslatorRegistry withDefaults() {
        TranslatorRegistry registry = new TranslatorRegistry();
        registry.register(new PythonTranslator());
        registry.register(new RTranslator());
        registry.register(new ScalaTranslator());
        registry.register(new BashTranslator());
        return registry;
    }

    /** Registers (or replaces) the translator for its language. */
    public void register(ParameterTranslator translator) {
        Objects.requireNonNull(translator, "translator");
        translators.put(key(translator.getLanguage()), translator);
    }

    /**
     * @throws IllegalArgumentException if no translator handles {@code language}
     */
    public ParameterTranslator get(String language) {
        ParameterTranslator translator = language == null ? null : translators.get(key(language));
        if (translator == null) {
            throw new IllegalArgumentException("No parameter translator for language: " + language);
        }
        return translator;
    }

    /** Translator for the notebook: see {@link #resolveLanguage(Notebook, String)}. */
    public ParameterTranslator forNotebook(Notebook notebook, String language) {
        return get(resolveLanguage(notebook, language));
    }

    /**
     * Explicit language if given, else {@code metadata.kernelspec.language}, else
     * {@code metadata.language_info.name}, else {@value #DEFAULT_LANGUAGE}.
     */
    public static String resolveLanguage(Notebook notebook, String language) {
        if (language != null && !language.isBlank()) {
            return key(language);
        }
        if (notebook != null) {
            String fromKernelspec = notebook.metadataString("kernelspec.language");
            if (fromKernelspec != null && !fromKernelspec.isBlank()) {
                return key(fromKernelspec);
            }
            String fromLanguageInfo = notebook.metadataString("language_info.name");
            if (fromLanguageInfo != null && !fromLanguageInfo.isBlank()) {
                return key(fromLanguageInfo);
            }
        }
        return DEFAULT_LANGUAGE;
    }

    private static String key(String language) {
        return language.strip().toLowerCase(Locale.ROOT);
    }
}
