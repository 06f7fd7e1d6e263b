package com.galaxyast.docs.language;

import java.util.Optional;

/**
 * Languages recognised by the registry. {@code id} is the name written to output.
 */
public enum Language {
    PYTHON("python"),
    JAVASCRIPT("javascript"),
    JAVA("java"),
    METTA("metta");

    private final String id;

    Language(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<Language> fromId(String id) {
        for (Language language : values()) {
            if (language.id.equals(id)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
