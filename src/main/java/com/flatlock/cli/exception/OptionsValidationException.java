package com.flatlock.cli.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every problem found in one flatlock command line, keyed by the option that caused it
 * ({@code <lockfile>}, {@code --type}, {@code --workspace}, ...), in the order they were found.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final Map<String, String> errorsByOption;

    public OptionsValidationException(Map<String, String> errorsByOption) {
        super(describe(errorsByOption));
        this.errorsByOption = Collections.unmodifiableMap(new LinkedHashMap<>(errorsByOption));
    }

    public Map<String, String> getErrorsByOption() {
        return errorsByOption;
    }

    public Set<String> getOptions() {
        return errorsByOption.keySet();
    }

    public List<String> getErrors() {
        return List.copyOf(errorsByOption.values());
    }

    private static String describe(Map<String, String> errorsByOption) {
        return errorsByOption.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
