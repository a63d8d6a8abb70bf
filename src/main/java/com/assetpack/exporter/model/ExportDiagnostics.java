package com.assetpack.exporter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings accumulated during an export run.
 *
 * Written from worker threads, so both lists are synchronized. Pure structure only: no logging, no IO.
 */
@Getter
public class ExportDiagnostics {
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
