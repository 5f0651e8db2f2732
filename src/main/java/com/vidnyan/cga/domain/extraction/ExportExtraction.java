package com.vidnyan.cga.domain.extraction;

/**
 * A name made visible outside its file.
 */
public record ExportExtraction(
    String name,
    int line,
    boolean defaultExport
) {

    public String mergeKey() {
        return name + ":" + line;
    }
}
