package com.paperharvest.backend.export;

public enum ExportFormat {
    CSV("csv", "text/csv"),
    JSONL("jsonl", "application/x-ndjson");

    private final String extension;
    private final String contentType;

    ExportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    public static ExportFormat fromName(String name) {
        if (name != null) {
            for (ExportFormat format : values()) {
                if (format.extension.equalsIgnoreCase(name.trim())) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + name);
    }
}
