package lovedata.menus.cleaning.model;

import java.util.Locale;

/**
 * Upload formats a menu export may arrive in, keyed by file extension.
 */
public enum ExportFormat {
    CSV("csv"),
    GZIP("gz"),
    ZIP("zip");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * @return the format whose extension ends the filename (case-insensitive), or null
     */
    public static ExportFormat fromFilename(String filename) {
        if (filename == null) {
            return null;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (lower.endsWith("." + format.extension)) {
                return format;
            }
        }
        return null;
    }

    public static String[] extensions() {
        ExportFormat[] formats = values();
        String[] extensions = new String[formats.length];
        for (int i = 0; i < formats.length; i++) {
            extensions[i] = formats[i].extension;
        }
        return extensions;
    }
}
