package lovedata.menus.cleaning.util;

import lovedata.menus.cleaning.model.ExportFormat;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Checks on uploaded menu exports before anything is read from them.
 */
public class FileValidationUtil {

    private FileValidationUtil() {
    }

    /**
     * @throws IllegalArgumentException if file is null or empty
     */
    public static void validateFileNotEmpty(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty or not provided");
        }
    }

    /**
     * @return the original filename
     * @throws IllegalArgumentException if filename is null or blank
     */
    public static String validateAndGetFilename(MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Invalid filename");
        }
        return filename;
    }

    /**
     * @param allowedExtensions extensions without the leading dot, e.g. "csv", "gz"
     * @throws IllegalArgumentException if the filename ends with none of them
     */
    public static void validateFileExtension(MultipartFile file, String... allowedExtensions) {
        String filename = validateAndGetFilename(file);
        String lower = filename.toLowerCase(Locale.ROOT);

        for (String extension : allowedExtensions) {
            if (lower.endsWith("." + extension.toLowerCase(Locale.ROOT))) {
                return;
            }
        }
        String expected = Arrays.stream(allowedExtensions)
                .map(extension -> extension.toUpperCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                String.format("Invalid file type. Expected %s file but received '%s'. Please upload a valid file.",
                        expected, filename));
    }

    public static void validateFile(MultipartFile file, String... allowedExtensions) {
        validateFileNotEmpty(file);
        validateFileExtension(file, allowedExtensions);
    }

    /**
     * Validate an upload as a menu export (plain, gzip or zip CSV).
     *
     * @return the detected format
     * @throws IllegalArgumentException if the file is empty or not a supported export
     */
    public static ExportFormat validateMenuExport(MultipartFile file) {
        validateFile(file, ExportFormat.extensions());
        return ExportFormat.fromFilename(file.getOriginalFilename());
    }
}
