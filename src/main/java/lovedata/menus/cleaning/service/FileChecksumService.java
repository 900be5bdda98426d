package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.model.ExportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Service responsible for upload checksums and decompression.
 *
 * Features:
 * - SHA-256 checksum of the uploaded bytes, used to detect re-uploads
 * - Transparent .gz and .zip handling for menu exports
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class FileChecksumService {

    private static final Logger logger = LoggerFactory.getLogger(FileChecksumService.class);

    /**
     * Calculate SHA-256 checksum of the file as uploaded (compressed bytes for .gz/.zip).
     *
     * @return SHA-256 checksum as lower-case hexadecimal string
     */
    public String calculateFileChecksum(MultipartFile file) throws IOException, NoSuchAlgorithmException {
        logger.debug("Calculating SHA-256 checksum for file: {}", file.getOriginalFilename());

        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        try (InputStream inputStream = file.getInputStream()) {
            byte[] buffer = new byte[8192];
            int bytesRead;
            while ((bytesRead = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }

        String checksum = bytesToHex(digest.digest());
        logger.debug("Calculated checksum for {}: {}", file.getOriginalFilename(), checksum);
        return checksum;
    }

    /**
     * Stream of the CSV text inside an upload:
     * - GZIP: the inflated stream
     * - ZIP: positioned at the first .csv entry
     * - CSV, or no recognizable extension: the upload as is
     *
     * @throws IllegalArgumentException if a .zip holds no .csv entry
     */
    public InputStream getDecompressedInputStream(MultipartFile file) throws IOException {
        String filename = file.getOriginalFilename();
        ExportFormat format = ExportFormat.fromFilename(filename);
        InputStream inputStream = file.getInputStream();

        if (format == ExportFormat.GZIP) {
            logger.debug("Decompressing GZIP menu export: {}", filename);
            return new GZIPInputStream(inputStream);
        }
        if (format == ExportFormat.ZIP) {
            return openCsvEntry(new ZipInputStream(inputStream), filename);
        }
        logger.debug("Reading plain menu export: {}", filename);
        return inputStream;
    }

    private InputStream openCsvEntry(ZipInputStream zipStream, String filename) throws IOException {
        ZipEntry entry;
        while ((entry = zipStream.getNextEntry()) != null) {
            if (!entry.isDirectory() && ExportFormat.fromFilename(entry.getName()) == ExportFormat.CSV) {
                logger.debug("Reading ZIP entry {} of {}", entry.getName(), filename);
                return zipStream;
            }
        }
        zipStream.close();
        throw new IllegalArgumentException("No CSV entry found in ZIP file: " + filename);
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
