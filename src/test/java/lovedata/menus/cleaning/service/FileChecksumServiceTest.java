package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FileChecksumService
 */
class FileChecksumServiceTest {

    private FileChecksumService fileChecksumService;

    @BeforeEach
    void setUp() {
        fileChecksumService = new FileChecksumService();
    }

    @Test
    void testCalculateFileChecksum_KnownSha256() throws Exception {
        MockMultipartFile file = TestDataFactory.createCsvFile("abc.csv", "abc");

        String checksum = fileChecksumService.calculateFileChecksum(file);

        assertThat(checksum).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void testCalculateFileChecksum_SameContentSameChecksum() throws Exception {
        String first = fileChecksumService.calculateFileChecksum(TestDataFactory.createSampleCsvFile());
        String renamed = fileChecksumService.calculateFileChecksum(
                TestDataFactory.createCsvFile("Menu-copy.csv", TestDataFactory.sampleCsv()));
        String other = fileChecksumService.calculateFileChecksum(
                TestDataFactory.createCsvFile("menus.csv", TestDataFactory.CSV_HEADER));

        assertThat(renamed).isEqualTo(first);
        assertThat(other).isNotEqualTo(first).hasSize(64);
    }

    @Test
    void testGetDecompressedInputStream_PlainCsv() throws IOException {
        MockMultipartFile file = TestDataFactory.createSampleCsvFile();

        try (InputStream in = fileChecksumService.getDecompressedInputStream(file)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo(TestDataFactory.sampleCsv());
        }
    }

    @Test
    void testGetDecompressedInputStream_Gzip() throws IOException {
        MockMultipartFile file = TestDataFactory.createGzipFile("Menu.csv.gz", TestDataFactory.sampleCsv());

        try (InputStream in = fileChecksumService.getDecompressedInputStream(file)) {
            assertThat(in).isInstanceOf(GZIPInputStream.class);
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo(TestDataFactory.sampleCsv());
        }
    }

    @Test
    void testGetDecompressedInputStream_ZipPositionedAtCsvEntry() throws IOException {
        MockMultipartFile file = TestDataFactory.createZipFile("Menu.ZIP", "export/Menu.csv", TestDataFactory.sampleCsv());

        try (InputStream in = fileChecksumService.getDecompressedInputStream(file)) {
            assertThat(in).isInstanceOf(ZipInputStream.class);
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo(TestDataFactory.sampleCsv());
        }
    }

    @Test
    void testGetDecompressedInputStream_ZipWithoutCsv_Throws() throws IOException {
        MockMultipartFile file = TestDataFactory.createZipFile("Menu.zip", "README.txt", "no data here");

        assertThatThrownBy(() -> fileChecksumService.getDecompressedInputStream(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No CSV entry found in ZIP file: Menu.zip");
    }
}
