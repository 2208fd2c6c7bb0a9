package org.iceforge.quarry.dataset;

import org.iceforge.quarry.ErrorType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FormatValidatorTest {

    @TempDir
    Path dir;

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void parquetNeedsMagicAtBothEnds() throws Exception {
        Path good = Files.write(dir.resolve("good.parquet"), ascii("PAR1 some column chunks PAR1"));
        Path noFooter = Files.write(dir.resolve("nofooter.parquet"), ascii("PAR1 truncated dow"));
        Path noHeader = Files.write(dir.resolve("html.parquet"), ascii("<html>Not Found</html>"));

        ValidationResult ok = FormatValidator.validateFile("u", good, DatasetFormat.PARQUET);
        assertTrue(ok.valid());
        assertEquals(28L, ok.fileSizeBytes());

        ValidationResult footer = FormatValidator.validateFile("u", noFooter, DatasetFormat.PARQUET);
        assertFalse(footer.valid());
        assertEquals(ErrorType.VALIDATION, footer.errorType());
        assertTrue(footer.message().contains("footer"));

        ValidationResult header = FormatValidator.validateFile("u", noHeader, DatasetFormat.PARQUET);
        assertFalse(header.valid());
        assertTrue(header.message().contains("header"));
    }

    @Test
    void shortParquetIsRejectedButBareMagicPairIsAccepted() throws Exception {
        Path tiny = Files.write(dir.resolve("tiny.parquet"), ascii("PA"));
        Path pair = Files.write(dir.resolve("pair.parquet"), ascii("PAR1PAR1"));

        assertTrue(FormatValidator.validateFile("u", tiny, DatasetFormat.PARQUET).message().contains("too few bytes"));
        assertTrue(FormatValidator.validateFile("u", pair, DatasetFormat.PARQUET).valid());
    }

    @Test
    void textFormatsRejectBinaryContent() throws Exception {
        Path csv = Files.write(dir.resolve("a.csv"), ascii("id,name\n1,x\n"));
        Path binary = Files.write(dir.resolve("b.tsv"), new byte[]{'a', 0, 'b'});
        Path empty = Files.write(dir.resolve("empty.csv"), new byte[0]);

        assertTrue(FormatValidator.validateFile("u", csv, DatasetFormat.CSV).valid());
        assertTrue(FormatValidator.validateFile("u", empty, DatasetFormat.CSV).valid());
        ValidationResult r = FormatValidator.validateFile("u", binary, DatasetFormat.TSV);
        assertFalse(r.valid());
        assertTrue(r.message().contains("binary"));
    }

    @Test
    void gzipNeedsGzipMagic() throws Exception {
        Path gz = Files.write(dir.resolve("a.csv.gz"), new byte[]{(byte) 0x1f, (byte) 0x8b, 8, 0});
        Path plain = Files.write(dir.resolve("b.csv.gz"), ascii("id,name"));

        assertTrue(FormatValidator.validateFile("u", gz, DatasetFormat.CSV_GZ).valid());
        assertFalse(FormatValidator.validateFile("u", plain, DatasetFormat.CSV_GZ).valid());
    }

    @Test
    void missingFileIsReportedNotThrown() {
        ValidationResult r = FormatValidator.validateFile("u", dir.resolve("gone.parquet"), DatasetFormat.PARQUET);
        assertFalse(r.valid());
        assertEquals(ErrorType.NETWORK, r.errorType());
    }

    @Test
    void formatComesFromUrlSuffix() {
        assertEquals(DatasetFormat.CSV_GZ, DatasetFormat.fromUrl("https://h/x.csv.gz"));
        assertEquals(DatasetFormat.TSV, DatasetFormat.fromUrl("https://h/x.tsv?dl=1"));
        assertEquals(DatasetFormat.PARQUET, DatasetFormat.fromUrl("https://h/export"));
        assertEquals("read_csv_auto('f.tsv', delim='\\t')", DatasetFormat.TSV.scanExpression("'f.tsv'"));
    }
}
