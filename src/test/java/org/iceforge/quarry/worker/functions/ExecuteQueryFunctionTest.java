package org.iceforge.quarry.worker.functions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.support.DuckDbFixtures;
import org.iceforge.quarry.worker.WorkerTaskException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExecuteQueryFunctionTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecuteQueryFunction fn = new ExecuteQueryFunction();
    private Path trips;

    @BeforeEach
    void setUp() throws Exception {
        trips = DuckDbFixtures.parquet(dir.resolve("trips.parquet"), DuckDbFixtures.tripsSelect());
    }

    private ObjectNode request(String sql, Object... tableAndPathAndFormat) {
        ObjectNode args = mapper.createObjectNode().put("sql", sql);
        ArrayNode datasets = args.putArray("datasets");
        for (int i = 0; i < tableAndPathAndFormat.length; i += 3) {
            datasets.addObject()
                    .put("tableName", (String) tableAndPathAndFormat[i])
                    .put("path", tableAndPathAndFormat[i + 1].toString())
                    .put("format", (String) tableAndPathAndFormat[i + 2]);
        }
        return args;
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    @Test
    void queriesRegisteredDatasetsByTableName() throws Exception {
        JsonNode out = fn.apply(request(
                "SELECT city, count(*) AS n FROM trips GROUP BY city ORDER BY city",
                "trips", trips, "PARQUET"), mapper);

        assertEquals(List.of("city", "n"), texts(out.get("columns")));
        assertEquals(3, out.get("totalRows").asInt());
        assertEquals("Kyoto", out.get("rows").get(0).get("city").asText());
        assertEquals(8, out.get("rows").get(0).get("n").asInt());
        assertEquals(9, out.get("rows").get(1).get("n").asInt());
        assertTrue(out.get("limitApplied").asBoolean());
        assertThat(out.get("executionTimeMs").asDouble()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void returnsAtMostAThousandRowsButReportsTheTrueCount() throws Exception {
        JsonNode out = fn.apply(request("SELECT * FROM range(0, 2500) t(i)"), mapper);

        assertEquals(2500, out.get("totalRows").asInt());
        assertEquals(SqlLimits.MAX_RESULT_ROWS, out.get("rows").size());
        assertEquals(0, out.get("rows").get(0).get("i").asInt());
    }

    @Test
    void selectWithoutLimitIsCappedAtTenThousand() throws Exception {
        JsonNode capped = fn.apply(request("SELECT * FROM range(0, 20000) t(i);"), mapper);
        assertEquals(SqlLimits.AUTO_LIMIT, capped.get("totalRows").asInt());
        assertTrue(capped.get("limitApplied").asBoolean());

        JsonNode explicit = fn.apply(request("SELECT * FROM range(0, 20000) t(i) LIMIT 15000"), mapper);
        assertEquals(15000, explicit.get("totalRows").asInt());
        assertFalse(explicit.get("limitApplied").asBoolean());
    }

    @Test
    void joinsAcrossFormats() throws Exception {
        Path cities = DuckDbFixtures.csv(dir.resolve("cities.csv"),
                "SELECT * FROM (VALUES ('Oslo', 'NOR'), ('Lima', 'PER')) v(city, country)");

        JsonNode out = fn.apply(request(
                "SELECT c.country, sum(t.fare) AS total FROM trips t JOIN cities c USING (city) GROUP BY 1 ORDER BY 1",
                "trips", trips, "PARQUET", "cities", cities, "CSV"), mapper);

        assertEquals(2, out.get("totalRows").asInt());
        assertEquals("NOR", out.get("rows").get(0).get("country").asText());
        assertEquals("PER", out.get("rows").get(1).get("country").asText());
    }

    @Test
    void sqlErrorsCarryRawMessageAndAvailableColumns() {
        WorkerTaskException ex = assertThrows(WorkerTaskException.class,
                () -> fn.apply(request("SELECT nope FROM trips", "trips", trips, "PARQUET"), mapper));

        assertEquals(ErrorType.SQL, ex.errorType());
        assertThat(ex.getMessage()).startsWith("SQL execution error: ");
        assertThat(ex.details()).contains("nope");
        assertThat(texts(ex.context().get("availableColumns"))).containsExactly("id", "city", "fare", "tip");
    }

    @Test
    void unreadableDatasetIsAValidationFailure() throws Exception {
        Path bogus = Files.writeString(dir.resolve("bogus.parquet"), "not parquet at all");

        WorkerTaskException ex = assertThrows(WorkerTaskException.class,
                () -> fn.apply(request("SELECT 1", "bogus", bogus, "PARQUET"), mapper));

        assertEquals(ErrorType.VALIDATION, ex.errorType());
        assertThat(ex.getMessage()).contains("bogus");
    }

    @Test
    void nonSelectStatementsAreRejectedBeforeRunning() {
        Path target = dir.resolve("written.csv");

        WorkerTaskException ex = assertThrows(WorkerTaskException.class, () -> fn.apply(request(
                "COPY (SELECT 42 AS x) TO '" + target + "'", "trips", trips, "PARQUET"), mapper));

        assertEquals(ErrorType.SQL, ex.errorType());
        assertThat(ex.details()).startsWith("Statement type is not supported");
        assertFalse(Files.exists(target));
    }

    @Test
    void queriesCannotReadFilesOutsideTheirDatasets() throws Exception {
        Path secret = Files.writeString(dir.resolve("secret.txt"), "top-secret");
        Path other = DuckDbFixtures.parquet(dir.resolve("other.parquet"), "SELECT 'hidden' AS v");

        WorkerTaskException text = assertThrows(WorkerTaskException.class, () -> fn.apply(request(
                "SELECT content FROM read_text('" + secret + "')", "trips", trips, "PARQUET"), mapper));
        assertEquals(ErrorType.SQL, text.errorType());
        assertThat(text.getMessage()).doesNotContain("top-secret");

        WorkerTaskException parquet = assertThrows(WorkerTaskException.class, () -> fn.apply(request(
                "SELECT * FROM read_parquet('" + other + "')", "trips", trips, "PARQUET"), mapper));
        assertEquals(ErrorType.SQL, parquet.errorType());
    }

    @Test
    void statementsSmuggledAfterASelectCannotWriteFiles() {
        Path target = dir.resolve("smuggled.csv");

        assertThrows(WorkerTaskException.class, () -> fn.apply(request(
                "SELECT 1; COPY (SELECT 42 AS x) TO '" + target + "'", "trips", trips, "PARQUET"), mapper));

        assertFalse(Files.exists(target));
    }

    @Test
    void duplicateOutputColumnNamesAreRejected() {
        WorkerTaskException ex = assertThrows(WorkerTaskException.class,
                () -> fn.apply(request("SELECT id AS a, fare AS a FROM trips", "trips", trips, "PARQUET"), mapper));

        assertEquals(ErrorType.SQL, ex.errorType());
        assertEquals("Duplicate column name \"a\" in query result", ex.details());
    }

    @Test
    void missingSqlIsRejected() {
        WorkerTaskException ex = assertThrows(WorkerTaskException.class,
                () -> fn.apply(mapper.createObjectNode(), mapper));
        assertEquals(ErrorType.INTERNAL, ex.errorType());
    }
}
