package org.iceforge.quarry.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryModelsTest {

    @Test
    void tableNameDefaultsToTheFileStem() {
        assertEquals("trips", QueryModels.DatasetRef.of("https://h/data/trips.parquet").tableName());
        assertEquals("yellow_taxi", QueryModels.DatasetRef.of("https://h/Yellow-Taxi.csv.gz?sig=abc").tableName());
        assertEquals("t_2024_q1", QueryModels.DatasetRef.of("file:///tmp/2024_q1.tsv").tableName());
    }

    @Test
    void explicitTableNameWins() {
        assertEquals("rides", new QueryModels.DatasetRef("https://h/trips.parquet", "rides").effectiveTableName());
        assertEquals("trips", new QueryModels.DatasetRef("https://h/trips.parquet", " ").effectiveTableName());
    }

    @Test
    void requestExposesUrlsInDeclarationOrder() {
        QueryModels.QueryRequest req = new QueryModels.QueryRequest("SELECT 1",
                List.of(QueryModels.DatasetRef.of("https://h/b.csv"), QueryModels.DatasetRef.of("https://h/a.csv")), null, null);

        assertEquals(List.of("https://h/b.csv", "https://h/a.csv"), req.datasetUrls());
        assertTrue(new QueryModels.QueryRequest("SELECT 1", null, null, null).datasets().isEmpty());
    }
}
