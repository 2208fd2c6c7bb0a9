package org.iceforge.quarry.worker.functions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlLimitsTest {

    @Test
    void detectsLimitOutsideLiteralsAndComments() {
        assertTrue(SqlLimits.hasLimit("select * from t limit 5"));
        assertTrue(SqlLimits.hasLimit("SELECT * FROM t\nLIMIT 5 OFFSET 2"));
        assertFalse(SqlLimits.hasLimit("SELECT 'no limit here' FROM t"));
        assertFalse(SqlLimits.hasLimit("SELECT \"limit\" FROM t"));
        assertFalse(SqlLimits.hasLimit("SELECT * FROM t -- limit 10"));
        assertFalse(SqlLimits.hasLimit("SELECT * /* LIMIT 10 */ FROM t"));
        assertFalse(SqlLimits.hasLimit("SELECT unlimited FROM t"));
    }

    @Test
    void recognizesSelectAndWithStatements() {
        assertTrue(SqlLimits.isSelect("  select 1"));
        assertTrue(SqlLimits.isSelect("( (SELECT 1) UNION (SELECT 2) )"));
        assertTrue(SqlLimits.isSelect("WITH x AS (SELECT 1) SELECT * FROM x"));
        assertFalse(SqlLimits.isSelect("CREATE TABLE t AS SELECT 1"));
        assertFalse(SqlLimits.isSelect("INSERT INTO t VALUES (1)"));
    }

    @Test
    void skipsLeadingCommentsButNotOtherStatements() {
        assertTrue(SqlLimits.isSelect("-- top rows\nSELECT 1"));
        assertTrue(SqlLimits.isSelect("/* report */ (WITH x AS (SELECT 1) SELECT * FROM x)"));
        assertFalse(SqlLimits.isSelect("COPY (SELECT 42) TO '/tmp/out.csv'"));
        assertFalse(SqlLimits.isSelect("-- SELECT\nATTACH 'other.db'"));
        assertFalse(SqlLimits.isSelect("/* SELECT */ PRAGMA version"));
        assertFalse(SqlLimits.isSelect("SET enable_external_access = true"));
    }

    @Test
    void appendsLimitOnlyWhenMissing() {
        assertEquals("SELECT * FROM t\nLIMIT 10000", SqlLimits.applyAutoLimit("SELECT * FROM t;; ", SqlLimits.AUTO_LIMIT));
        assertEquals("SELECT * FROM t -- trailing\nLIMIT 10", SqlLimits.applyAutoLimit("SELECT * FROM t -- trailing", 10));
        assertEquals("SELECT * FROM t LIMIT 3", SqlLimits.applyAutoLimit("SELECT * FROM t LIMIT 3", 10));
        assertEquals("DESCRIBE t", SqlLimits.applyAutoLimit("DESCRIBE t", 10));
    }
}
