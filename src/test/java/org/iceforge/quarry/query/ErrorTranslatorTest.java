package org.iceforge.quarry.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ErrorTranslatorTest {

    private static String friendly(String raw) {
        String out = ErrorTranslator.translate(raw);
        assertThat(out).endsWith("\n\nTechnical details: " + raw);
        return out.substring(0, out.indexOf("\n\n"));
    }

    @Test
    void unknownColumnNamesTheColumnAndListsAlternatives() {
        String raw = "Binder Error: Referenced column \"fair\" not found in FROM clause!";

        assertEquals("Column 'fair' doesn't exist in this dataset. Available columns: id, fare",
                ErrorTranslator.translate(raw, List.of("id", "fare")).split("\n\n")[0]);
        assertEquals("Column 'fair' doesn't exist in this dataset.", friendly(raw));
        assertThat(friendly("unable to find column \"x\"; valid columns: [\"a\"]")).startsWith("Column 'x'");
    }

    @Test
    void recognizesEachCategory() {
        assertThat(friendly("no ILIKE for you")).startsWith("ILIKE is not supported");
        assertThat(friendly("Binder Error: Cannot compare values of type VARCHAR and type INTEGER")).startsWith("Type mismatch");
        assertThat(friendly("Catalog Error: Table with name tripz does not exist!")).startsWith("Table not found");
        assertThat(friendly("Parser Error: syntax error at or near \"FRM\"")).startsWith("SQL syntax error");
        assertThat(friendly("Division by zero")).startsWith("Division by zero");
        assertThat(friendly("Catalog Error: Scalar Function with name lenn does not exist!")).startsWith("Function not supported");
        assertThat(friendly("Binder Error: column \"city\" must appear in the GROUP BY clause or must be part of an aggregate function."))
                .startsWith("Columns in SELECT must appear in GROUP BY");
        assertThat(friendly("Binder Error: Ambiguous reference to column name \"id\"")).startsWith("Ambiguous column reference");
        assertThat(friendly("Out of Range Error: Overflow in multiplication of INT32")).startsWith("Numeric overflow");
        assertThat(friendly("Conversion Error: Could not convert string 'abc' to INT32")).startsWith("Could not convert string");
        assertThat(friendly("executeQuery() can only be used with queries that return a ResultSet"))
                .startsWith("Only SELECT queries are supported");
        assertThat(friendly("Statement type is not supported: only SELECT and WITH queries can run"))
                .startsWith("Only SELECT queries are supported");
    }

    @Test
    void duplicateResultColumnsSuggestAliases() {
        String translated = ErrorTranslator.translate("Duplicate column name \"a\" in query result", List.of("a", "b"));

        assertThat(translated).startsWith("Duplicate column names in the result. Give each selected column a unique alias");
        assertThat(translated).endsWith("Technical details: Duplicate column name \"a\" in query result");
    }

    @Test
    void blockedFileAccessIsExplained() {
        assertThat(friendly("Permission Error: Scanning read_text files is disabled through configuration"))
                .startsWith("Queries can only read the datasets they name");
        assertThat(friendly("Permission Error: COPY TO is disabled by configuration"))
                .startsWith("Queries can only read the datasets they name");
    }

    @Test
    void firstMatchingRuleWins() {
        // mentions both a missing column and a type mismatch
        String raw = "column \"a\" not found; type mismatch";
        assertThat(friendly(raw)).startsWith("Column 'a'");
    }

    @Test
    void unrecognizedNullAndBlankInputPassThrough() {
        assertEquals("weird engine failure", ErrorTranslator.translate("weird engine failure"));
        assertNull(ErrorTranslator.translate(null));
        assertEquals("", ErrorTranslator.translate(""));
        assertEquals("  ", ErrorTranslator.translate("  ", List.of("a")));
    }
}
