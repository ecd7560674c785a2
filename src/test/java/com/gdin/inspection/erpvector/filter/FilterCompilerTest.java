package com.gdin.inspection.erpvector.filter;

import com.gdin.inspection.erpvector.support.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FilterCompilerTest {
    private static final String MODEL = "account.move.line";

    private final FilterCompiler compiler = new FilterCompiler(TestSchemas.catalog(),
            List.of("account_id_id", "date", "tax_ids"));

    @Test
    void indexedConditionsArePushedDown() {
        CompiledFilter compiled = compiler.compile(MODEL, List.of(
                FilterCondition.of("account_id_id", FilterOperator.EQ, 5),
                FilterCondition.of("date", FilterOperator.GTE, "2024-01-01")));

        List<FilterClause> clauses = compiled.getNativeFilter().getClauses();
        assertEquals(3, clauses.size());
        assertEquals("model_name", clauses.get(0).getField());
        assertEquals(MODEL, clauses.get(0).getValue());
        assertEquals("account_id_id", clauses.get(1).getField());
        assertEquals("date", clauses.get(2).getField());
        assertFalse(compiled.hasResidual());
    }

    @Test
    void emptyConditionsOnlyPinTheModel() {
        CompiledFilter compiled = compiler.compile(MODEL, List.of());
        assertEquals(1, compiled.getNativeFilter().getClauses().size());
        assertTrue(compiled.getNativeFilter().hasClauseOn("model_name"));
        assertTrue(compiled.getResidual().isEmpty());
    }

    @Test
    void unindexedFieldsBecomeResidual() {
        CompiledFilter compiled = compiler.compile(MODEL, List.of(
                FilterCondition.of("debit", FilterOperator.GT, 100),
                FilterCondition.of("partner_id_name", FilterOperator.CONTAINS, "Acme")));
        assertEquals(1, compiled.getNativeFilter().getClauses().size());
        assertEquals(2, compiled.getResidual().size());
        ResidualPredicate debit = compiled.getResidual().get(0);
        assertTrue(debit.test(Map.of("debit", 150.0)));
        assertFalse(debit.test(Map.of("debit", 50)));
        assertFalse(debit.test(Map.of()));
    }

    @Test
    void containsStaysResidualOnIndexedFields() {
        CompiledFilter compiled = compiler.compile(MODEL, List.of(
                FilterCondition.of("vector_text", FilterOperator.CONTAINS, "acme")));
        assertEquals(1, compiled.getNativeFilter().getClauses().size());
        assertEquals(1, compiled.getResidual().size());
        ResidualPredicate text = compiled.getResidual().get(0);
        assertTrue(text.test(Map.of("vector_text", "Invoice ACME Corp")));
        assertFalse(text.test(Map.of("vector_text", "Invoice Globex")));
    }

    @Test
    void inRequiresAnArray() {
        List<ValidationError> errors = compiler.validateFilters(MODEL, List.of(
                FilterCondition.of("account_id_id", FilterOperator.IN, 5)));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getMessage().contains("array"));

        CompiledFilter compiled = compiler.compile(MODEL, List.of(
                FilterCondition.of("tax_ids", FilterOperator.IN, List.of(1, 2, 3))));
        FilterClause clause = compiled.getNativeFilter().getClauses().get(1);
        assertEquals("tax_ids", clause.getField());
        assertEquals(FilterOperator.IN, clause.getOp());
    }

    @Test
    void vectorTextOnlyAllowsContains() {
        List<ValidationError> errors = compiler.validateFilters(MODEL, List.of(
                FilterCondition.of("vector_text", FilterOperator.GT, "a")));
        assertEquals(1, errors.size());
        assertEquals("gt", errors.get(0).getOp());
        assertTrue(errors.get(0).getMessage().contains("'gt'"));
        assertTrue(errors.get(0).getMessage().contains("contains"));
    }

    @Test
    void unknownFieldCarriesSuggestions() {
        FilterValidationException e = assertThrows(FilterValidationException.class, () -> compiler.compile(MODEL,
                List.of(FilterCondition.of("debitt", FilterOperator.GT, 1))));
        ValidationError error = e.getErrors().get(0);
        assertEquals("debitt", error.getField());
        assertEquals("debit", error.getSuggestion());
    }

    @Test
    void everyInvalidConditionIsReported() {
        List<ValidationError> errors = compiler.validateFilters(MODEL, List.of(
                FilterCondition.of("nope", FilterOperator.EQ, 1),
                FilterCondition.of("name", null, "x"),
                FilterCondition.of("name", FilterOperator.CONTAINS, 3),
                FilterCondition.of("name", FilterOperator.EQ, "ok")));
        assertEquals(3, errors.size());
    }

    @Test
    void unknownModelIsRejected() {
        List<ValidationError> errors = compiler.validateFilters("account.mov.line", List.of());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getSuggestion().contains(MODEL));
    }
}
