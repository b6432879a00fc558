package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.analytics.pipeline.sales_warehouse_batch.exception.TransformationException;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSalesLine;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

class SalesLineRepairProcessorTest {

    private final SalesLineRepairProcessor processor = new SalesLineRepairProcessor(19000101, 20500101);

    @Test
    void process_missingPrice_isDerivedFromSales() {
        CanonicalSalesLine line = repair(100, 2, null);

        assertEquals(50, line.price());
        assertEquals(100, line.sales());
    }

    @Test
    void process_inconsistentSales_isRecomputed() {
        CanonicalSalesLine line = repair(100, 3, 10);

        assertEquals(30, line.sales());
        assertEquals(10, line.price());
    }

    @Test
    void process_negativePrice_isMadePositiveAndSalesRecomputed() {
        CanonicalSalesLine line = repair(-40, 2, -20);

        assertEquals(40, line.sales());
        assertEquals(20, line.price());
    }

    @Test
    void process_missingSales_isComputedFromPrice() {
        CanonicalSalesLine line = repair(null, 4, 5);

        assertEquals(20, line.sales());
    }

    @Test
    void process_consistentLine_isKept() {
        CanonicalSalesLine line = repair(30, 3, 10);

        assertEquals(30, line.sales());
        assertEquals(10, line.price());
    }

    @Test
    void process_zeroQuantityWithoutPrice_leavesPriceNull() {
        CanonicalSalesLine line = repair(100, 0, null);

        assertNull(line.price());
        assertEquals(100, line.sales());
    }

    @Test
    void process_neitherSalesNorPrice_leavesBothNull() {
        CanonicalSalesLine line = repair(null, 2, null);

        assertNull(line.sales());
        assertNull(line.price());
    }

    @Test
    void toDate_validInteger_isConverted() {
        assertEquals(LocalDate.of(2010, 12, 29), processor.toDate(20101229));
    }

    @Test
    void toDate_invalidValues_becomeNull() {
        assertNull(processor.toDate(null));
        assertNull(processor.toDate(0));
        assertNull(processor.toDate(-20101229));
        assertNull(processor.toDate(5489));
        assertNull(processor.toDate(201012291));
        assertNull(processor.toDate(32154563));
        assertNull(processor.toDate(18991231));
        assertNull(processor.toDate(20231301));
        assertNull(processor.toDate(20230230));
    }

    @Test
    void toDate_rangeBounds_areInclusive() {
        assertEquals(LocalDate.of(1900, 1, 1), processor.toDate(19000101));
        assertEquals(LocalDate.of(2050, 1, 1), processor.toDate(20500101));
    }

    @Test
    void process_allDateFields_areValidatedIndependently() {
        CanonicalSalesLine line = processor.process(List.of(
                new RawSalesLine("SO1", "P", 1, 0, 20110105, 99999999, 10, 1, 10))).get(0);

        assertNull(line.orderDate());
        assertEquals(LocalDate.of(2011, 1, 5), line.shipDate());
        assertNull(line.dueDate());
    }

    @Test
    void process_missingOrderNumber_throwsTransformationException() {
        List<RawSalesLine> lines = List.of(new RawSalesLine(null, "P", 1, 20110101, 20110105, 20110110, 10, 1, 10));

        TransformationException e = assertThrows(TransformationException.class, () -> processor.process(lines));
        assertEquals("crm_sales_details", e.getEntity());
    }

    @Test
    void process_overflowingAmount_throwsTransformationException() {
        List<RawSalesLine> lines = List.of(
                new RawSalesLine("SO9", "P-1", 1, 20110101, 20110105, 20110110, null, 50_000, 50_000));

        TransformationException e = assertThrows(TransformationException.class, () -> processor.process(lines));
        assertEquals("crm_sales_details", e.getEntity());
        assertTrue(e.getCause() instanceof ArithmeticException);
    }

    @Test
    void process_minimumIntegerPrice_throwsTransformationException() {
        List<RawSalesLine> lines = List.of(
                new RawSalesLine("SO9", "P-1", 1, 20110101, 20110105, 20110110, 10, 1, Integer.MIN_VALUE));

        assertThrows(TransformationException.class, () -> processor.process(lines));
    }

    @Test
    void process_largestRepresentableAmount_isKept() {
        CanonicalSalesLine line = repair(null, 1, Integer.MAX_VALUE);

        assertEquals(Integer.MAX_VALUE, line.sales());
    }

    private CanonicalSalesLine repair(Integer sales, Integer quantity, Integer price) {
        return processor.process(List.of(
                new RawSalesLine("SO1", "P-1", 1, 20110101, 20110105, 20110110, sales, quantity, price))).get(0);
    }
}
