package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.exception.TransformationException;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalProduct;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

class ProductHistoryProcessorTest {

    private final ProductHistoryProcessor processor = new ProductHistoryProcessor(CodeMappings.defaults());

    @Test
    void process_productKey_isSplitIntoCategoryAndKey() {
        CanonicalProduct product = processor.process(List.of(
                product(1, "AB-CO-1234", 10, "M", 2020, 1, 1))).get(0);

        assertEquals("AB_CO", product.categoryId());
        assertEquals("1234", product.productKey());
    }

    @Test
    void process_shortKey_yieldsEmptyProductKey() {
        CanonicalProduct product = processor.process(List.of(
                product(1, "AB-C", 10, "M", 2020, 1, 1))).get(0);

        assertEquals("AB_C", product.categoryId());
        assertEquals("", product.productKey());
    }

    @Test
    void process_twoVersions_endDateIsDayBeforeNextStart() {
        List<CanonicalProduct> result = processor.process(List.of(
                product(2, "AB-CO-X", 10, "R", 2021, 1, 1),
                product(1, "AB-CO-X", 10, "R", 2020, 1, 1)));

        result = result.stream().sorted(Comparator.comparing(CanonicalProduct::startDate)).toList();
        assertEquals(LocalDate.of(2020, 12, 31), result.get(0).endDate());
        assertNull(result.get(1).endDate());
    }

    @Test
    void process_chainsArePartitionedByCleanedKey() {
        List<CanonicalProduct> result = processor.process(List.of(
                product(1, "AB-CO-X", 10, "R", 2020, 1, 1),
                product(2, "AB-CO-Y", 10, "R", 2021, 1, 1)));

        assertNull(result.get(0).endDate());
        assertNull(result.get(1).endDate());
    }

    @Test
    void process_rawEndDate_isIgnored() {
        RawProduct raw = new RawProduct(1, "AB-CO-X", "Name", 5, "T",
                LocalDateTime.of(2011, 7, 1, 0, 0), LocalDateTime.of(2007, 12, 28, 0, 0));

        CanonicalProduct product = processor.process(List.of(raw)).get(0);

        assertNull(product.endDate());
        assertEquals(LocalDate.of(2011, 7, 1), product.startDate());
        assertEquals("Touring", product.productLine());
    }

    @Test
    void process_nullCost_becomesZeroAndNegativePassesThrough() {
        List<CanonicalProduct> result = processor.process(List.of(
                product(1, "AB-CO-X", null, "S", 2020, 1, 1),
                product(2, "AB-CO-Y", -3, " s ", 2020, 1, 1)));

        assertEquals(0, result.get(0).cost());
        assertEquals(-3, result.get(1).cost());
        assertEquals("Other Sales", result.get(1).productLine());
    }

    @Test
    void process_unknownLine_isNotAvailable() {
        CanonicalProduct product = processor.process(List.of(
                product(1, "AB-CO-X", 1, null, 2020, 1, 1))).get(0);

        assertEquals("N/A", product.productLine());
    }

    @Test
    void process_undatedVersions_sortFirstAndStayOpenWhenSuccessorIsUndated() {
        List<CanonicalProduct> result = processor.process(List.of(
                new RawProduct(1, "AB-CO-X", "Product 1", 10, "R", null, null),
                new RawProduct(2, "AB-CO-X", "Product 2", 10, "R", null, null),
                product(3, "AB-CO-X", 10, "R", 2020, 1, 1)));

        assertEquals(List.of(1, 2, 3), result.stream().map(CanonicalProduct::productId).toList());
        assertNull(result.get(0).endDate());
        assertEquals(LocalDate.of(2019, 12, 31), result.get(1).endDate());
        assertNull(result.get(2).endDate());
        assertEquals(2, result.stream().filter(CanonicalProduct::isActive).count());
    }

    @Test
    void process_missingProductKey_throwsTransformationException() {
        TransformationException e = assertThrows(TransformationException.class,
                () -> processor.process(List.of(product(7, null, 1, "M", 2020, 1, 1))));

        assertEquals("crm_prd_info", e.getEntity());
    }

    private static RawProduct product(int id, String key, Integer cost, String line, int year, int month, int day) {
        return new RawProduct(id, key, "Product " + id, cost, line, LocalDateTime.of(year, month, day, 0, 0), null);
    }
}
