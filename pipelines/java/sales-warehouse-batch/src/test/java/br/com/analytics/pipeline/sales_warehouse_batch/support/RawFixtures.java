package br.com.analytics.pipeline.sales_warehouse_batch.support;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCategory;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpLocation;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSnapshot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A small but complete raw snapshot resembling the CRM/ERP extracts.
 */
public final class RawFixtures {

    private RawFixtures() {
    }

    public static RawSnapshot snapshot() {
        return new RawSnapshot(
                List.of(
                        new RawCustomer(11000, "AW00011000", " Jon", "Yang ", "M", "M", LocalDate.of(2025, 10, 6)),
                        new RawCustomer(11001, "AW00011001", "Eugene", "Huang", "S", null, LocalDate.of(2025, 10, 6)),
                        new RawCustomer(11001, "AW00011001", "Eugene", "Huang", "M", "M", LocalDate.of(2025, 1, 1)),
                        new RawCustomer(null, "SF566", null, null, null, null, null)
                ),
                List.of(
                        new RawProduct(210, "CO-RF-FR-R92B-58", "HL Road Frame - Black- 58", null, "R ",
                                LocalDateTime.of(2003, 7, 1, 0, 0), null),
                        new RawProduct(212, "AC-HE-HL-U509-R", "Sport-100 Helmet- Red", 12, "S",
                                LocalDateTime.of(2011, 7, 1, 0, 0), LocalDateTime.of(2007, 12, 28, 0, 0)),
                        new RawProduct(213, "AC-HE-HL-U509-R", "Sport-100 Helmet- Red", 14, "S",
                                LocalDateTime.of(2012, 7, 1, 0, 0), null)
                ),
                List.of(
                        new RawSalesLine("SO43697", "FR-R92B-58", 11000, 20101229, 20110105, 20110110, 3578, 1, 3578),
                        new RawSalesLine("SO43698", "HL-U509-R", 11001, 0, 20110105, 20110110, null, 2, 35),
                        new RawSalesLine("SO43699", "BK-M82S-44", 11002, 20101229, 20110105, 20110110, 100, 1, 100)
                ),
                List.of(
                        new RawErpCustomer("NASAW00011000", LocalDate.of(1971, 10, 6), "Male"),
                        new RawErpCustomer("AW00011001", LocalDate.of(1976, 5, 10), " F ")
                ),
                List.of(
                        new RawErpLocation("AW-00011000", "Australia"),
                        new RawErpLocation("AW-00011001", "US")
                ),
                List.of(
                        new RawErpCategory("CO_RF", "Components", "Road Frames", "No"),
                        new RawErpCategory("AC_HE", "Accessories", "Helmets", "Yes")
                )
        );
    }
}
