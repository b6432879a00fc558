package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.exception.TransformationException;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSalesLine;
import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@code yyyyMMdd} integers into dates and repairs sales amount and unit price so that
 * {@code sales = quantity * |price|}.
 *
 * <p>
 * Amount and price are repaired independently from the raw values: a missing price is derived from
 * the raw amount, and the amount is only recomputed when it is missing, not positive, or disagrees
 * with a known price. A line that has neither a usable amount nor a price keeps a null amount.
 * Arithmetic that leaves the integer range aborts the run.
 * </p>
 */
public class SalesLineRepairProcessor implements CanonicalProcessor<RawSalesLine, CanonicalSalesLine> {

    private static final int MIN_EIGHT_DIGITS = 10_000_000;
    private static final int MAX_EIGHT_DIGITS = 99_999_999;

    private final int minValidDate;
    private final int maxValidDate;

    public SalesLineRepairProcessor(int minValidDate, int maxValidDate) {
        this.minValidDate = minValidDate;
        this.maxValidDate = maxValidDate;
    }

    @Override
    public String entityName() {
        return "crm_sales_details";
    }

    @Override
    public List<CanonicalSalesLine> process(List<RawSalesLine> records) {
        List<CanonicalSalesLine> canonical = new ArrayList<>(records.size());
        for (RawSalesLine line : records) {
            canonical.add(repair(line));
        }
        return canonical;
    }

    CanonicalSalesLine repair(RawSalesLine line) {
        if (line.orderNumber() == null) {
            throw new TransformationException(entityName(),
                    "Sales line for product " + line.productKey() + " has no order number");
        }
        Integer sales;
        Integer price;
        try {
            sales = repairSales(line.sales(), line.quantity(), line.price());
            price = repairPrice(line.sales(), line.quantity(), line.price());
        } catch (ArithmeticException e) {
            throw new TransformationException(entityName(), "Sales line " + line.orderNumber() +
                    " overflows the integer range (sales=" + line.sales() + ", quantity=" + line.quantity() +
                    ", price=" + line.price() + ")", e);
        }
        return new CanonicalSalesLine(
                line.orderNumber(),
                line.productKey(),
                line.customerId(),
                toDate(line.orderDate()),
                toDate(line.shipDate()),
                toDate(line.dueDate()),
                sales,
                line.quantity(),
                price
        );
    }

    @Nullable
    LocalDate toDate(@Nullable Integer value) {
        if (value == null || value < MIN_EIGHT_DIGITS || value > MAX_EIGHT_DIGITS) {
            return null;
        }
        if (value < minValidDate || value > maxValidDate) {
            return null;
        }
        try {
            return LocalDate.of(value / 10_000, value / 100 % 100, value % 100);
        } catch (DateTimeException e) {
            // e.g. 20230231, treated like any other unusable date
            return null;
        }
    }

    // Overflow raises ArithmeticException instead of wrapping
    @Nullable
    static Integer repairSales(@Nullable Integer sales, @Nullable Integer quantity, @Nullable Integer price) {
        Integer expected = quantity == null || price == null
                ? null
                : Math.multiplyExact(quantity, Math.absExact(price));
        if (sales == null || sales <= 0 || (expected != null && !sales.equals(expected))) {
            return expected;
        }
        return sales;
    }

    @Nullable
    static Integer repairPrice(@Nullable Integer sales, @Nullable Integer quantity, @Nullable Integer price) {
        if (price == null) {
            if (sales == null || quantity == null || quantity == 0) {
                return null;
            }
            return Math.toIntExact((long) sales / quantity);
        }
        if (price <= 0) {
            return Math.absExact(price);
        }
        return price;
    }
}
