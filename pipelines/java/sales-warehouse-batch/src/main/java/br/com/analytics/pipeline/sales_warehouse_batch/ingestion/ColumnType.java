package br.com.analytics.pipeline.sales_warehouse_batch.ingestion;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;

public enum ColumnType {

    TEXT {
        @Override
        Object convert(String value) {
            return value;
        }
    },
    INTEGER {
        @Override
        Object convert(String value) {
            return Integer.valueOf(value.trim());
        }
    },
    DATE {
        @Override
        Object convert(String value) {
            return LocalDate.parse(value.trim());
        }
    },
    DATETIME {
        @Override
        Object convert(String value) {
            String trimmed = value.trim();
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            return LocalDateTime.parse(trimmed.replace(' ', 'T'));
        }
    };

    abstract Object convert(String value);

    @Nullable
    public Object parse(@Nullable String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return convert(value);
    }
}
