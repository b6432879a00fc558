package br.com.analytics.pipeline.sales_warehouse_batch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Settings bound from the {@code warehouse} prefix of {@code application.yml}.
 *
 * <p>
 * Mapping tables start from {@link CodeMappings#defaults()}; entries configured under
 * {@code warehouse.mappings.*} are added on top of them, so a deployment only lists the codes it
 * wants to add or override.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "warehouse")
@Data
public class WarehouseProperties {

    private Ingestion ingestion = new Ingestion();
    private Transform transform = new Transform();
    private Mappings mappings = new Mappings();
    private Quality quality = new Quality();

    public CodeMappings codeMappings() {
        return new CodeMappings(
                mappings.getMaritalStatus(),
                mappings.getGender(),
                mappings.getErpGender(),
                mappings.getProductLine(),
                mappings.getCountry(),
                mappings.getNotAvailable());
    }

    @Data
    public static class Ingestion {

        // Copies the source files into the bronze tables before transforming
        private boolean enabled = true;

        // Directory holding source_crm/ and source_erp/
        private String sourcePath;

        private String fieldDelimiter = ",";

        private boolean headerRowPresent = true;

        private String encoding = StandardCharsets.UTF_8.name();
    }

    @Data
    public static class Transform {

        // Abort the run when a raw record set is empty
        private boolean requireNonEmptySources = true;

        private int minValidDateInt = 19000101;

        private int maxValidDateInt = 20500101;
    }

    @Data
    public static class Mappings {

        private String notAvailable = CodeMappings.NOT_AVAILABLE;
        private Map<String, String> maritalStatus = CodeMappings.defaultMaritalStatus();
        private Map<String, String> gender = CodeMappings.defaultGender();
        private Map<String, String> erpGender = CodeMappings.defaultErpGender();
        private Map<String, String> productLine = CodeMappings.defaultProductLine();
        private Map<String, String> country = CodeMappings.defaultCountry();
    }

    @Data
    public static class Quality {

        private boolean enabled = true;

        private boolean failOnViolation = false;
    }
}
