package br.com.analytics.pipeline.sales_warehouse_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesWarehouseBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(SalesWarehouseBatchApplication.class, args)
        ));
    }
}
