package br.com.analytics.pipeline.sales_warehouse_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class DataSourceConfig {

    @Autowired
    private Environment env;

    @Primary
    @Bean(name = "warehouseDataSource")
    public DataSource warehouseDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("warehouse-pool");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.warehouse.driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty("spring.datasource.warehouse.url"));
        dataSource.setUsername(env.getProperty("spring.datasource.warehouse.username"));
        dataSource.setPassword(env.getProperty("spring.datasource.warehouse.password"));
        dataSource.setMaximumPoolSize(env.getProperty("spring.datasource.warehouse.maximum-pool-size", Integer.class, 4));
        return dataSource;
    }

    // Also drives the tasklet steps, so the whole build step shares one warehouse transaction
    @Primary
    @Bean(name = "transactionManager")
    public DataSourceTransactionManager transactionManager(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

}
