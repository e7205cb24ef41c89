package com.clinicbooking.bookingservice.config;

import com.clinicbooking.bookingservice.model.Appointment;
import com.clinicbooking.bookingservice.util.LocalDateTimeConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.orm.jpa.EntityManagerFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.orm.jpa.LocalContainerEntityManagerFactoryBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import jakarta.persistence.EntityManagerFactory;
import javax.sql.DataSource;
import java.util.HashMap;
import java.util.Map;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Single SQLite store for catalog, schedules and the booking ledger. Transactions begin
 * IMMEDIATE so writers queue on the database lock (bounded by the busy timeout) instead of
 * failing halfway through a unit of work.
 */
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(
    basePackages = "com.clinicbooking.bookingservice.repository",
    entityManagerFactoryRef = "entityManagerFactory",
    transactionManagerRef = "bookingTransactionManager"
)
public class BookingDatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(BookingDatabaseConfig.class);

    @Bean(name = "dataSource")
    @Primary
    public DataSource dataSource(@Value("${booking.datasource.url:jdbc:sqlite:data/booking.db}") String url,
                                 @Value("${booking.datasource.busy-timeout-ms:10000}") int busyTimeoutMs) {
        DatabaseDirectoryInitializer.ensureDirectoryFor(url);

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(url);
        logger.info("[BookingDatabaseConfig] Using {} (busy timeout {}ms)", url, busyTimeoutMs);
        return dataSource;
    }

    @Bean(name = "entityManagerFactory")
    @Primary
    public LocalContainerEntityManagerFactoryBean entityManagerFactory(
            EntityManagerFactoryBuilder builder,
            @Qualifier("dataSource") DataSource dataSource,
            @Value("${booking.jpa.ddl-auto:update}") String ddlAuto,
            @Value("${booking.jpa.show-sql:false}") String showSql) {
        Map<String, String> properties = new HashMap<>();
        properties.put("hibernate.dialect", "org.hibernate.community.dialect.SQLiteDialect");
        properties.put("hibernate.hbm2ddl.auto", ddlAuto);
        properties.put("hibernate.show_sql", showSql);
        properties.put("hibernate.format_sql", "true");
        properties.put("hibernate.jdbc.use_get_generated_keys", "false");

        return builder
            .dataSource(dataSource)
            .packages(Appointment.class, LocalDateTimeConverter.class)
            .persistenceUnit("booking")
            .properties(properties)
            .build();
    }

    @Bean(name = {"bookingTransactionManager", "transactionManager"})
    @Primary
    public PlatformTransactionManager bookingTransactionManager(
            @Qualifier("entityManagerFactory") EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }
}
