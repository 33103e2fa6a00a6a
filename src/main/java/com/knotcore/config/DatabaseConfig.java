package com.knotcore.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL connection.
 * The connection factory itself comes from Spring Boot auto-configuration.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Initialize database schema on startup.
     * Executes schema.sql when {@code knot.database.initialize-schema} is true; the script is idempotent.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(
            ConnectionFactory connectionFactory,
            @Value("${knot.database.initialize-schema:false}") boolean initializeSchema) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        if (initializeSchema) {
            populator.addScript(new ClassPathResource("schema.sql"));
        }
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initializeSchema);

        return initializer;
    }
}
