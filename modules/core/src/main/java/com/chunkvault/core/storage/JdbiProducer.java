package com.chunkvault.core.storage;

import io.agroal.api.AgroalDataSource;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

/**
 * Jdbi over the pooled default datasource ({@code quarkus.datasource.*}).
 */
@ApplicationScoped
@IfBuildProperty(name = "chunkvault.storage.type", stringValue = "jdbc")
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        return configure(Jdbi.create(dataSource));
    }

    /** Plugins and logging shared by every Jdbi the engine uses. */
    public static Jdbi configure(Jdbi jdbi) {
        return jdbi
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
