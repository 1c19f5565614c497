package com.gt.studyscheduler.conf;

import com.gt.studyscheduler.store.KeyValueStore;
import com.gt.studyscheduler.store.impl.KeyValueStorePG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${studyscheduler.datasource.postgres.url}") String url,
                                    @Value("${studyscheduler.datasource.postgres.username}") String username,
                                    @Value("${studyscheduler.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public KeyValueStore getKeyValueStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate, Clock clock) {
        return new KeyValueStorePG(namedParameterJdbcTemplate, clock);
    }
}
