package com.di.epistream.registry;

import com.di.epistream.model.Country;
import com.di.epistream.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of {@link CountryStore} over the {@code countries} and
 * {@code country_aliases} tables.
 */
@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "jdbc")
public class JdbcCountryStore implements CountryStore {

    private static final RowMapper<Country> COUNTRY_ROW_MAPPER = (rs, rowNum) -> Country.builder()
            .countryCode(rs.getString("country_code"))
            .name(rs.getString("name"))
            .continent(rs.getString("continent"))
            .population(rs.getObject("population", Long.class))
            .alpha2(rs.getString("alpha2"))
            .build();

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final Clock clock;

    public JdbcCountryStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.clock = clock;
    }

    @Override
    public void upsertCountries(List<Country> countries) {
        if (countries.isEmpty()) return;
        jdbc.batchUpdate(sql.getCountries().getUpsert(), countries.stream()
                .map(c -> new Object[]{c.getCountryCode(), c.getName(), c.getContinent(), c.getPopulation(), c.getAlpha2()})
                .toList());
    }

    @Override
    public List<Country> findAllCountries() {
        return jdbc.query(sql.getCountries().getFindAll(), COUNTRY_ROW_MAPPER);
    }

    @Override
    public Map<String, String> findAliases() {
        Map<String, String> aliases = new HashMap<>();
        jdbc.query(sql.getCountries().getFindAliases(),
                rs -> {
                    aliases.put(rs.getString("alias"), rs.getString("country_code"));
                });
        return aliases;
    }

    @Override
    public boolean appendAlias(String normalizedAlias, String countryCode) {
        // insert ... on conflict do nothing
        return jdbc.update(sql.getCountries().getInsertAlias(),
                normalizedAlias, countryCode, Timestamp.from(clock.instant())) > 0;
    }
}
