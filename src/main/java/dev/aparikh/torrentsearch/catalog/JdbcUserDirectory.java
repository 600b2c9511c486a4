package dev.aparikh.torrentsearch.catalog;

import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcUserDirectory implements UserDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean userExists(long userId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users WHERE id = ?", Integer.class, userId);
        return count != null && count > 0;
    }
}
