/**
 * JDBC persistence for hookbox: connection provisioning, the {@code JdbcTemplate}
 * helper and the store exception type.
 *
 * <p>DDL for H2, MySQL and PostgreSQL ships under {@code /schema/} on the classpath.
 */
package io.hookbox.jdbc;
