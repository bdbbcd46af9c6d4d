/**
 * JDBC persistence for the campaign engine.
 *
 * <p>{@link io.campaign.jdbc.JdbcCampaignStores} assembles every store for a DataSource. DDL
 * for H2, MySQL and PostgreSQL ships as {@code schema/h2.sql}, {@code schema/mysql.sql} and
 * {@code schema/postgresql.sql} on the classpath.
 */
package io.campaign.jdbc;
