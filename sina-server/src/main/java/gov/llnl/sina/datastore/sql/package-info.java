/**
 * Relational {@code DataStore} implementation over JDBC and a HikariCP connection pool.
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.datastore.sql;
