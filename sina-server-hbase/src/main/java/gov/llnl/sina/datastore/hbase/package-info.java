/**
 * Wide-column {@code DataStore} implementation over Apache HBase.
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.datastore.hbase;
