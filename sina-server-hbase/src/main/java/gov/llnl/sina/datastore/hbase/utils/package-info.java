/**
 * Low-level HBase access layers: the native HBase client and an in-memory emulation.
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.datastore.hbase.utils;
