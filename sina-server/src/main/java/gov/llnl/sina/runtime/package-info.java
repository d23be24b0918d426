/**
 * Runtime support: component lifecycle, {@code DataStore} instantiation from configuration
 * properties, and bulk import / export of records.
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.runtime;
