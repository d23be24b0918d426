/**
 * Query model: ranges, list criteria, criteria classification and set operations over streams
 * of record ids.
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.query;
