/**
 * Data model: records with their data, files and curve sets, relationships, JSON documents and
 * the lazy {@link gov.llnl.sina.data.Stream} used to return query results.
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.data;
