/**
 * {@code DataStore} server-side component API ({@code sina-server}).
 * <p>
 * This package defines the storage API used to ingest and query records, namely:
 * </p>
 * <ul>
 * <li>the {@code DataStore} API ({@link gov.llnl.sina.datastore.DataStore},
 * {@link gov.llnl.sina.datastore.RecordDAO}, {@link gov.llnl.sina.datastore.RelationshipDAO})
 * and its checked exceptions;</li>
 * <li>the backend-independent query executor
 * {@link gov.llnl.sina.datastore.AbstractRecordDAO}, which evaluates data queries on top of
 * two primitives implemented by each backend;</li>
 * <li>abstract forwarding classes for implementing the decorator pattern, and the
 * {@link gov.llnl.sina.datastore.LoggingDataStore} decorator.</li>
 * </ul>
 */
@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.datastore;
