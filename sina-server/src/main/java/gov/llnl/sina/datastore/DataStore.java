package gov.llnl.sina.datastore;

import java.io.IOException;

import gov.llnl.sina.runtime.Component;
import gov.llnl.sina.runtime.DataCorruptedException;

/**
 * A persistent storage component for records and relationships.
 * <p>
 * A {@code DataStore} owns the single connection handle (a JDBC pool or an HBase connection)
 * shared by all the DAOs it produces; the handle is opened by {@link #init()} and released by
 * {@link #close()}, following the general contract of {@link Component}. A {@code DataStore}
 * and its DAOs must be thread safe; result {@code Stream}s are not required to be.
 * </p>
 */
public interface DataStore extends Component {

    /**
     * Returns the DAO for accessing records and their data.
     *
     * @return the record DAO
     * @throws IllegalStateException
     *             if the {@code DataStore} has not been initialized or has been closed
     */
    RecordDAO getRecordDAO() throws IllegalStateException;

    /**
     * Returns the DAO for accessing relationships among records.
     *
     * @return the relationship DAO
     * @throws IllegalStateException
     *             if the {@code DataStore} has not been initialized or has been closed
     */
    RelationshipDAO getRelationshipDAO() throws IllegalStateException;

    /**
     * Returns true if independent documents can be ingested concurrently by multiple threads.
     */
    boolean supportsParallelIngestion();

    @Override
    void init() throws DataCorruptedException, IOException, IllegalStateException;

}
