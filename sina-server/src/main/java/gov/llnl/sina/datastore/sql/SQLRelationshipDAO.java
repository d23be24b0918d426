package gov.llnl.sina.datastore.sql;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import gov.llnl.sina.data.Relationship;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.datastore.RelationshipDAO;

final class SQLRelationshipDAO implements RelationshipDAO {

    private static final SQLDataStore.RowMapper<Relationship> MAPPER = new SQLDataStore.RowMapper<Relationship>() {

        @Override
        public Relationship map(final ResultSet resultSet) throws SQLException {
            return new Relationship(resultSet.getString(1), resultSet.getString(2),
                    resultSet.getString(3));
        }

    };

    private final SQLDataStore store;

    SQLRelationshipDAO(final SQLDataStore store) {
        this.store = Preconditions.checkNotNull(store);
    }

    @Override
    public void insert(final Iterable<Relationship> relationships) throws IOException {
        try (Connection connection = this.store.getConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO "
                    + "relationship (subject_id, predicate, object_id) VALUES (?, ?, ?)")) {
                for (final Relationship relationship : relationships) {
                    SQLDataStore.bind(statement, ImmutableList.of(relationship.getSubject(),
                            relationship.getPredicate(), relationship.getObject()));
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (final SQLException | RuntimeException ex) {
                connection.rollback();
                throw ex;
            }
        } catch (final SQLException ex) {
            throw new IOException("Failed to insert relationships: " + ex.getMessage(), ex);
        }
    }

    @Override
    public Stream<Relationship> get(@Nullable final String subject,
            @Nullable final String predicate, @Nullable final String object) throws IOException {
        Preconditions.checkArgument(subject != null || predicate != null || object != null,
                "At least one of subject, predicate and object must be specified");
        final StringBuilder sql = new StringBuilder(
                "SELECT subject_id, predicate, object_id FROM relationship WHERE ");
        final List<String> parameters = Lists.newArrayList();
        String separator = "";
        if (subject != null) {
            sql.append("subject_id = ?");
            parameters.add(subject);
            separator = " AND ";
        }
        if (predicate != null) {
            sql.append(separator).append("predicate = ?");
            parameters.add(predicate);
            separator = " AND ";
        }
        if (object != null) {
            sql.append(separator).append("object_id = ?");
            parameters.add(object);
        }
        return this.store.query(sql.toString(), parameters, MAPPER);
    }

    @Override
    public void delete(final Relationship relationship) throws IOException {
        try (Connection connection = this.store.getConnection();
                PreparedStatement statement = connection.prepareStatement("DELETE FROM "
                        + "relationship WHERE subject_id = ? AND predicate = ? AND object_id = ?")) {
            SQLDataStore.bind(statement, ImmutableList.of(relationship.getSubject(),
                    relationship.getPredicate(), relationship.getObject()));
            statement.executeUpdate();
        } catch (final SQLException ex) {
            throw new IOException("Failed to delete " + relationship + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
