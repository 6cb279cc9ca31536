/**********************************************************************
Copyright (c) 2014 Andy Jefferson and others. All rights reserved.
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.

Contributors:
    ...
 **********************************************************************/
package org.schemasync.cassandra;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;
import org.schemasync.cassandra.catalog.CatalogReader;
import org.schemasync.cassandra.catalog.ClusterMetadataSnapshot;
import org.schemasync.cassandra.catalog.DuplicateCreateDetector;
import org.schemasync.cassandra.connection.ManagedSession;
import org.schemasync.cassandra.cql.CqlStatementBuilder;
import org.schemasync.cassandra.model.ColumnSpec;
import org.schemasync.cassandra.model.TableSpec;

/**
 * Brings tables and their secondary indexes in line with their definitions. Tables and indexes are only ever
 * created when missing; existing tables are never altered.
 * <p>
 * Existence is checked against the catalog before each CREATE, and a CREATE that fails because another client
 * created the same object in the meantime is ignored. Two clients can still both pass the existence check, in which
 * case the cluster rejects the second CREATE and the {@link DuplicateCreateDetector} recognises the rejection.
 * </p>
 */
public class TableSynchronizer
{
    static
    {
        Localiser.registerBundle(SchemaSyncConfiguration.LOCALISATION_BUNDLE, TableSynchronizer.class.getClassLoader());
    }

    final KeyspaceManager keyspaceMgr;

    final CatalogReader catalogReader;

    final DuplicateCreateDetector duplicateDetector;

    public TableSynchronizer(KeyspaceManager keyspaceMgr, CatalogReader catalogReader, DuplicateCreateDetector duplicateDetector)
    {
        this.keyspaceMgr = keyspaceMgr;
        this.catalogReader = catalogReader;
        this.duplicateDetector = duplicateDetector;
    }

    /**
     * Create the table for the definition if it doesn't exist, followed by any of its secondary indexes that don't
     * exist.
     * @param session Connection to use
     * @param table Definition of the table
     * @param createMissingKeyspace Whether to create the keyspace (with default replication) if it doesn't exist
     * @return Whether the table was created by this call
     * @throws SchemaError if the definition is abstract, or a CREATE fails for a reason other than the object existing
     */
    public boolean createTable(ManagedSession session, TableSpec table, boolean createMissingKeyspace)
    {
        if (table.isAbstract())
        {
            throw new SchemaError(Localiser.msg("SchemaSync.Table.Abstract", table.getQualifiedName()));
        }

        String keyspace = table.getKeyspace();
        if (createMissingKeyspace)
        {
            keyspaceMgr.createKeyspace(session, keyspace);
        }

        boolean created = false;
        Set<String> tableNames = catalogReader.getTableNames(session, keyspace);
        if (!tableNames.contains(table.getName()))
        {
            String stmt = CqlStatementBuilder.createTable(table);
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Table.Create", stmt));
            try
            {
                session.execute(stmt);
                created = true;
                NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Table.Create.Success", table.getQualifiedName()));
            }
            catch (SchemaError se)
            {
                if (!duplicateDetector.isDuplicateCreate(se))
                {
                    throw se;
                }
                NucleusLogger.DATASTORE_SCHEMA.info(Localiser.msg("SchemaSync.Table.CreateRace", table.getQualifiedName(), se.getMessage()));
            }
        }
        else
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Table.Exists", table.getQualifiedName()));
        }

        createMissingIndexes(session, table);
        return created;
    }

    /**
     * Create any secondary index of the table that doesn't exist.
     * @param session Connection to use
     * @param table Definition of the table
     * @return Number of indexes created
     */
    protected int createMissingIndexes(ManagedSession session, TableSpec table)
    {
        List<ColumnSpec> indexedCols = table.getIndexedColumns();
        if (indexedCols.isEmpty())
        {
            return 0;
        }

        int numCreated = 0;
        Set<String> indexNames = catalogReader.getIndexNames(session, table.getKeyspace());
        for (ColumnSpec col : indexedCols)
        {
            String idxName = table.getIndexName(col);
            if (indexNames.contains(table.getQualifiedIndexName(col)))
            {
                NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Index.Exists", idxName, table.getQualifiedName()));
                continue;
            }

            String stmt = CqlStatementBuilder.createIndex(table, col);
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Index.Create", stmt));
            try
            {
                session.execute(stmt);
                numCreated++;
                NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Index.Create.Success", idxName));
            }
            catch (SchemaError se)
            {
                if (!duplicateDetector.isDuplicateCreate(se))
                {
                    throw se;
                }
                NucleusLogger.DATASTORE_SCHEMA.info(Localiser.msg("SchemaSync.Index.CreateRace", idxName, se.getMessage()));
            }
        }
        return numCreated;
    }

    /**
     * Drop the table for the definition if it exists.
     * @param session Connection to use
     * @param table Definition of the table
     * @return Whether the table was dropped by this call
     */
    public boolean deleteTable(ManagedSession session, TableSpec table)
    {
        Set<String> tableNames = catalogReader.getTableNames(session, table.getKeyspace());
        if (!tableNames.contains(table.getName()))
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Table.DoesntExist", table.getQualifiedName()));
            return false;
        }

        String stmt = CqlStatementBuilder.dropTable(table);
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Table.Drop", stmt));
        session.execute(stmt);
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Table.Drop.Success", table.getQualifiedName()));
        return true;
    }

    /**
     * Check that the keyspace, table, columns and secondary indexes of the definition all exist. Column types are
     * not compared. Each problem found is logged.
     * @param session Connection to use
     * @param table Definition of the table
     * @throws SchemaError listing the problems if any are found
     */
    public void validateTable(ManagedSession session, TableSpec table)
    {
        String keyspace = table.getKeyspace();
        String tableName = table.getQualifiedName();
        List<String> problems = new ArrayList<>();

        ClusterMetadataSnapshot snapshot = catalogReader.readSnapshot(session, keyspace);
        if (!snapshot.hasKeyspace(keyspace))
        {
            problems.add(Localiser.msg("SchemaSync.Validate.KeyspaceMissing", tableName, keyspace));
        }
        else if (!snapshot.hasTable(keyspace, table.getName()))
        {
            problems.add(Localiser.msg("SchemaSync.Validate.TableMissing", tableName));
        }
        else
        {
            Set<String> colNames = catalogReader.getColumnNames(session, keyspace, table.getName());
            for (ColumnSpec col : table.getColumns())
            {
                if (!colNames.contains(col.getName()))
                {
                    problems.add(Localiser.msg("SchemaSync.Validate.ColumnMissing", tableName, col.getName()));
                }
            }
            for (ColumnSpec col : table.getIndexedColumns())
            {
                if (!snapshot.hasIndex(keyspace, table.getQualifiedIndexName(col)))
                {
                    problems.add(Localiser.msg("SchemaSync.Validate.IndexMissing", tableName, table.getIndexName(col), col.getName()));
                }
            }
        }

        if (!problems.isEmpty())
        {
            for (String problem : problems)
            {
                NucleusLogger.DATASTORE_SCHEMA.error(problem);
            }
            throw new SchemaError(Localiser.msg("SchemaSync.Validate.Failed", tableName, problems.size(), StringUtils.collectionToString(problems)));
        }
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Validate.Success", tableName));
    }
}
