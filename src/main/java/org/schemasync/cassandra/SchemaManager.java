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
import java.util.Collection;
import java.util.List;

import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;
import org.schemasync.cassandra.catalog.CatalogReader;
import org.schemasync.cassandra.catalog.CatalogVersion;
import org.schemasync.cassandra.catalog.DuplicateCreateDetector;
import org.schemasync.cassandra.connection.ConnectionFactory;
import org.schemasync.cassandra.connection.ManagedSession;
import org.schemasync.cassandra.cql.DdlScriptWriter;
import org.schemasync.cassandra.model.KeyspaceSpec;
import org.schemasync.cassandra.model.TableSpec;

import com.datastax.oss.driver.api.core.CqlSession;

/**
 * Entry point for synchronising the schema of a Cassandra cluster with keyspace and table definitions.
 * Obtains a connection for each operation and releases it once the operation is complete.
 * <p>
 * The batch operations {@link #createSchema(Collection)} and {@link #deleteSchema(Collection)} write their DDL to
 * the file named by "schemasync.ddlFilename" when set, rather than executing it.
 * </p>
 */
public class SchemaManager
{
    static
    {
        Localiser.registerBundle(SchemaSyncConfiguration.LOCALISATION_BUNDLE, SchemaManager.class.getClassLoader());
    }

    final SchemaSyncConfiguration conf;

    final ConnectionFactory connectionFactory;

    final CatalogReader catalogReader;

    final KeyspaceManager keyspaceMgr;

    final TableSynchronizer tableSynchronizer;

    /**
     * Constructor for a manager connecting to the cluster defined by the configuration.
     * @param conf The configuration
     */
    public SchemaManager(SchemaSyncConfiguration conf)
    {
        this(conf, new ConnectionFactory(conf));
    }

    /**
     * Constructor for a manager using an existing session. The session remains open after {@link #close()}.
     * @param conf The configuration
     * @param session The session
     */
    public SchemaManager(SchemaSyncConfiguration conf, CqlSession session)
    {
        this(conf, new ConnectionFactory(session));
    }

    protected SchemaManager(SchemaSyncConfiguration conf, ConnectionFactory connectionFactory)
    {
        this.conf = conf;
        this.connectionFactory = connectionFactory;

        CatalogVersion catalogVersion = conf.getCatalogVersion();
        this.catalogReader = catalogVersion.newCatalogReader();
        DuplicateCreateDetector duplicateDetector = catalogVersion.newDuplicateCreateDetector();
        this.keyspaceMgr = new KeyspaceManager(catalogReader, duplicateDetector);
        this.tableSynchronizer = new TableSynchronizer(keyspaceMgr, catalogReader, duplicateDetector);

        NucleusLogger.GENERAL.debug(Localiser.msg("SchemaSync.Manager.Start", catalogVersion.getPropertyValue(), conf.isAutoCreateKeyspace()));
    }

    public SchemaSyncConfiguration getConfiguration()
    {
        return conf;
    }

    public CatalogReader getCatalogReader()
    {
        return catalogReader;
    }

    /**
     * Create a keyspace with default replication if it doesn't exist.
     * @param name Name of the keyspace
     * @return Whether the keyspace was created
     */
    public boolean createKeyspace(String name)
    {
        return createKeyspace(new KeyspaceSpec(name));
    }

    public boolean createKeyspace(KeyspaceSpec ksSpec)
    {
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            return keyspaceMgr.createKeyspace(mconn, ksSpec);
        }
        finally
        {
            mconn.release();
        }
    }

    public boolean deleteKeyspace(String name)
    {
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            return keyspaceMgr.deleteKeyspace(mconn, name);
        }
        finally
        {
            mconn.release();
        }
    }

    /**
     * Create the table and indexes for the definition where missing, creating its keyspace when missing if
     * "schemasync.autoCreateKeyspace" is enabled.
     * @param table Definition of the table
     * @return Whether the table was created
     */
    public boolean createTable(TableSpec table)
    {
        return createTable(table, conf.isAutoCreateKeyspace());
    }

    public boolean createTable(TableSpec table, boolean createMissingKeyspace)
    {
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            return tableSynchronizer.createTable(mconn, table, createMissingKeyspace);
        }
        finally
        {
            mconn.release();
        }
    }

    public boolean deleteTable(TableSpec table)
    {
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            return tableSynchronizer.deleteTable(mconn, table);
        }
        finally
        {
            mconn.release();
        }
    }

    public void validateTable(TableSpec table)
    {
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            tableSynchronizer.validateTable(mconn, table);
        }
        finally
        {
            mconn.release();
        }
    }

    /**
     * Create the tables and indexes for the definitions where missing. Abstract definitions are skipped.
     * All definitions are processed even when some fail.
     * @param tables Definitions of the tables
     * @throws SchemaError naming the tables that failed
     */
    public void createSchema(Collection<TableSpec> tables)
    {
        processSchema(tables, true);
    }

    /**
     * Drop the tables for the definitions where they exist. Abstract definitions are skipped.
     * All definitions are processed even when some fail.
     * @param tables Definitions of the tables
     * @throws SchemaError naming the tables that failed
     */
    public void deleteSchema(Collection<TableSpec> tables)
    {
        processSchema(tables, false);
    }

    /**
     * Validate the tables for the definitions against the cluster. Abstract definitions are skipped.
     * @param tables Definitions of the tables
     * @throws SchemaError naming the tables that failed validation
     */
    public void validateSchema(Collection<TableSpec> tables)
    {
        List<String> failedTables = new ArrayList<>();
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            for (TableSpec table : tables)
            {
                if (table.isAbstract())
                {
                    continue;
                }
                try
                {
                    tableSynchronizer.validateTable(mconn, table);
                }
                catch (SchemaError se)
                {
                    failedTables.add(table.getQualifiedName());
                }
            }
        }
        finally
        {
            mconn.release();
        }

        if (!failedTables.isEmpty())
        {
            throw new SchemaError(Localiser.msg("SchemaSync.Validate.BatchFailed", StringUtils.collectionToString(failedTables)));
        }
    }

    protected void processSchema(Collection<TableSpec> tables, boolean create)
    {
        List<String> failedTables = new ArrayList<>();
        DdlScriptWriter ddlWriter = null;
        ManagedSession mconn = connectionFactory.getConnection();
        try
        {
            String ddlFilename = conf.getDdlFilename();
            if (ddlFilename != null)
            {
                ddlWriter = new DdlScriptWriter(ddlFilename);
                mconn.setDdlWriter(ddlWriter);
            }

            for (TableSpec table : tables)
            {
                if (table.isAbstract())
                {
                    // No table required here
                    continue;
                }

                try
                {
                    if (create)
                    {
                        tableSynchronizer.createTable(mconn, table, conf.isAutoCreateKeyspace());
                    }
                    else
                    {
                        tableSynchronizer.deleteTable(mconn, table);
                    }
                }
                catch (SchemaError se)
                {
                    NucleusLogger.GENERAL.error(Localiser.msg("SchemaSync.Batch.TableFailed", table.getQualifiedName()), se);
                    failedTables.add(table.getQualifiedName());
                }
            }
        }
        finally
        {
            try
            {
                if (ddlWriter != null)
                {
                    ddlWriter.close();
                }
            }
            finally
            {
                mconn.release();
            }
        }

        if (!failedTables.isEmpty())
        {
            throw new SchemaError(Localiser.msg("SchemaSync.Batch.Failed", StringUtils.collectionToString(failedTables)));
        }
    }

    /**
     * Close the manager, closing the session unless it was provided by the caller.
     */
    public void close()
    {
        connectionFactory.close();
    }
}
