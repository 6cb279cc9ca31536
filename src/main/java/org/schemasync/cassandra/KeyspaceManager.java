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

import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.schemasync.cassandra.catalog.CatalogReader;
import org.schemasync.cassandra.catalog.DuplicateCreateDetector;
import org.schemasync.cassandra.connection.ManagedSession;
import org.schemasync.cassandra.cql.CqlStatementBuilder;
import org.schemasync.cassandra.model.KeyspaceSpec;

/**
 * Creates and drops keyspaces, checking the catalog first so that each operation only issues DDL when needed.
 */
public class KeyspaceManager
{
    static
    {
        Localiser.registerBundle(SchemaSyncConfiguration.LOCALISATION_BUNDLE, KeyspaceManager.class.getClassLoader());
    }

    final CatalogReader catalogReader;

    final DuplicateCreateDetector duplicateDetector;

    public KeyspaceManager(CatalogReader catalogReader, DuplicateCreateDetector duplicateDetector)
    {
        this.catalogReader = catalogReader;
        this.duplicateDetector = duplicateDetector;
    }

    /**
     * Create a keyspace with the default replication (SimpleStrategy, replication factor 3) if it doesn't exist.
     * @param session Connection to use
     * @param name Name of the keyspace
     * @return Whether the keyspace was created by this call
     */
    public boolean createKeyspace(ManagedSession session, String name)
    {
        return createKeyspace(session, new KeyspaceSpec(name));
    }

    /**
     * Create a keyspace if it doesn't exist.
     * @param session Connection to use
     * @param ksSpec Definition of the keyspace
     * @return Whether the keyspace was created by this call
     * @throws SchemaError if the CREATE fails for a reason other than the keyspace now existing
     */
    public boolean createKeyspace(ManagedSession session, KeyspaceSpec ksSpec)
    {
        if (catalogReader.getKeyspaceNames(session).contains(ksSpec.getName()))
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Keyspace.Exists", ksSpec.getName()));
            return false;
        }

        String stmt = CqlStatementBuilder.createKeyspace(ksSpec);
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Keyspace.Create", stmt));
        try
        {
            session.execute(stmt);
        }
        catch (SchemaError se)
        {
            if (!duplicateDetector.isDuplicateCreate(se))
            {
                throw se;
            }
            NucleusLogger.DATASTORE_SCHEMA.info(Localiser.msg("SchemaSync.Keyspace.CreateRace", ksSpec.getName(), se.getMessage()));
            return false;
        }
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Keyspace.Create.Success", ksSpec.getName()));
        return true;
    }

    /**
     * Drop a keyspace if it exists.
     * @param session Connection to use
     * @param name Name of the keyspace
     * @return Whether the keyspace was dropped by this call
     */
    public boolean deleteKeyspace(ManagedSession session, String name)
    {
        if (!catalogReader.getKeyspaceNames(session).contains(name))
        {
            NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Keyspace.DoesntExist", name));
            return false;
        }

        String stmt = CqlStatementBuilder.dropKeyspace(name);
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Keyspace.Drop", stmt));
        session.execute(stmt);
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.Keyspace.Drop.Success", name));
        return true;
    }
}
