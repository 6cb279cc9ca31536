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
package org.schemasync.cassandra.catalog;

import java.util.Set;

import org.schemasync.cassandra.connection.ManagedSession;

/**
 * Reader of the schema catalog of a cluster. Every call queries the cluster, nothing is cached.
 * Implementations exist for the catalog tables of the different Cassandra versions.
 */
public interface CatalogReader
{
    /**
     * Accessor for the names of all keyspaces in the cluster.
     * @param session Connection to use
     * @return The keyspace names
     */
    Set<String> getKeyspaceNames(ManagedSession session);

    /**
     * Accessor for the names of the tables (column families) of a keyspace.
     * @param session Connection to use
     * @param keyspace Name of the keyspace
     * @return The table names (empty if the keyspace doesn't exist)
     */
    Set<String> getTableNames(ManagedSession session, String keyspace);

    /**
     * Accessor for the names of the secondary indexes of a keyspace, each qualified by its table name, i.e
     * "{table}.{index}".
     * @param session Connection to use
     * @param keyspace Name of the keyspace
     * @return The qualified index names
     */
    Set<String> getIndexNames(ManagedSession session, String keyspace);

    /**
     * Accessor for the names of the columns of a table.
     * @param session Connection to use
     * @param keyspace Name of the keyspace
     * @param table Name of the table
     * @return The column names (empty if the table doesn't exist)
     */
    Set<String> getColumnNames(ManagedSession session, String keyspace, String table);

    /**
     * Read a snapshot of the keyspaces of the cluster, together with the tables and indexes of the specified keyspaces.
     * @param session Connection to use
     * @param keyspaces Keyspaces to read tables and indexes for
     * @return The snapshot
     */
    ClusterMetadataSnapshot readSnapshot(ManagedSession session, String... keyspaces);
}
