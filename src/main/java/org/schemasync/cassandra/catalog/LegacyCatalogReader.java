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

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import org.schemasync.cassandra.connection.ManagedSession;

/**
 * Catalog reader for Cassandra 1.2 and 2.x, where the schema is held in the "system" keyspace tables
 * "schema_keyspaces", "schema_columnfamilies", "schema_columns" and "IndexInfo".
 * <p>
 * Note that the partition key of "IndexInfo" is named "table_name" but holds the keyspace name, and that its
 * "index_name" values are already qualified by the table name.
 * </p>
 */
public class LegacyCatalogReader extends AbstractCatalogReader
{
    public static final String KEYSPACES_QUERY = "SELECT keyspace_name FROM system.schema_keyspaces";

    public static final String TABLES_QUERY = "SELECT columnfamily_name FROM system.schema_columnfamilies WHERE keyspace_name = ?";

    public static final String INDEXES_QUERY = "SELECT index_name FROM system.\"IndexInfo\" WHERE table_name = ?";

    public static final String COLUMNS_QUERY = "SELECT column_name FROM system.schema_columns WHERE keyspace_name = ? AND columnfamily_name = ?";

    @Override
    public Set<String> getKeyspaceNames(ManagedSession session)
    {
        return readNames(session, KEYSPACES_QUERY, null, "keyspace_name");
    }

    @Override
    public Set<String> getTableNames(ManagedSession session, String keyspace)
    {
        return readNames(session, TABLES_QUERY, Collections.singletonList(keyspace), "columnfamily_name");
    }

    @Override
    public Set<String> getIndexNames(ManagedSession session, String keyspace)
    {
        return readNames(session, INDEXES_QUERY, Collections.singletonList(keyspace), "index_name");
    }

    @Override
    public Set<String> getColumnNames(ManagedSession session, String keyspace, String table)
    {
        return readNames(session, COLUMNS_QUERY, Arrays.asList(keyspace, table), "column_name");
    }
}
