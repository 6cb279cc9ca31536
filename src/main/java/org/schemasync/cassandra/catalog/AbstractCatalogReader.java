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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.schemasync.cassandra.connection.ManagedSession;
import org.schemasync.cassandra.connection.RowFactory;

/**
 * Base for catalog readers, providing snapshot creation on top of the individual catalog queries.
 */
public abstract class AbstractCatalogReader implements CatalogReader
{
    @Override
    public ClusterMetadataSnapshot readSnapshot(ManagedSession session, String... keyspaces)
    {
        Set<String> keyspaceNames = getKeyspaceNames(session);
        ClusterMetadataSnapshot snapshot = new ClusterMetadataSnapshot(keyspaceNames);
        if (keyspaces != null)
        {
            for (String keyspace : keyspaces)
            {
                if (keyspaceNames.contains(keyspace))
                {
                    snapshot.addKeyspaceContents(keyspace, getTableNames(session, keyspace), getIndexNames(session, keyspace));
                }
                else
                {
                    snapshot.addKeyspaceContents(keyspace, Collections.<String>emptySet(), Collections.<String>emptySet());
                }
            }
        }
        return snapshot;
    }

    /**
     * Execute a catalog query returning a single text column.
     * @param session Connection to use
     * @param cql The query
     * @param params Any parameters for the query
     * @param columnName Name of the column to return
     * @return The values, in result order
     */
    protected Set<String> readNames(ManagedSession session, String cql, List<?> params, String columnName)
    {
        return new LinkedHashSet<>(session.execute(cql, params, RowFactory.stringColumn(columnName)));
    }
}
