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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of the schema catalog : the keyspaces of the cluster, and the tables and (qualified) index
 * names of the keyspaces that were read. Never refreshed; read a new snapshot to see later changes.
 */
public class ClusterMetadataSnapshot
{
    final Set<String> keyspaceNames;

    final Map<String, Set<String>> tableNamesByKeyspace = new HashMap<>();

    final Map<String, Set<String>> indexNamesByKeyspace = new HashMap<>();

    public ClusterMetadataSnapshot(Set<String> keyspaceNames)
    {
        this.keyspaceNames = Collections.unmodifiableSet(new LinkedHashSet<>(keyspaceNames));
    }

    void addKeyspaceContents(String keyspace, Set<String> tableNames, Set<String> indexNames)
    {
        tableNamesByKeyspace.put(keyspace, Collections.unmodifiableSet(new LinkedHashSet<>(tableNames)));
        indexNamesByKeyspace.put(keyspace, Collections.unmodifiableSet(new LinkedHashSet<>(indexNames)));
    }

    public Set<String> getKeyspaceNames()
    {
        return keyspaceNames;
    }

    public boolean hasKeyspace(String keyspace)
    {
        return keyspaceNames.contains(keyspace);
    }

    /**
     * Accessor for the tables of a keyspace.
     * @param keyspace The keyspace
     * @return The table names, or null when the keyspace was not read for this snapshot
     */
    public Set<String> getTableNames(String keyspace)
    {
        return tableNamesByKeyspace.get(keyspace);
    }

    /**
     * Accessor for the qualified ("{table}.{index}") index names of a keyspace.
     * @param keyspace The keyspace
     * @return The index names, or null when the keyspace was not read for this snapshot
     */
    public Set<String> getIndexNames(String keyspace)
    {
        return indexNamesByKeyspace.get(keyspace);
    }

    public boolean hasTable(String keyspace, String table)
    {
        Set<String> tableNames = tableNamesByKeyspace.get(keyspace);
        return tableNames != null && tableNames.contains(table);
    }

    public boolean hasIndex(String keyspace, String qualifiedIndexName)
    {
        Set<String> indexNames = indexNamesByKeyspace.get(keyspace);
        return indexNames != null && indexNames.contains(qualifiedIndexName);
    }

    public String toString()
    {
        return "ClusterMetadataSnapshot[keyspaces=" + keyspaceNames + " tables=" + tableNamesByKeyspace + " indexes=" + indexNamesByKeyspace + "]";
    }
}
