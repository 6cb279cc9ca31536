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
package org.schemasync.cassandra.cql;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.datanucleus.util.StringUtils;
import org.schemasync.cassandra.model.ClusteringOrder;
import org.schemasync.cassandra.model.ColumnSpec;
import org.schemasync.cassandra.model.KeyspaceSpec;
import org.schemasync.cassandra.model.TableSpec;

import com.datastax.oss.driver.api.core.CqlIdentifier;

/**
 * Generator of the CQL data-definition statements for keyspaces, tables and indexes.
 * <p>
 * Identifiers (keyspace, table, column and index names) are passed through {@link CqlIdentifier}, so are only left
 * unquoted when they are valid lowercase unquoted identifiers that are not reserved words. The indexed column of a
 * CREATE INDEX is always quoted. String literals have any single quote doubled. Column types and table options are
 * taken as declared.
 * </p>
 */
public final class CqlStatementBuilder
{
    private CqlStatementBuilder()
    {
    }

    /**
     * Generate "CREATE KEYSPACE {name} WITH REPLICATION = {map}", adding " AND DURABLE_WRITES = {flag}" when the
     * strategy is not SimpleStrategy.
     * @param ksSpec The keyspace
     * @return The statement
     */
    public static String createKeyspace(KeyspaceSpec ksSpec)
    {
        StringBuilder stmtBuilder = new StringBuilder("CREATE KEYSPACE ");
        stmtBuilder.append(identifier(ksSpec.getName()));
        stmtBuilder.append(" WITH REPLICATION = ").append(mapLiteral(ksSpec.getReplicationMap()));
        if (!ksSpec.isDefaultStrategy())
        {
            stmtBuilder.append(" AND DURABLE_WRITES = ").append(ksSpec.isDurableWrites() ? "true" : "false");
        }
        return stmtBuilder.toString();
    }

    public static String dropKeyspace(String keyspaceName)
    {
        return "DROP KEYSPACE " + identifier(keyspaceName);
    }

    /**
     * Generate the CREATE TABLE statement for a table, of the form
     * <pre>
     * CREATE TABLE ks.tbl (col1 type1, col2 type2, ..., PRIMARY KEY ((pk1, pk2), ck1, ck2)) WITH read_repair_chance = 0.1
     * </pre>
     * with "clustering order by (...)" added to the WITH clause when any clustering key is descending, followed by
     * any table options.
     * @param table The table
     * @return The statement
     */
    public static String createTable(TableSpec table)
    {
        StringBuilder stmtBuilder = new StringBuilder("CREATE TABLE ");
        stmtBuilder.append(tableName(table));
        stmtBuilder.append(" (");

        for (ColumnSpec col : table.getColumns())
        {
            stmtBuilder.append(identifier(col.getName())).append(' ').append(col.getTypeName()).append(", ");
        }

        stmtBuilder.append("PRIMARY KEY ((");
        appendColumnNames(stmtBuilder, table.getPartitionKeyColumns());
        stmtBuilder.append(")");
        List<ColumnSpec> clusteringCols = table.getClusteringKeyColumns();
        if (!clusteringCols.isEmpty())
        {
            stmtBuilder.append(", ");
            appendColumnNames(stmtBuilder, clusteringCols);
        }
        stmtBuilder.append("))");

        List<String> withClauses = new ArrayList<>();
        if (table.getReadRepairChance() != null)
        {
            withClauses.add("read_repair_chance = " + table.getReadRepairChance());
        }
        String clusteringOrder = clusteringOrderClause(clusteringCols);
        if (clusteringOrder != null)
        {
            withClauses.add(clusteringOrder);
        }
        withClauses.addAll(table.getOptions());
        if (!withClauses.isEmpty())
        {
            stmtBuilder.append(" WITH ");
            for (int i = 0; i < withClauses.size(); i++)
            {
                if (i > 0)
                {
                    stmtBuilder.append(" AND ");
                }
                stmtBuilder.append(withClauses.get(i));
            }
        }

        return stmtBuilder.toString();
    }

    public static String dropTable(TableSpec table)
    {
        return "DROP TABLE " + tableName(table);
    }

    /**
     * Generate "CREATE INDEX index_{table}_{column} ON ks.tbl ("{column}")", adding a USING clause for a custom
     * index class.
     * @param table The table
     * @param col The indexed column
     * @return The statement
     */
    public static String createIndex(TableSpec table, ColumnSpec col)
    {
        StringBuilder stmtBuilder = new StringBuilder("CREATE INDEX ");
        stmtBuilder.append(identifier(table.getIndexName(col)));
        stmtBuilder.append(" ON ").append(tableName(table));
        stmtBuilder.append(" (").append(CqlIdentifier.fromInternal(col.getName()).asCql(false)).append(")");
        if (!StringUtils.isWhitespace(col.getIndexClass()))
        {
            stmtBuilder.append(" USING ").append(literal(col.getIndexClass()));
        }
        return stmtBuilder.toString();
    }

    public static String tableName(TableSpec table)
    {
        return identifier(table.getKeyspace()) + "." + identifier(table.getName());
    }

    public static String identifier(String name)
    {
        return CqlIdentifier.fromInternal(name).asCql(true);
    }

    /**
     * Convert a value into a CQL literal. Numbers and booleans are emitted as is, anything else as a quoted string.
     * @param value The value
     * @return The literal
     */
    public static String literal(Object value)
    {
        if (value instanceof Number || value instanceof Boolean)
        {
            return value.toString();
        }
        return "'" + String.valueOf(value).replace("'", "''") + "'";
    }

    /**
     * Convert a map into a CQL map literal, e.g "{'class': 'SimpleStrategy', 'replication_factor': 3}".
     * @param map The map
     * @return The literal
     */
    public static String mapLiteral(Map<String, ?> map)
    {
        StringBuilder str = new StringBuilder("{");
        Iterator<? extends Map.Entry<String, ?>> entryIter = map.entrySet().iterator();
        while (entryIter.hasNext())
        {
            Map.Entry<String, ?> entry = entryIter.next();
            str.append(literal(entry.getKey())).append(": ").append(literal(entry.getValue()));
            if (entryIter.hasNext())
            {
                str.append(", ");
            }
        }
        return str.append("}").toString();
    }

    private static String clusteringOrderClause(List<ColumnSpec> clusteringCols)
    {
        boolean descending = false;
        for (ColumnSpec col : clusteringCols)
        {
            if (col.getClusteringOrder() == ClusteringOrder.DESC)
            {
                descending = true;
            }
        }
        if (!descending)
        {
            return null;
        }

        StringBuilder str = new StringBuilder("clustering order by (");
        Iterator<ColumnSpec> colIter = clusteringCols.iterator();
        while (colIter.hasNext())
        {
            ColumnSpec col = colIter.next();
            str.append(identifier(col.getName())).append(' ');
            str.append(col.getClusteringOrder() != null ? col.getClusteringOrder().name() : ClusteringOrder.ASC.name());
            if (colIter.hasNext())
            {
                str.append(", ");
            }
        }
        return str.append(")").toString();
    }

    private static void appendColumnNames(StringBuilder stmtBuilder, List<ColumnSpec> cols)
    {
        Iterator<ColumnSpec> colIter = cols.iterator();
        while (colIter.hasNext())
        {
            stmtBuilder.append(identifier(colIter.next().getName()));
            if (colIter.hasNext())
            {
                stmtBuilder.append(", ");
            }
        }
    }
}
