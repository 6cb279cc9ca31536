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

import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.schemasync.cassandra.catalog.LegacyCatalogReader;
import org.schemasync.cassandra.catalog.SystemSchemaCatalogReader;
import org.schemasync.cassandra.connection.ConnectionFactory;
import org.schemasync.cassandra.connection.ManagedSession;

import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.datastax.oss.driver.api.core.metadata.Node;
import com.datastax.oss.driver.api.core.servererrors.AlreadyExistsException;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;

/**
 * In-memory stand-in for a Cassandra cluster, backing a mocked CqlSession. Answers the catalog queries of both
 * catalog layouts from its keyspaces, tables and indexes, and applies the DDL statements executed against it.
 * Creating an existing object fails the way the cluster reports it, either as an invalid query (legacy clusters) or
 * as AlreadyExistsException.
 */
public class FakeCluster
{
    private static final Pattern CREATE_KEYSPACE = Pattern.compile("CREATE KEYSPACE (\\S+) WITH .*");

    private static final Pattern DROP_KEYSPACE = Pattern.compile("DROP KEYSPACE (\\S+)");

    private static final Pattern CREATE_TABLE = Pattern.compile("CREATE TABLE ([^ .]+)\\.([^ (]+) \\((.*), PRIMARY KEY .*");

    private static final Pattern DROP_TABLE = Pattern.compile("DROP TABLE ([^ .]+)\\.(\\S+)");

    private static final Pattern CREATE_INDEX = Pattern.compile("CREATE INDEX (\\S+) ON ([^ .]+)\\.(\\S+) .*");

    /** Separator of column definitions, ignoring commas inside a collection type. */
    private static final Pattern COLUMN_SEPARATOR = Pattern.compile(",\\s*(?![^<]*>)");

    final boolean legacy;

    final CqlSession session;

    final Node coordinator;

    /** Columns of each table, keyed by keyspace then table. */
    final Map<String, Map<String, List<String>>> keyspaces = new LinkedHashMap<>();

    /** Qualified ("{table}.{index}") index names, keyed by keyspace. */
    final Map<String, Set<String>> indexes = new HashMap<>();

    final List<String> executedDdl = new ArrayList<>();

    final List<String> catalogQueries = new ArrayList<>();

    final Map<String, RuntimeException> failures = new HashMap<>();

    final Set<String> concurrentCreates = new LinkedHashSet<>();

    public FakeCluster(boolean legacy)
    {
        this.legacy = legacy;
        this.coordinator = mock(Node.class);
        this.session = mock(CqlSession.class);
        when(session.execute(any(Statement.class))).thenAnswer(new Answer<ResultSet>()
        {
            @Override
            public ResultSet answer(InvocationOnMock invocation) throws Throwable
            {
                SimpleStatement stmt = (SimpleStatement)invocation.getArguments()[0];
                return execute(stmt.getQuery(), stmt.getPositionalValues());
            }
        });
    }

    public CqlSession getSession()
    {
        return session;
    }

    /**
     * Obtain a connection for the session of this cluster.
     * @return The connection
     */
    public ManagedSession newConnection()
    {
        return new ConnectionFactory(session).getConnection();
    }

    public FakeCluster addKeyspace(String keyspace)
    {
        if (!keyspaces.containsKey(keyspace))
        {
            keyspaces.put(keyspace, new LinkedHashMap<String, List<String>>());
            indexes.put(keyspace, new LinkedHashSet<String>());
        }
        return this;
    }

    public FakeCluster addTable(String keyspace, String table, String... columns)
    {
        addKeyspace(keyspace);
        keyspaces.get(keyspace).put(table, new ArrayList<>(Arrays.asList(columns)));
        return this;
    }

    public FakeCluster addIndex(String keyspace, String table, String index)
    {
        addKeyspace(keyspace);
        indexes.get(keyspace).add(table + "." + index);
        return this;
    }

    /**
     * Fail the next statement starting with the specified text with the specified error.
     * @param stmtPrefix Start of the statement
     * @param error The error
     */
    public void failOn(String stmtPrefix, RuntimeException error)
    {
        failures.put(stmtPrefix, error);
    }

    /**
     * Have another client create the object of the next statement starting with the specified text just before
     * that statement reaches the cluster.
     * @param stmtPrefix Start of the statement
     */
    public void createConcurrentlyOn(String stmtPrefix)
    {
        concurrentCreates.add(stmtPrefix);
    }

    public boolean hasKeyspace(String keyspace)
    {
        return keyspaces.containsKey(keyspace);
    }

    public boolean hasTable(String keyspace, String table)
    {
        return keyspaces.containsKey(keyspace) && keyspaces.get(keyspace).containsKey(table);
    }

    public boolean hasIndex(String keyspace, String table, String index)
    {
        return indexes.containsKey(keyspace) && indexes.get(keyspace).contains(table + "." + index);
    }

    public List<String> getColumns(String keyspace, String table)
    {
        return hasTable(keyspace, table) ? keyspaces.get(keyspace).get(table) : null;
    }

    /**
     * Accessor for the DDL statements that were applied, in order (excluding any that failed).
     * @return The statements
     */
    public List<String> getExecutedDdl()
    {
        return executedDdl;
    }

    public List<String> getCatalogQueries()
    {
        return catalogQueries;
    }

    /**
     * Accessor for the applied DDL statements starting with the specified text.
     * @param stmtPrefix Start of the statement
     * @return The statements
     */
    public List<String> getExecutedDdl(String stmtPrefix)
    {
        List<String> stmts = new ArrayList<>();
        for (String stmt : executedDdl)
        {
            if (stmt.startsWith(stmtPrefix))
            {
                stmts.add(stmt);
            }
        }
        return stmts;
    }

    ResultSet execute(String cql, List<Object> values)
    {
        if (cql.startsWith("SELECT "))
        {
            catalogQueries.add(cql);
            return resultSet(query(cql, values));
        }

        for (Map.Entry<String, RuntimeException> failure : new ArrayList<>(failures.entrySet()))
        {
            if (cql.startsWith(failure.getKey()))
            {
                failures.remove(failure.getKey());
                throw failure.getValue();
            }
        }
        for (String prefix : new ArrayList<>(concurrentCreates))
        {
            if (cql.startsWith(prefix))
            {
                concurrentCreates.remove(prefix);
                apply(cql);
            }
        }

        apply(cql);
        executedDdl.add(cql);
        return resultSet(Collections.<Map<String, String>>emptyList());
    }

    private List<Map<String, String>> query(String cql, List<Object> values)
    {
        List<Map<String, String>> rows = new ArrayList<>();
        if (cql.equals(LegacyCatalogReader.KEYSPACES_QUERY) || cql.equals(SystemSchemaCatalogReader.KEYSPACES_QUERY))
        {
            assertLayout(cql.equals(LegacyCatalogReader.KEYSPACES_QUERY), cql);
            for (String keyspace : keyspaces.keySet())
            {
                rows.add(Collections.singletonMap("keyspace_name", keyspace));
            }
        }
        else if (cql.equals(LegacyCatalogReader.TABLES_QUERY) || cql.equals(SystemSchemaCatalogReader.TABLES_QUERY))
        {
            assertLayout(cql.equals(LegacyCatalogReader.TABLES_QUERY), cql);
            String colName = legacy ? "columnfamily_name" : "table_name";
            Map<String, List<String>> tables = keyspaces.get((String)values.get(0));
            if (tables != null)
            {
                for (String table : tables.keySet())
                {
                    rows.add(Collections.singletonMap(colName, table));
                }
            }
        }
        else if (cql.equals(LegacyCatalogReader.INDEXES_QUERY) || cql.equals(SystemSchemaCatalogReader.INDEXES_QUERY))
        {
            assertLayout(cql.equals(LegacyCatalogReader.INDEXES_QUERY), cql);
            Set<String> idxNames = indexes.get((String)values.get(0));
            if (idxNames != null)
            {
                for (String qualifiedName : idxNames)
                {
                    if (legacy)
                    {
                        rows.add(Collections.singletonMap("index_name", qualifiedName));
                    }
                    else
                    {
                        int sep = qualifiedName.indexOf('.');
                        Map<String, String> row = new HashMap<>();
                        row.put("table_name", qualifiedName.substring(0, sep));
                        row.put("index_name", qualifiedName.substring(sep + 1));
                        rows.add(row);
                    }
                }
            }
        }
        else if (cql.equals(LegacyCatalogReader.COLUMNS_QUERY) || cql.equals(SystemSchemaCatalogReader.COLUMNS_QUERY))
        {
            assertLayout(cql.equals(LegacyCatalogReader.COLUMNS_QUERY), cql);
            List<String> columns = getColumns((String)values.get(0), (String)values.get(1));
            if (columns != null)
            {
                for (String column : columns)
                {
                    rows.add(Collections.singletonMap("column_name", column));
                }
            }
        }
        else
        {
            throw new InvalidQueryException(coordinator, "Unsupported query " + cql);
        }
        return rows;
    }

    private void assertLayout(boolean legacyQuery, String cql)
    {
        if (legacyQuery != legacy)
        {
            throw new InvalidQueryException(coordinator, "unconfigured table for query " + cql);
        }
    }

    private void apply(String cql)
    {
        Matcher m = CREATE_KEYSPACE.matcher(cql);
        if (m.matches())
        {
            String keyspace = unquote(m.group(1));
            if (hasKeyspace(keyspace))
            {
                throw legacy ? new InvalidQueryException(coordinator, "Cannot add existing keyspace \"" + keyspace + "\"") :
                    new AlreadyExistsException(coordinator, keyspace, "");
            }
            addKeyspace(keyspace);
            return;
        }

        m = DROP_KEYSPACE.matcher(cql);
        if (m.matches())
        {
            String keyspace = unquote(m.group(1));
            assertKeyspace(keyspace);
            keyspaces.remove(keyspace);
            indexes.remove(keyspace);
            return;
        }

        m = CREATE_TABLE.matcher(cql);
        if (m.matches())
        {
            String keyspace = unquote(m.group(1));
            String table = unquote(m.group(2));
            assertKeyspace(keyspace);
            if (hasTable(keyspace, table))
            {
                throw legacy ? new InvalidQueryException(coordinator, "Cannot add already existing column family \"" + table + "\" to keyspace \"" + keyspace + "\"") :
                    new AlreadyExistsException(coordinator, keyspace, table);
            }
            List<String> columns = new ArrayList<>();
            for (String colDefn : COLUMN_SEPARATOR.split(m.group(3)))
            {
                columns.add(unquote(colDefn.trim().split(" ")[0]));
            }
            keyspaces.get(keyspace).put(table, columns);
            return;
        }

        m = DROP_TABLE.matcher(cql);
        if (m.matches())
        {
            String keyspace = unquote(m.group(1));
            String table = unquote(m.group(2));
            if (!hasTable(keyspace, table))
            {
                throw new InvalidQueryException(coordinator, "unconfigured table " + table);
            }
            keyspaces.get(keyspace).remove(table);
            return;
        }

        m = CREATE_INDEX.matcher(cql);
        if (m.matches())
        {
            String index = unquote(m.group(1));
            String keyspace = unquote(m.group(2));
            String table = unquote(m.group(3));
            if (!hasTable(keyspace, table))
            {
                throw new InvalidQueryException(coordinator, "unconfigured table " + table);
            }
            if (hasIndex(keyspace, table, index))
            {
                throw new InvalidQueryException(coordinator, "Index " + index + " already exists");
            }
            indexes.get(keyspace).add(table + "." + index);
            return;
        }

        throw new InvalidQueryException(coordinator, "line 1:0 no viable alternative at input " + cql);
    }

    private void assertKeyspace(String keyspace)
    {
        if (!hasKeyspace(keyspace))
        {
            throw new InvalidQueryException(coordinator, "Keyspace " + keyspace + " does not exist");
        }
    }

    private static String unquote(String name)
    {
        if (name.length() > 1 && name.startsWith("\"") && name.endsWith("\""))
        {
            return name.substring(1, name.length() - 1).replace("\"\"", "\"");
        }
        return name;
    }

    private static ResultSet resultSet(final List<Map<String, String>> rowValues)
    {
        final List<Row> rows = new ArrayList<>();
        for (final Map<String, String> values : rowValues)
        {
            Row row = mock(Row.class);
            for (Map.Entry<String, String> entry : values.entrySet())
            {
                when(row.getString(entry.getKey())).thenReturn(entry.getValue());
            }
            rows.add(row);
        }

        ResultSet rs = mock(ResultSet.class);
        when(rs.iterator()).thenAnswer(new Answer<Object>()
        {
            @Override
            public Object answer(InvocationOnMock invocation) throws Throwable
            {
                return rows.iterator();
            }
        });
        return rs;
    }
}
