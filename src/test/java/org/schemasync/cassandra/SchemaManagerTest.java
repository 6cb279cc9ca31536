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

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.schemasync.cassandra.catalog.SystemSchemaCatalogReader;
import org.schemasync.cassandra.model.ColumnSpec;
import org.schemasync.cassandra.model.KeyspaceSpec;
import org.schemasync.cassandra.model.TableSpec;

import com.datastax.oss.driver.api.core.metadata.Node;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;

public class SchemaManagerTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private FakeCluster cluster;

    private SchemaSyncConfiguration conf;

    private TableSpec users;

    private TableSpec events;

    private TableSpec base;

    @Before
    public void setUp()
    {
        cluster = new FakeCluster(false);
        conf = new SchemaSyncConfiguration();

        users = TableSpec.builder("ks", "users")
            .column(new ColumnSpec("id", "uuid").setPrimaryKey(true))
            .column(new ColumnSpec("email", "text").setIndexed(true))
            .build();
        events = TableSpec.builder("ks", "events")
            .column(new ColumnSpec("tenant", "text").setPartitionKey(true))
            .column(new ColumnSpec("ts", "timestamp").setPrimaryKey(true))
            .build();
        base = TableSpec.builder("ks", "base").column("created", "timestamp").abstractTable(true).build();
    }

    @Test
    public void shouldCreateSchemaSkippingAbstractTables()
    {
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());
        assertTrue(schemaMgr.getCatalogReader() instanceof SystemSchemaCatalogReader);

        schemaMgr.createSchema(Arrays.asList(users, base, events));

        assertTrue(cluster.hasTable("ks", "users"));
        assertTrue(cluster.hasTable("ks", "events"));
        assertFalse(cluster.hasTable("ks", "base"));
        assertTrue(cluster.hasIndex("ks", "users", "index_users_email"));
        assertEquals(1, cluster.getExecutedDdl("CREATE KEYSPACE").size());

        // Running again changes nothing
        int numDdl = cluster.getExecutedDdl().size();
        schemaMgr.createSchema(Arrays.asList(users, base, events));
        assertEquals(numDdl, cluster.getExecutedDdl().size());
    }

    @Test
    public void shouldProcessAllTablesBeforeReportingFailures()
    {
        cluster.failOn("CREATE TABLE ks.users", new InvalidQueryException(mock(Node.class), "Unknown type uuid"));
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());

        try
        {
            schemaMgr.createSchema(Arrays.asList(users, events));
            fail("Expected SchemaError");
        }
        catch (SchemaError se)
        {
            assertTrue(se.getMessage(), se.getMessage().contains("ks.users"));
            assertFalse(se.getMessage(), se.getMessage().contains("ks.events"));
        }
        assertFalse(cluster.hasTable("ks", "users"));
        assertTrue(cluster.hasTable("ks", "events"));
    }

    @Test
    public void shouldNotCreateKeyspaceWhenDisabled()
    {
        conf.setProperty(SchemaSyncConfiguration.PROPERTY_AUTO_CREATE_KEYSPACE, "false");
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());

        try
        {
            schemaMgr.createTable(users);
            fail("Expected SchemaError");
        }
        catch (SchemaError se)
        {
            // Expected
        }
        assertFalse(cluster.hasKeyspace("ks"));

        assertTrue(schemaMgr.createKeyspace(new KeyspaceSpec("ks").setReplicationFactor(1)));
        assertTrue(schemaMgr.createTable(users));
        assertFalse(schemaMgr.createTable(users));
    }

    @Test
    public void shouldDeleteSchemaAndKeyspace()
    {
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());
        schemaMgr.createSchema(Arrays.asList(users, events));

        schemaMgr.deleteSchema(Arrays.asList(users, base));
        assertFalse(cluster.hasTable("ks", "users"));
        assertTrue(cluster.hasTable("ks", "events"));
        assertFalse(schemaMgr.deleteTable(users));

        assertTrue(schemaMgr.deleteKeyspace("ks"));
        assertFalse(schemaMgr.deleteKeyspace("ks"));
    }

    @Test
    public void shouldValidateSchema()
    {
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());
        schemaMgr.createTable(users);
        schemaMgr.validateTable(users);

        try
        {
            schemaMgr.validateSchema(Arrays.asList(users, base, events));
            fail("Expected SchemaError");
        }
        catch (SchemaError se)
        {
            assertTrue(se.getMessage(), se.getMessage().contains("ks.events"));
            assertFalse(se.getMessage(), se.getMessage().contains("ks.users"));
            assertFalse(se.getMessage(), se.getMessage().contains("ks.base"));
        }
    }

    @Test
    public void shouldWriteBatchDdlToFileWithoutExecuting() throws Exception
    {
        File ddlFile = new File(folder.getRoot(), "create.cql");
        conf.setProperty(SchemaSyncConfiguration.PROPERTY_DDL_FILENAME, ddlFile.getAbsolutePath());
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());

        schemaMgr.createSchema(Arrays.asList(users, base, events));

        assertTrue(cluster.getExecutedDdl().isEmpty());
        assertFalse(cluster.hasKeyspace("ks"));

        List<String> lines = Files.readAllLines(ddlFile.toPath(), StandardCharsets.UTF_8);
        assertEquals("CREATE KEYSPACE ks WITH REPLICATION = {'class': 'SimpleStrategy', 'replication_factor': 3};", lines.get(3));
        assertEquals("CREATE TABLE ks.users (id uuid, email text, PRIMARY KEY ((id))) WITH read_repair_chance = 0.1;", lines.get(4));
        assertEquals("CREATE INDEX index_users_email ON ks.users (\"email\");", lines.get(5));
        assertTrue(lines.get(lines.size() - 1).startsWith("CREATE TABLE ks.events "));
        assertEquals(7, lines.size());
    }

    @Test
    public void shouldExecuteSingleOperationsEvenWithDdlFile()
    {
        conf.setProperty(SchemaSyncConfiguration.PROPERTY_DDL_FILENAME, new File(folder.getRoot(), "create.cql").getAbsolutePath());
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());

        assertTrue(schemaMgr.createTable(users));
        assertTrue(cluster.hasTable("ks", "users"));
    }

    @Test
    public void shouldUseLegacyCatalogWhenConfigured()
    {
        FakeCluster legacyCluster = new FakeCluster(true);
        conf.setProperty(SchemaSyncConfiguration.PROPERTY_CATALOG_VERSION, "legacy");
        SchemaManager schemaMgr = new SchemaManager(conf, legacyCluster.getSession());

        schemaMgr.createSchema(Arrays.asList(users, events));
        assertTrue(legacyCluster.hasTable("ks", "users"));
        assertTrue(legacyCluster.hasIndex("ks", "users", "index_users_email"));
    }

    @Test
    public void shouldNotCloseExternalSession()
    {
        SchemaManager schemaMgr = new SchemaManager(conf, cluster.getSession());
        schemaMgr.createKeyspace("ks");
        schemaMgr.close();
        verify(cluster.getSession(), never()).close();
    }
}
