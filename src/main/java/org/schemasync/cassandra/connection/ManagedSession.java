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
package org.schemasync.cassandra.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.schemasync.cassandra.SchemaError;
import org.schemasync.cassandra.SchemaSyncConfiguration;
import org.schemasync.cassandra.cql.DdlScriptWriter;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;

/**
 * Connection obtained from a {@link ConnectionFactory}, wrapping a CqlSession for the duration of a unit of work.
 * Must be released when the caller has finished with it.
 * <p>
 * When a {@link DdlScriptWriter} is set, DDL passed to {@link #execute(String)} is written to the script rather
 * than executed, while reads still go to the cluster.
 * </p>
 */
public class ManagedSession
{
    static
    {
        Localiser.registerBundle(SchemaSyncConfiguration.LOCALISATION_BUNDLE, ManagedSession.class.getClassLoader());
    }

    final CqlSession session;

    /** Whether the session belongs to this connection only, so is closed on release. */
    final boolean closeOnRelease;

    DdlScriptWriter ddlWriter = null;

    boolean released = false;

    ManagedSession(CqlSession session, boolean closeOnRelease)
    {
        this.session = session;
        this.closeOnRelease = closeOnRelease;
    }

    public CqlSession getSession()
    {
        return session;
    }

    public void setDdlWriter(DdlScriptWriter writer)
    {
        this.ddlWriter = writer;
    }

    public DdlScriptWriter getDdlWriter()
    {
        return ddlWriter;
    }

    /**
     * Execute a (read) statement with positional parameters, converting each row of the results.
     * @param cql The statement, with "?" for each parameter
     * @param params The parameter values (or null)
     * @param rowFactory Converter for the result rows
     * @return The converted rows
     * @param <T> Type of the converted rows
     * @throws SchemaError if the statement fails
     */
    public <T> List<T> execute(String cql, List<?> params, RowFactory<T> rowFactory)
    {
        assertNotReleased();
        Object[] values = params != null ? params.toArray() : new Object[0];
        if (NucleusLogger.DATASTORE_NATIVE.isDebugEnabled())
        {
            NucleusLogger.DATASTORE_NATIVE.debug(cql + (values.length > 0 ? " " + params : ""));
        }

        try
        {
            ResultSet rs = session.execute(SimpleStatement.newInstance(cql, values));
            if (rs == null)
            {
                return Collections.emptyList();
            }

            // Iterating can fetch further pages, so can fail too
            List<T> results = new ArrayList<>();
            for (Row row : rs)
            {
                results.add(rowFactory.create(row));
            }
            return results;
        }
        catch (DriverException de)
        {
            throw new SchemaError(Localiser.msg("SchemaSync.Statement.Failed", cql, de.getMessage()), de);
        }
    }

    /**
     * Execute a DDL statement, ignoring any results. Written to the DDL script instead when one is set.
     * @param cql The statement
     * @throws SchemaError if the statement fails
     */
    public void execute(String cql)
    {
        assertNotReleased();
        if (ddlWriter != null)
        {
            ddlWriter.write(cql);
            return;
        }

        try
        {
            session.execute(SimpleStatement.newInstance(cql));
        }
        catch (DriverException de)
        {
            throw new SchemaError(Localiser.msg("SchemaSync.Statement.Failed", cql, de.getMessage()), de);
        }
    }

    public boolean isReleased()
    {
        return released;
    }

    /**
     * Release this connection. A session owned by this connection is closed, a shared session is left open.
     */
    public void release()
    {
        if (released)
        {
            return;
        }
        released = true;
        if (closeOnRelease)
        {
            NucleusLogger.CONNECTION.debug("ManagedSession " + this.toString() + " - close CqlSession");
            session.close();
        }
        else
        {
            NucleusLogger.CONNECTION.debug("ManagedSession " + this.toString() + " - released connection");
        }
    }

    private void assertNotReleased()
    {
        if (released)
        {
            throw new SchemaError(Localiser.msg("SchemaSync.Connection.Released", this.toString()));
        }
    }
}
