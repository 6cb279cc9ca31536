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

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.HashSet;
import java.util.Set;

import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;
import org.schemasync.cassandra.SchemaError;
import org.schemasync.cassandra.SchemaSyncConfiguration;

/**
 * Writer of DDL statements to a script file, used in place of executing them against the cluster.
 * Any existing file is replaced. A statement identical to one already written is not written again, so a keyspace
 * needed by several tables is only created once in the script.
 */
public class DdlScriptWriter
{
    static
    {
        Localiser.registerBundle(SchemaSyncConfiguration.LOCALISATION_BUNDLE, DdlScriptWriter.class.getClassLoader());
    }

    final File ddlFile;

    FileWriter ddlFileWriter;

    final Set<String> writtenStmts = new HashSet<>();

    public DdlScriptWriter(String ddlFilename)
    {
        ddlFile = StringUtils.getFileForFilename(ddlFilename);
        try
        {
            if (ddlFile.exists())
            {
                // Delete existing file
                ddlFile.delete();
            }
            if (ddlFile.getParentFile() != null && !ddlFile.getParentFile().exists())
            {
                // Make sure the directory exists
                ddlFile.getParentFile().mkdirs();
            }
            ddlFile.createNewFile();
            ddlFileWriter = new FileWriter(ddlFile);

            SimpleDateFormat fmt = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
            ddlFileWriter.write("------------------------------------------------------------------\n");
            ddlFileWriter.write("-- SchemaSync " + "(ran at " + fmt.format(new java.util.Date()) + ")\n");
            ddlFileWriter.write("------------------------------------------------------------------\n");
        }
        catch (IOException ioe)
        {
            throw new SchemaError(Localiser.msg("SchemaSync.DdlFile.Failed", ddlFile.getAbsolutePath()), ioe);
        }
        NucleusLogger.DATASTORE_SCHEMA.debug(Localiser.msg("SchemaSync.DdlFile.Open", ddlFile.getAbsolutePath()));
    }

    public File getFile()
    {
        return ddlFile;
    }

    /**
     * Append the statement to the script, terminated by ";".
     * @param stmt The statement
     * @return Whether it was written, false when already in the script
     */
    public boolean write(String stmt)
    {
        if (!writtenStmts.add(stmt))
        {
            return false;
        }
        try
        {
            ddlFileWriter.write(stmt + ";\n");
        }
        catch (IOException ioe)
        {
            throw new SchemaError(Localiser.msg("SchemaSync.DdlFile.Failed", ddlFile.getAbsolutePath()), ioe);
        }
        return true;
    }

    public void close()
    {
        if (ddlFileWriter == null)
        {
            return;
        }
        try
        {
            ddlFileWriter.close();
        }
        catch (IOException ioe)
        {
            throw new SchemaError(Localiser.msg("SchemaSync.DdlFile.Failed", ddlFile.getAbsolutePath()), ioe);
        }
        finally
        {
            ddlFileWriter = null;
        }
    }
}
