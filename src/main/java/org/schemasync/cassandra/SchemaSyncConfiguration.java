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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.properties.PropertyValidator;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;
import org.schemasync.cassandra.catalog.CatalogVersion;

/**
 * Configuration for schema synchronisation. Holds properties of the following names
 * <ul>
 * <li><b>schemasync.connectionURL</b> : "cassandra:[host1[:port][,host2[:port]...]]"</li>
 * <li><b>schemasync.connectionUserName</b>, <b>schemasync.connectionPassword</b> : login credentials</li>
 * <li><b>schemasync.cassandra.localDatacenter</b> : local datacenter, required by the driver when hosts are specified</li>
 * <li><b>schemasync.cassandra.sessionPerConnection</b> : whether each connection uses its own session (default false)</li>
 * <li><b>schemasync.catalogVersion</b> : "legacy" (Cassandra 1.2/2.x) or "system_schema" (3.0+, default)</li>
 * <li><b>schemasync.autoCreateKeyspace</b> : whether to create a missing keyspace when creating a table (default true)</li>
 * <li><b>schemasync.ddlFilename</b> : file to write batch DDL to rather than executing it</li>
 * </ul>
 */
public class SchemaSyncConfiguration
{
    public static final String LOCALISATION_BUNDLE = "org.schemasync.cassandra.Localisation";

    public static final String PROPERTY_CONNECTION_URL = "schemasync.connectionURL";

    public static final String PROPERTY_CONNECTION_USER_NAME = "schemasync.connectionUserName";

    public static final String PROPERTY_CONNECTION_PASSWORD = "schemasync.connectionPassword";

    public static final String PROPERTY_LOCAL_DATACENTER = "schemasync.cassandra.localDatacenter";

    public static final String PROPERTY_SESSION_PER_CONNECTION = "schemasync.cassandra.sessionPerConnection";

    public static final String PROPERTY_CATALOG_VERSION = "schemasync.catalogVersion";

    public static final String PROPERTY_AUTO_CREATE_KEYSPACE = "schemasync.autoCreateKeyspace";

    public static final String PROPERTY_DDL_FILENAME = "schemasync.ddlFilename";

    static
    {
        Localiser.registerBundle(LOCALISATION_BUNDLE, SchemaSyncConfiguration.class.getClassLoader());
    }

    final Properties properties = new Properties();

    final PropertyValidator validator = new SchemaSyncPropertyValidator();

    public SchemaSyncConfiguration()
    {
    }

    public SchemaSyncConfiguration(Properties props)
    {
        if (props != null)
        {
            for (String name : props.stringPropertyNames())
            {
                setProperty(name, props.getProperty(name));
            }
        }
    }

    /**
     * Create a configuration from a properties file in the CLASSPATH.
     * @param resourceName Name of the resource, e.g "schemasync.properties"
     * @return The configuration
     * @throws NucleusUserException if the resource is not found or cannot be read
     */
    public static SchemaSyncConfiguration load(String resourceName)
    {
        ClassLoader loader = SchemaSyncConfiguration.class.getClassLoader();
        Properties props = new Properties();
        try (InputStream in = loader.getResourceAsStream(resourceName))
        {
            if (in == null)
            {
                throw new NucleusUserException(Localiser.msg("SchemaSync.Config.NotFound", resourceName));
            }
            props.load(in);
        }
        catch (IOException ioe)
        {
            throw new NucleusUserException(Localiser.msg("SchemaSync.Config.NotFound", resourceName), ioe);
        }
        NucleusLogger.GENERAL.debug(Localiser.msg("SchemaSync.Config.Loaded", resourceName, props.size()));
        return new SchemaSyncConfiguration(props);
    }

    /**
     * Set a property, validating its value where the property has a restricted set of values.
     * @param name Name of the property
     * @param value Its value (null to remove it)
     * @return This configuration
     * @throws NucleusUserException if the value is invalid
     */
    public SchemaSyncConfiguration setProperty(String name, String value)
    {
        if (value == null)
        {
            properties.remove(name);
            return this;
        }
        if (SchemaSyncPropertyValidator.isValidated(name) && !validator.validate(name, value))
        {
            throw new NucleusUserException(Localiser.msg("SchemaSync.Config.Invalid", name, value));
        }
        properties.setProperty(name, value.trim());
        return this;
    }

    public String getProperty(String name)
    {
        return properties.getProperty(name);
    }

    public boolean getBooleanProperty(String name, boolean defaultValue)
    {
        String value = properties.getProperty(name);
        if (StringUtils.isWhitespace(value))
        {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    public String getConnectionURL()
    {
        return getProperty(PROPERTY_CONNECTION_URL);
    }

    public String getConnectionUserName()
    {
        return getProperty(PROPERTY_CONNECTION_USER_NAME);
    }

    public String getConnectionPassword()
    {
        return getProperty(PROPERTY_CONNECTION_PASSWORD);
    }

    public String getLocalDatacenter()
    {
        return getProperty(PROPERTY_LOCAL_DATACENTER);
    }

    public boolean isSessionPerConnection()
    {
        return getBooleanProperty(PROPERTY_SESSION_PER_CONNECTION, false);
    }

    public CatalogVersion getCatalogVersion()
    {
        String value = getProperty(PROPERTY_CATALOG_VERSION);
        return StringUtils.isWhitespace(value) ? CatalogVersion.SYSTEM_SCHEMA : CatalogVersion.forName(value);
    }

    public boolean isAutoCreateKeyspace()
    {
        return getBooleanProperty(PROPERTY_AUTO_CREATE_KEYSPACE, true);
    }

    public String getDdlFilename()
    {
        String value = getProperty(PROPERTY_DDL_FILENAME);
        return StringUtils.isWhitespace(value) ? null : value;
    }
}
