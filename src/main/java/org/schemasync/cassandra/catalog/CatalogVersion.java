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

import org.datanucleus.exceptions.NucleusUserException;

/**
 * Layout of the schema catalog of the cluster, deciding how the catalog is read and how concurrent creation of
 * the same object is recognised.
 */
public enum CatalogVersion
{
    /** Cassandra 1.2 and 2.x : "system.schema_*" tables. */
    LEGACY("legacy"),

    /** Cassandra 3.0 and later : "system_schema" keyspace. */
    SYSTEM_SCHEMA("system_schema");

    final String propertyValue;

    CatalogVersion(String propertyValue)
    {
        this.propertyValue = propertyValue;
    }

    /**
     * Accessor for the value used for this version in the configuration.
     * @return The property value
     */
    public String getPropertyValue()
    {
        return propertyValue;
    }

    public CatalogReader newCatalogReader()
    {
        return this == LEGACY ? new LegacyCatalogReader() : new SystemSchemaCatalogReader();
    }

    public DuplicateCreateDetector newDuplicateCreateDetector()
    {
        return this == LEGACY ? new ErrorMessageDuplicateDetector() : new AlreadyExistsDuplicateDetector();
    }

    public static CatalogVersion forName(String value)
    {
        for (CatalogVersion version : values())
        {
            if (version.propertyValue.equalsIgnoreCase(value.trim()))
            {
                return version;
            }
        }
        throw new NucleusUserException("Catalog version \"" + value + "\" is not supported. Use \"legacy\" or \"system_schema\"");
    }
}
