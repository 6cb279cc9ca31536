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

import org.datanucleus.properties.PropertyValidator;
import org.schemasync.cassandra.catalog.CatalogVersion;

/**
 * Validator for the schema synchronisation properties that only accept a restricted set of values.
 */
public class SchemaSyncPropertyValidator implements PropertyValidator
{
    /**
     * Whether the specified property is one that this validator checks.
     * @param name Name of the property
     * @return Whether validated
     */
    public static boolean isValidated(String name)
    {
        return SchemaSyncConfiguration.PROPERTY_CATALOG_VERSION.equals(name) ||
            SchemaSyncConfiguration.PROPERTY_SESSION_PER_CONNECTION.equals(name) ||
            SchemaSyncConfiguration.PROPERTY_AUTO_CREATE_KEYSPACE.equals(name);
    }

    /**
     * Validate the specified property.
     * @param name Name of the property
     * @param value Value
     * @return Whether it is valid
     */
    public boolean validate(String name, Object value)
    {
        if (name == null)
        {
            return false;
        }
        else if (name.equals(SchemaSyncConfiguration.PROPERTY_CATALOG_VERSION))
        {
            if (value instanceof String)
            {
                String strVal = ((String)value).trim();
                for (CatalogVersion version : CatalogVersion.values())
                {
                    if (version.getPropertyValue().equalsIgnoreCase(strVal))
                    {
                        return true;
                    }
                }
            }
        }
        else if (name.equals(SchemaSyncConfiguration.PROPERTY_SESSION_PER_CONNECTION) ||
            name.equals(SchemaSyncConfiguration.PROPERTY_AUTO_CREATE_KEYSPACE))
        {
            if (value instanceof Boolean)
            {
                return true;
            }
            if (value instanceof String)
            {
                String strVal = ((String)value).trim();
                if (strVal.equalsIgnoreCase("true") ||
                    strVal.equalsIgnoreCase("false"))
                {
                    return true;
                }
            }
        }
        return false;
    }
}
