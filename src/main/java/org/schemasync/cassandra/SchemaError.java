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

import org.datanucleus.exceptions.NucleusException;

/**
 * Error raised when the schema of the cluster cannot be brought in line with the declared definitions.
 * Thrown when trying to create a table for an abstract definition, when a DDL statement fails for any reason
 * other than the object having been created concurrently, and when validation finds differences.
 */
public class SchemaError extends NucleusException
{
    private static final long serialVersionUID = -3625167212341235012L;

    public SchemaError(String msg)
    {
        super(msg);
    }

    public SchemaError(String msg, Throwable nested)
    {
        super(msg, nested);
    }
}
