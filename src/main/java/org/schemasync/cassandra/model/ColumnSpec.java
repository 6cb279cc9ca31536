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
package org.schemasync.cassandra.model;

import java.util.regex.Pattern;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.util.StringUtils;

/**
 * Definition of a column of a table, as it will be declared in the datastore.
 * A column flagged as partition key is always part of the primary key. A primary key column that is not part of the
 * partition key is a clustering key.
 * <p>
 * A table holds its own copies of the columns it was built from. Those copies are read-only, so the key flags of a
 * built table cannot change, and a column can be reused to build other tables.
 * </p>
 */
public class ColumnSpec
{
    /**
     * Characters accepted in a CQL type fragment, e.g "map&lt;text, int&gt;" or "frozen&lt;"my_type"&gt;".
     * Commas and spaces are further restricted to inside the angle brackets.
     */
    private static final Pattern TYPE_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_<>,. \"]*");

    final String name;

    final String typeName;

    boolean primaryKey = false;

    boolean partitionKey = false;

    boolean indexed = false;

    ClusteringOrder clusteringOrder = null;

    String indexClass = null;

    boolean readOnly = false;

    /**
     * Constructor for a column.
     * @param name Name of the column in the datastore
     * @param typeName CQL type of the column
     */
    public ColumnSpec(String name, String typeName)
    {
        if (StringUtils.isWhitespace(name))
        {
            throw new NucleusUserException("Column name must be specified");
        }
        if (StringUtils.isWhitespace(typeName) || !isValidType(typeName.trim()))
        {
            throw new NucleusUserException("Column " + name + " has invalid type \"" + typeName + "\"");
        }
        this.name = name;
        this.typeName = typeName.trim();
    }

    /**
     * Constructor for a read-only copy of a column.
     * @param col The column to copy
     */
    ColumnSpec(ColumnSpec col)
    {
        this.name = col.name;
        this.typeName = col.typeName;
        this.primaryKey = col.primaryKey;
        this.partitionKey = col.partitionKey;
        this.indexed = col.indexed;
        this.clusteringOrder = col.clusteringOrder;
        this.indexClass = col.indexClass;
        this.readOnly = true;
    }

    private static boolean isValidType(String typeName)
    {
        if (!TYPE_PATTERN.matcher(typeName).matches())
        {
            return false;
        }

        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < typeName.length(); i++)
        {
            char c = typeName.charAt(i);
            if (c == '"')
            {
                quoted = !quoted;
            }
            else if (quoted)
            {
                continue;
            }
            else if (c == '<')
            {
                depth++;
            }
            else if (c == '>')
            {
                depth--;
                if (depth < 0)
                {
                    return false;
                }
            }
            else if ((c == ',' || c == ' ') && depth == 0)
            {
                return false;
            }
        }
        return depth == 0 && !quoted;
    }

    public String getName()
    {
        return name;
    }

    public String getTypeName()
    {
        return typeName;
    }

    public boolean isPrimaryKey()
    {
        return primaryKey;
    }

    public boolean isPartitionKey()
    {
        return partitionKey;
    }

    public boolean isClusteringKey()
    {
        return primaryKey && !partitionKey;
    }

    public boolean isIndexed()
    {
        return indexed;
    }

    /**
     * Accessor for the declared clustering order.
     * @return The order, or null when not declared (ascending in the datastore)
     */
    public ClusteringOrder getClusteringOrder()
    {
        return clusteringOrder;
    }

    /**
     * Accessor for the class of a custom index for this column.
     * @return The index class, or null for the default secondary index
     */
    public String getIndexClass()
    {
        return indexClass;
    }

    public boolean isReadOnly()
    {
        return readOnly;
    }

    public ColumnSpec setPrimaryKey(boolean primaryKey)
    {
        assertModifiable();
        this.primaryKey = primaryKey;
        if (!primaryKey)
        {
            this.partitionKey = false;
        }
        return this;
    }

    public ColumnSpec setPartitionKey(boolean partitionKey)
    {
        assertModifiable();
        this.partitionKey = partitionKey;
        if (partitionKey)
        {
            this.primaryKey = true;
        }
        return this;
    }

    public ColumnSpec setIndexed(boolean indexed)
    {
        assertModifiable();
        this.indexed = indexed;
        return this;
    }

    public ColumnSpec setClusteringOrder(ClusteringOrder order)
    {
        assertModifiable();
        this.clusteringOrder = order;
        return this;
    }

    /**
     * Mutator for the class of a custom index (emitted as a USING clause). Implies that the column is indexed.
     * @param indexClass Index implementation class
     * @return This column
     */
    public ColumnSpec setIndexClass(String indexClass)
    {
        assertModifiable();
        this.indexClass = indexClass;
        if (!StringUtils.isWhitespace(indexClass))
        {
            this.indexed = true;
        }
        return this;
    }

    private void assertModifiable()
    {
        if (readOnly)
        {
            throw new NucleusUserException("Column " + name + " belongs to a built table so cannot be changed");
        }
    }

    public String toString()
    {
        StringBuilder str = new StringBuilder("ColumnSpec[");
        str.append(name).append(' ').append(typeName);
        if (partitionKey)
        {
            str.append(" partitionKey");
        }
        else if (primaryKey)
        {
            str.append(" clusteringKey");
        }
        if (clusteringOrder != null)
        {
            str.append(' ').append(clusteringOrder);
        }
        if (indexed)
        {
            str.append(" indexed");
        }
        return str.append(']').toString();
    }
}
