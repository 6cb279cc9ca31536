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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.util.StringUtils;

/**
 * Definition of a table (column family) in a keyspace. Instances are created using {@link Builder}, which validates
 * the definition so that it is consistent before any CQL is generated from it. The table holds read-only copies
 * of the columns it was built from.
 * <p>
 * The primary key is made up of the partition key columns, in declaration order, followed by the clustering key
 * columns, in declaration order. When no column is flagged as partition key the first primary key column is used.
 * </p>
 */
public class TableSpec
{
    public static final double DEFAULT_READ_REPAIR_CHANCE = 0.1;

    final String keyspace;

    final String name;

    final List<ColumnSpec> columns;

    final Double readRepairChance;

    final boolean abstractTable;

    final List<String> options;

    private TableSpec(Builder builder, List<ColumnSpec> builtColumns)
    {
        this.keyspace = builder.keyspace;
        this.name = builder.name;
        this.columns = Collections.unmodifiableList(builtColumns);
        this.readRepairChance = builder.readRepairChance;
        this.abstractTable = builder.abstractTable;
        this.options = Collections.unmodifiableList(new ArrayList<>(builder.options));
    }

    public static Builder builder(String keyspace, String name)
    {
        return new Builder(keyspace, name);
    }

    public String getKeyspace()
    {
        return keyspace;
    }

    /**
     * Accessor for the name of the table without its keyspace.
     * @return The table name
     */
    public String getName()
    {
        return name;
    }

    /**
     * Accessor for the name of the table including its keyspace, e.g "ks.users".
     * @return The qualified table name
     */
    public String getQualifiedName()
    {
        return keyspace + "." + name;
    }

    public List<ColumnSpec> getColumns()
    {
        return columns;
    }

    public ColumnSpec getColumn(String colName)
    {
        for (ColumnSpec col : columns)
        {
            if (col.getName().equals(colName))
            {
                return col;
            }
        }
        return null;
    }

    public List<ColumnSpec> getPartitionKeyColumns()
    {
        List<ColumnSpec> cols = new ArrayList<>();
        for (ColumnSpec col : columns)
        {
            if (col.isPartitionKey())
            {
                cols.add(col);
            }
        }
        return cols;
    }

    public List<ColumnSpec> getClusteringKeyColumns()
    {
        List<ColumnSpec> cols = new ArrayList<>();
        for (ColumnSpec col : columns)
        {
            if (col.isClusteringKey())
            {
                cols.add(col);
            }
        }
        return cols;
    }

    public List<ColumnSpec> getIndexedColumns()
    {
        List<ColumnSpec> cols = new ArrayList<>();
        for (ColumnSpec col : columns)
        {
            if (col.isIndexed())
            {
                cols.add(col);
            }
        }
        return cols;
    }

    /**
     * Accessor for the read repair chance.
     * @return The chance, or null if the table options should not include it
     */
    public Double getReadRepairChance()
    {
        return readRepairChance;
    }

    /**
     * Whether this definition is abstract, so declares a shape but has no table of its own.
     * @return Whether abstract
     */
    public boolean isAbstract()
    {
        return abstractTable;
    }

    /**
     * Accessor for any additional table options, each of the form "name = value".
     * @return The options
     */
    public List<String> getOptions()
    {
        return options;
    }

    /**
     * Accessor for the name of the secondary index on the specified column, "index_{table}_{column}".
     * @param col The column
     * @return Name of the index
     */
    public String getIndexName(ColumnSpec col)
    {
        return "index_" + name + "_" + col.getName();
    }

    /**
     * Accessor for the index name qualified by the table name, as held in the catalog, "{table}.index_{table}_{column}".
     * @param col The column
     * @return Qualified name of the index
     */
    public String getQualifiedIndexName(ColumnSpec col)
    {
        return name + "." + getIndexName(col);
    }

    public String toString()
    {
        return "TableSpec[" + getQualifiedName() + (abstractTable ? " abstract" : "") + " columns=" + columns + "]";
    }

    /**
     * Builder for a table definition.
     */
    public static class Builder
    {
        final String keyspace;

        final String name;

        final List<ColumnSpec> columns = new ArrayList<>();

        Double readRepairChance = DEFAULT_READ_REPAIR_CHANCE;

        boolean abstractTable = false;

        final List<String> options = new ArrayList<>();

        Builder(String keyspace, String name)
        {
            this.keyspace = keyspace;
            this.name = name;
        }

        public Builder column(ColumnSpec col)
        {
            columns.add(col);
            return this;
        }

        public Builder column(String colName, String typeName)
        {
            return column(new ColumnSpec(colName, typeName));
        }

        /**
         * Mutator for the read repair chance. Use null to omit it from the table options (Cassandra 4.0+ no longer
         * supports it).
         * @param chance Chance in the range 0 to 1
         * @return The builder
         */
        public Builder readRepairChance(Double chance)
        {
            this.readRepairChance = chance;
            return this;
        }

        public Builder abstractTable(boolean flag)
        {
            this.abstractTable = flag;
            return this;
        }

        /**
         * Add a table option, e.g "comment = 'users'" or "gc_grace_seconds = 3600".
         * @param option The option
         * @return The builder
         */
        public Builder option(String option)
        {
            if (!StringUtils.isWhitespace(option))
            {
                options.add(option.trim());
            }
            return this;
        }

        public TableSpec build()
        {
            if (StringUtils.isWhitespace(keyspace))
            {
                throw new NucleusUserException("Keyspace must be specified for table " + name);
            }
            if (StringUtils.isWhitespace(name))
            {
                throw new NucleusUserException("Table name must be specified");
            }
            if (readRepairChance != null && (readRepairChance.isNaN() || readRepairChance < 0.0 || readRepairChance > 1.0))
            {
                throw new NucleusUserException("Table " + name + " has read repair chance " + readRepairChance + " outside of range 0-1");
            }

            // Read-only copies of the caller's columns
            List<ColumnSpec> builtColumns = new ArrayList<>(columns.size());
            Set<String> colNames = new HashSet<>();
            ColumnSpec firstPkCol = null;
            boolean hasPartitionKey = false;
            for (ColumnSpec srcCol : columns)
            {
                ColumnSpec col = new ColumnSpec(srcCol);
                builtColumns.add(col);
                if (!colNames.add(col.getName()))
                {
                    throw new NucleusUserException("Table " + name + " has more than one column with name " + col.getName());
                }
                if (col.isPrimaryKey() && firstPkCol == null)
                {
                    firstPkCol = col;
                }
                if (col.isPartitionKey())
                {
                    hasPartitionKey = true;
                }
            }

            if (firstPkCol == null)
            {
                if (!abstractTable)
                {
                    throw new NucleusUserException("Table " + name + " has no primary key column");
                }
            }
            else if (!hasPartitionKey)
            {
                // Convention : first primary key column is the partition key
                firstPkCol.partitionKey = true;
            }

            for (ColumnSpec col : builtColumns)
            {
                if (col.getClusteringOrder() != null && !col.isClusteringKey())
                {
                    throw new NucleusUserException("Table " + name + " column " + col.getName() + " has a clustering order but is not a clustering key");
                }
            }

            return new TableSpec(this, builtColumns);
        }
    }
}
