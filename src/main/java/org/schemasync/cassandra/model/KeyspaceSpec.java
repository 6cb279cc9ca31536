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

import java.util.LinkedHashMap;
import java.util.Map;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.util.StringUtils;

/**
 * Definition of a keyspace and its replication.
 */
public class KeyspaceSpec
{
    public static final String DEFAULT_STRATEGY_CLASS = "SimpleStrategy";

    public static final int DEFAULT_REPLICATION_FACTOR = 3;

    final String name;

    String strategyClass = DEFAULT_STRATEGY_CLASS;

    Integer replicationFactor = DEFAULT_REPLICATION_FACTOR;

    boolean durableWrites = true;

    final Map<String, Object> replicationOptions = new LinkedHashMap<>();

    public KeyspaceSpec(String name)
    {
        if (StringUtils.isWhitespace(name))
        {
            throw new NucleusUserException("Keyspace name must be specified");
        }
        this.name = name;
    }

    public String getName()
    {
        return name;
    }

    public String getStrategyClass()
    {
        return strategyClass;
    }

    public Integer getReplicationFactor()
    {
        return replicationFactor;
    }

    public boolean isDurableWrites()
    {
        return durableWrites;
    }

    public boolean isDefaultStrategy()
    {
        return DEFAULT_STRATEGY_CLASS.equals(strategyClass);
    }

    public KeyspaceSpec setStrategyClass(String strategyClass)
    {
        if (StringUtils.isWhitespace(strategyClass))
        {
            throw new NucleusUserException("Replication strategy class for keyspace " + name + " must be specified");
        }
        this.strategyClass = strategyClass;
        return this;
    }

    /**
     * Mutator for the replication factor. Use null to omit "replication_factor" from the replication map.
     * @param factor The replication factor
     * @return This keyspace
     */
    public KeyspaceSpec setReplicationFactor(Integer factor)
    {
        this.replicationFactor = factor;
        return this;
    }

    public KeyspaceSpec setDurableWrites(boolean durableWrites)
    {
        this.durableWrites = durableWrites;
        return this;
    }

    /**
     * Add a value to the replication map, e.g the replication factor of a datacenter for "NetworkTopologyStrategy".
     * Overrides "class" or "replication_factor" when using those keys.
     * @param key The key
     * @param value The value
     * @return This keyspace
     */
    public KeyspaceSpec setReplicationOption(String key, Object value)
    {
        replicationOptions.put(key, value);
        return this;
    }

    /**
     * Accessor for the replication map : "class", then "replication_factor" (when set), then any replication options
     * in the order they were added.
     * @return The replication map
     */
    public Map<String, Object> getReplicationMap()
    {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("class", strategyClass);
        if (replicationFactor != null)
        {
            map.put("replication_factor", replicationFactor);
        }
        map.putAll(replicationOptions);
        return map;
    }

    public String toString()
    {
        return "KeyspaceSpec[" + name + " replication=" + getReplicationMap() + " durableWrites=" + durableWrites + "]";
    }
}
