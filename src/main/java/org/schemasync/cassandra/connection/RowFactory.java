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

import com.datastax.oss.driver.api.core.cql.Row;

/**
 * Converter of a result row into an object.
 * @param <T> Type of object created from each row
 */
public interface RowFactory<T>
{
    T create(Row row);

    /**
     * Factory returning the value of a text column of each row.
     * @param columnName Name of the column
     * @return The factory
     */
    static RowFactory<String> stringColumn(final String columnName)
    {
        return row -> row.getString(columnName);
    }
}
