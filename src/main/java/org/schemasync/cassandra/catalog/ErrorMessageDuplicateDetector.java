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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.schemasync.cassandra.SchemaError;

/**
 * Detector that looks for known text in the message of the failure or of any of its causes. Needed for old
 * Cassandra versions that only report existing objects as generic invalid requests. Fragile, since the messages
 * can change between versions.
 * <p>
 * The message of a {@link SchemaError} in the chain is not matched, since it holds the failed statement text and
 * that text can contain any of the patterns (e.g in a table comment). Only the errors reported by the driver count.
 * </p>
 */
public class ErrorMessageDuplicateDetector implements DuplicateCreateDetector
{
    /** Message fragments reported by Cassandra when creating an existing column family, keyspace, or index. */
    public static final List<String> DEFAULT_PATTERNS = Collections.unmodifiableList(Arrays.asList(
        "Cannot add already existing column family",
        "Cannot add existing keyspace",
        "already exists"));

    final List<String> patterns;

    public ErrorMessageDuplicateDetector()
    {
        this(DEFAULT_PATTERNS);
    }

    public ErrorMessageDuplicateDetector(List<String> patterns)
    {
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    public List<String> getPatterns()
    {
        return patterns;
    }

    @Override
    public boolean isDuplicateCreate(Throwable error)
    {
        Throwable cause = error;
        while (cause != null)
        {
            String msg = (cause instanceof SchemaError) ? null : cause.getMessage();
            if (msg != null)
            {
                for (String pattern : patterns)
                {
                    if (msg.contains(pattern))
                    {
                        return true;
                    }
                }
            }
            if (cause.getCause() == cause)
            {
                break;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
