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

import com.datastax.oss.driver.api.core.servererrors.AlreadyExistsException;

/**
 * Detector for clusters that report existing keyspaces and tables with a dedicated error, surfaced by the driver as
 * {@link AlreadyExistsException}. Other failures (e.g an existing index, reported as an invalid query) are passed
 * to a message-matching detector.
 */
public class AlreadyExistsDuplicateDetector implements DuplicateCreateDetector
{
    final DuplicateCreateDetector fallback;

    public AlreadyExistsDuplicateDetector()
    {
        this(new ErrorMessageDuplicateDetector());
    }

    public AlreadyExistsDuplicateDetector(DuplicateCreateDetector fallback)
    {
        this.fallback = fallback;
    }

    @Override
    public boolean isDuplicateCreate(Throwable error)
    {
        Throwable cause = error;
        while (cause != null)
        {
            if (cause instanceof AlreadyExistsException)
            {
                return true;
            }
            if (cause.getCause() == cause)
            {
                break;
            }
            cause = cause.getCause();
        }
        return fallback != null && fallback.isDuplicateCreate(error);
    }
}
