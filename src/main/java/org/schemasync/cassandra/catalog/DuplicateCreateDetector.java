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

/**
 * Recogniser of a failed CREATE that failed only because the object was created in the meantime, typically by
 * another client racing to create the same schema. Such failures can be ignored.
 */
public interface DuplicateCreateDetector
{
    /**
     * Whether the specified failure of a CREATE statement means that the object already exists.
     * @param error The failure
     * @return Whether the object already exists
     */
    boolean isDuplicateCreate(Throwable error);
}
