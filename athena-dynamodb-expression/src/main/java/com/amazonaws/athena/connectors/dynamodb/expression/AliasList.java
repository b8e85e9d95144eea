/*-
 * #%L
 * athena-dynamodb-expression
 * %%
 * Copyright (C) 2019 - 2026 Amazon Web Services
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */
package com.amazonaws.athena.connectors.dynamodb.expression;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.NAME_ALIAS_PREFIX;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.VALUE_ALIAS_PREFIX;
import static java.util.Objects.requireNonNull;

/**
 * Produces the placeholder aliases for one {@link Expression.Builder#build()} call. Attribute paths are
 * deduplicated so the same path always maps to the same #index; values are never deduplicated and each one
 * gets a fresh :index.
 *
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.ExpressionAttributeNames.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.ExpressionAttributeNames.html</a>
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.ExpressionAttributeValues.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.ExpressionAttributeValues.html</a>
 */
class AliasList
{
    private final List<String> names = new ArrayList<>();
    private final List<AttributeValue> values = new ArrayList<>();

    /**
     * Returns the alias for the given attribute path, registering it if it has not been seen before.
     *
     * @param name the raw attribute path segment
     * @return the #index alias
     */
    public String aliasPath(String name)
    {
        requireNonNull(name, "name is null");
        int index = names.indexOf(name);
        if (index < 0) {
            names.add(name);
            index = names.size() - 1;
        }
        return NAME_ALIAS_PREFIX + index;
    }

    /**
     * Registers the given value and returns its alias.
     *
     * @param value the literal to alias
     * @return the next :index alias
     */
    public String aliasValue(AttributeValue value)
    {
        values.add(requireNonNull(value, "value is null"));
        return VALUE_ALIAS_PREFIX + (values.size() - 1);
    }

    public List<String> getNames()
    {
        return Collections.unmodifiableList(names);
    }

    public List<AttributeValue> getValues()
    {
        return Collections.unmodifiableList(values);
    }
}
