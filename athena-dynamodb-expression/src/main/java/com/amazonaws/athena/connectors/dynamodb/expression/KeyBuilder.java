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

import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.UnsetParameterException;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_OPERAND;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.NAME_PLACEHOLDER;

/**
 * A partition or sort key attribute. Keys are top level attributes, so unlike {@link NameBuilder} the key is
 * never split into path segments.
 */
public final class KeyBuilder
        implements OperandBuilder
{
    private final String key;

    KeyBuilder(String key)
    {
        this.key = key;
    }

    public String getKey()
    {
        return key;
    }

    @Override
    public Operand buildOperand()
    {
        if (StringUtils.isEmpty(key)) {
            throw new UnsetParameterException(BUILD_OPERAND, "KeyBuilder");
        }
        return new Operand(ExpressionNode.fromNames(ImmutableList.of(key), NAME_PLACEHOLDER));
    }

    public KeyConditionBuilder equal(ValueBuilder value)
    {
        return DDBExpressions.keyEqual(this, value);
    }

    public KeyConditionBuilder lessThan(ValueBuilder value)
    {
        return DDBExpressions.keyLessThan(this, value);
    }

    public KeyConditionBuilder lessThanEqual(ValueBuilder value)
    {
        return DDBExpressions.keyLessThanEqual(this, value);
    }

    public KeyConditionBuilder greaterThan(ValueBuilder value)
    {
        return DDBExpressions.keyGreaterThan(this, value);
    }

    public KeyConditionBuilder greaterThanEqual(ValueBuilder value)
    {
        return DDBExpressions.keyGreaterThanEqual(this, value);
    }

    public KeyConditionBuilder between(ValueBuilder lower, ValueBuilder upper)
    {
        return DDBExpressions.keyBetween(this, lower, upper);
    }

    public KeyConditionBuilder beginsWith(String prefix)
    {
        return DDBExpressions.keyBeginsWith(this, prefix);
    }
}
