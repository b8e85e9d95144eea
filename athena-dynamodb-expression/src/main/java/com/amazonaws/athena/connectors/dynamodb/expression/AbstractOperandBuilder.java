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

/**
 * Base of the operands that can appear on either side of a comparison: attribute names, literal values and
 * size() of an attribute.
 */
public abstract class AbstractOperandBuilder
        implements OperandBuilder
{
    AbstractOperandBuilder() {}

    public ConditionBuilder equal(OperandBuilder right)
    {
        return DDBExpressions.equal(this, right);
    }

    public ConditionBuilder notEqual(OperandBuilder right)
    {
        return DDBExpressions.notEqual(this, right);
    }

    public ConditionBuilder lessThan(OperandBuilder right)
    {
        return DDBExpressions.lessThan(this, right);
    }

    public ConditionBuilder lessThanEqual(OperandBuilder right)
    {
        return DDBExpressions.lessThanEqual(this, right);
    }

    public ConditionBuilder greaterThan(OperandBuilder right)
    {
        return DDBExpressions.greaterThan(this, right);
    }

    public ConditionBuilder greaterThanEqual(OperandBuilder right)
    {
        return DDBExpressions.greaterThanEqual(this, right);
    }

    /**
     * The bounds are used in the order given; DynamoDB rejects the expression if lower is greater than upper.
     */
    public ConditionBuilder between(OperandBuilder lower, OperandBuilder upper)
    {
        return DDBExpressions.between(this, lower, upper);
    }

    public ConditionBuilder in(OperandBuilder right, OperandBuilder... other)
    {
        return DDBExpressions.in(this, right, other);
    }
}
