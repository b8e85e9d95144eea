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
 * Operands that can also be combined with the SET arithmetic and list functions.
 */
public abstract class AbstractArithmeticOperandBuilder
        extends AbstractOperandBuilder
{
    AbstractArithmeticOperandBuilder() {}

    public SetValueBuilder plus(OperandBuilder right)
    {
        return DDBExpressions.plus(this, right);
    }

    public SetValueBuilder minus(OperandBuilder right)
    {
        return DDBExpressions.minus(this, right);
    }

    public SetValueBuilder listAppend(OperandBuilder right)
    {
        return DDBExpressions.listAppend(this, right);
    }
}
