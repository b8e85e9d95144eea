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

import static java.util.Objects.requireNonNull;

/**
 * size() of an attribute path. The wrapped name is rendered first and then enclosed, so
 * name("foo[1]").size() renders as "size (#0[1])".
 */
public final class SizeBuilder
        extends AbstractOperandBuilder
{
    private final NameBuilder nameBuilder;

    SizeBuilder(NameBuilder nameBuilder)
    {
        this.nameBuilder = requireNonNull(nameBuilder, "nameBuilder is null");
    }

    @Override
    public Operand buildOperand()
    {
        ExpressionNode node = nameBuilder.buildOperand().getExpressionNode();
        return new Operand(node.withFmtExpression("size (" + node.getFmtExpression() + ")"));
    }
}
