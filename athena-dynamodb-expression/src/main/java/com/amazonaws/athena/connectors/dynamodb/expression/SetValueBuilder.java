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

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_OPERAND;
import static java.util.Objects.requireNonNull;

/**
 * A value computed by a SET action: addition, subtraction, list_append or if_not_exists.
 */
public final class SetValueBuilder
        implements OperandBuilder
{
    enum SetValueMode
    {
        UNSET(null),
        PLUS("$c + $c"),
        MINUS("$c - $c"),
        LIST_APPEND("list_append($c, $c)"),
        IF_NOT_EXISTS("if_not_exists($c, $c)");

        private final String fmtExpression;

        SetValueMode(String fmtExpression)
        {
            this.fmtExpression = fmtExpression;
        }
    }

    private final OperandBuilder leftOperand;
    private final OperandBuilder rightOperand;
    private final SetValueMode mode;

    /**
     * Creates an unset builder. Building its operand always fails.
     */
    public SetValueBuilder()
    {
        this.leftOperand = null;
        this.rightOperand = null;
        this.mode = SetValueMode.UNSET;
    }

    SetValueBuilder(OperandBuilder leftOperand, OperandBuilder rightOperand, SetValueMode mode)
    {
        this.leftOperand = requireNonNull(leftOperand, "leftOperand is null");
        this.rightOperand = requireNonNull(rightOperand, "rightOperand is null");
        this.mode = requireNonNull(mode, "mode is null");
    }

    @Override
    public Operand buildOperand()
    {
        if (mode == SetValueMode.UNSET) {
            throw new UnsetParameterException(BUILD_OPERAND, "SetValueBuilder");
        }

        ExpressionNode left = leftOperand.buildOperand().getExpressionNode();
        ExpressionNode right = rightOperand.buildOperand().getExpressionNode();
        return new Operand(ExpressionNode.fromChildren(ImmutableList.of(left, right), mode.fmtExpression));
    }
}
