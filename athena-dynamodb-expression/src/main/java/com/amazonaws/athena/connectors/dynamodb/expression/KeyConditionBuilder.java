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

import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.InvalidParameterException;
import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.UnsetParameterException;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_TREE;
import static java.util.Objects.requireNonNull;

/**
 * A key condition expression for Query. DynamoDB only accepts an equality on the partition key, optionally
 * followed by a single condition on the sort key, so the only legal AND is "partition key equality AND sort key
 * condition". Any other combination yields an invalid key condition that fails when its tree is built.
 *
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Query.KeyConditionExpressions.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Query.KeyConditionExpressions.html</a>
 */
public final class KeyConditionBuilder
        implements TreeBuilder
{
    private static final String SUBJECT = "KeyConditionBuilder";

    enum KeyConditionMode
    {
        UNSET(null),
        INVALID(null),
        EQUAL("$c = $c"),
        LESS_THAN("$c < $c"),
        LESS_THAN_EQUAL("$c <= $c"),
        GREATER_THAN("$c > $c"),
        GREATER_THAN_EQUAL("$c >= $c"),
        AND("($c) AND ($c)"),
        BETWEEN("$c BETWEEN $c AND $c"),
        BEGINS_WITH("begins_with ($c, $c)");

        private final String fmtExpression;

        KeyConditionMode(String fmtExpression)
        {
            this.fmtExpression = fmtExpression;
        }
    }

    private final List<OperandBuilder> operandList;
    private final List<KeyConditionBuilder> keyConditionList;
    private final KeyConditionMode mode;

    /**
     * Creates an unset key condition. Building its tree always fails.
     */
    public KeyConditionBuilder()
    {
        this(ImmutableList.of(), ImmutableList.of(), KeyConditionMode.UNSET);
    }

    KeyConditionBuilder(List<OperandBuilder> operandList, List<KeyConditionBuilder> keyConditionList, KeyConditionMode mode)
    {
        this.operandList = ImmutableList.copyOf(requireNonNull(operandList, "operandList is null"));
        this.keyConditionList = ImmutableList.copyOf(requireNonNull(keyConditionList, "keyConditionList is null"));
        this.mode = requireNonNull(mode, "mode is null");
    }

    static KeyConditionBuilder invalid()
    {
        return new KeyConditionBuilder(ImmutableList.of(), ImmutableList.of(), KeyConditionMode.INVALID);
    }

    KeyConditionMode getMode()
    {
        return mode;
    }

    public KeyConditionBuilder and(KeyConditionBuilder right)
    {
        return DDBExpressions.keyAnd(this, right);
    }

    @Override
    public ExpressionNode buildTree()
    {
        switch (mode) {
            case UNSET:
                throw new UnsetParameterException(BUILD_TREE, SUBJECT);
            case INVALID:
                throw new InvalidParameterException("buildKeyCondition", SUBJECT, "invalid key condition constructed");
            case AND:
                if (keyConditionList.isEmpty() && operandList.isEmpty()) {
                    throw new InvalidParameterException("andBuildKeyCondition", SUBJECT);
                }
                break;
            default:
                break;
        }

        return ExpressionNode.fromChildren(buildChildNodes(), mode.fmtExpression);
    }

    private List<ExpressionNode> buildChildNodes()
    {
        List<ExpressionNode> childNodes = new ArrayList<>(keyConditionList.size() + operandList.size());
        for (KeyConditionBuilder keyCondition : keyConditionList) {
            childNodes.add(keyCondition.buildTree());
        }
        for (OperandBuilder operand : operandList) {
            childNodes.add(operand.buildOperand().getExpressionNode());
        }
        return childNodes;
    }
}
