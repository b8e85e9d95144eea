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

import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.ExpressionException;
import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.InvalidParameterException;
import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.UnsetParameterException;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_TREE;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.CHILD_PLACEHOLDER;
import static java.util.Objects.requireNonNull;

/**
 * A condition or filter expression. Conditions are composed without any validation; everything is checked
 * when {@link #buildTree()} is called.
 *
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.OperatorsAndFunctions.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.OperatorsAndFunctions.html</a>
 */
public final class ConditionBuilder
        implements TreeBuilder
{
    private static final Joiner AND_JOINER = Joiner.on(" AND ");
    private static final Joiner OR_JOINER = Joiner.on(" OR ");
    private static final Joiner COMMA_JOINER = Joiner.on(", ");
    private static final String PARENTHESIZED_CHILD = "(" + CHILD_PLACEHOLDER + ")";

    enum ConditionMode
    {
        UNSET(null),
        EQUAL("$c = $c"),
        NOT_EQUAL("$c <> $c"),
        LESS_THAN("$c < $c"),
        LESS_THAN_EQUAL("$c <= $c"),
        GREATER_THAN("$c > $c"),
        GREATER_THAN_EQUAL("$c >= $c"),
        AND(null),
        OR(null),
        NOT("NOT ($c)"),
        BETWEEN("$c BETWEEN $c AND $c"),
        IN(null),
        ATTR_EXISTS("attribute_exists ($c)"),
        ATTR_NOT_EXISTS("attribute_not_exists ($c)"),
        ATTR_TYPE("attribute_type ($c, $c)"),
        BEGINS_WITH("begins_with ($c, $c)"),
        CONTAINS("contains ($c, $c)");

        // null when the template depends on the number of children
        private final String fmtExpression;

        ConditionMode(String fmtExpression)
        {
            this.fmtExpression = fmtExpression;
        }
    }

    private final List<OperandBuilder> operandList;
    private final List<ConditionBuilder> conditionList;
    private final ConditionMode mode;

    /**
     * Creates an unset condition. Building its tree always fails.
     */
    public ConditionBuilder()
    {
        this(ImmutableList.of(), ImmutableList.of(), ConditionMode.UNSET);
    }

    ConditionBuilder(List<OperandBuilder> operandList, List<ConditionBuilder> conditionList, ConditionMode mode)
    {
        this.operandList = ImmutableList.copyOf(requireNonNull(operandList, "operandList is null"));
        this.conditionList = ImmutableList.copyOf(requireNonNull(conditionList, "conditionList is null"));
        this.mode = requireNonNull(mode, "mode is null");
    }

    ConditionMode getMode()
    {
        return mode;
    }

    public ConditionBuilder and(ConditionBuilder right, ConditionBuilder... other)
    {
        return DDBExpressions.and(this, right, other);
    }

    public ConditionBuilder or(ConditionBuilder right, ConditionBuilder... other)
    {
        return DDBExpressions.or(this, right, other);
    }

    public ConditionBuilder not()
    {
        return DDBExpressions.not(this);
    }

    @Override
    public ExpressionNode buildTree()
    {
        if (mode == ConditionMode.UNSET) {
            throw new UnsetParameterException(BUILD_TREE, "ConditionBuilder");
        }

        List<ExpressionNode> childNodes = buildChildNodes();
        switch (mode) {
            case AND:
                return ExpressionNode.fromChildren(childNodes, AND_JOINER.join(Collections.nCopies(childNodes.size(), PARENTHESIZED_CHILD)));
            case OR:
                return ExpressionNode.fromChildren(childNodes, OR_JOINER.join(Collections.nCopies(childNodes.size(), PARENTHESIZED_CHILD)));
            case IN:
                if (operandList.size() < 2) {
                    throw new InvalidParameterException("buildCondition", "ConditionBuilder");
                }
                // the first operand is the subject, every other operand is a candidate
                String candidates = COMMA_JOINER.join(Collections.nCopies(operandList.size() - 1, CHILD_PLACEHOLDER));
                return ExpressionNode.fromChildren(childNodes, CHILD_PLACEHOLDER + " IN (" + candidates + ")");
            default:
                if (mode.fmtExpression == null) {
                    throw new ExpressionException("buildCondition error: unsupported mode: " + mode);
                }
                return ExpressionNode.fromChildren(childNodes, mode.fmtExpression);
        }
    }

    /*
    Nested conditions are built before operands, depth first.
     */
    private List<ExpressionNode> buildChildNodes()
    {
        List<ExpressionNode> childNodes = new ArrayList<>(conditionList.size() + operandList.size());
        for (ConditionBuilder condition : conditionList) {
            childNodes.add(condition.buildTree());
        }
        for (OperandBuilder operand : operandList) {
            childNodes.add(operand.buildOperand().getExpressionNode());
        }
        return childNodes;
    }
}
