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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_TREE;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.CHILD_PLACEHOLDER;
import static java.util.Objects.requireNonNull;

/**
 * An update expression made of SET, REMOVE, ADD and DELETE actions. Actions of the same kind are rendered as
 * one comma separated clause, and clauses are always emitted in SET, REMOVE, ADD, DELETE order no matter in
 * which order the actions were added.
 *
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.UpdateExpressions.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.UpdateExpressions.html</a>
 */
public final class UpdateBuilder
        implements TreeBuilder
{
    private static final Joiner COMMA_JOINER = Joiner.on(", ");

    // declaration order is clause order
    enum OperationMode
    {
        SET("SET", "$c = $c"),
        REMOVE("REMOVE", "$c"),
        ADD("ADD", "$c $c"),
        DELETE("DELETE", "$c $c");

        private final String keyword;
        private final String fmtExpression;

        OperationMode(String keyword, String fmtExpression)
        {
            this.keyword = keyword;
            this.fmtExpression = fmtExpression;
        }

        String getKeyword()
        {
            return keyword;
        }
    }

    /**
     * One action on one attribute. REMOVE carries no value.
     */
    static final class OperationBuilder
    {
        private final NameBuilder name;
        private final Optional<OperandBuilder> value;
        private final OperationMode mode;

        OperationBuilder(NameBuilder name, Optional<OperandBuilder> value, OperationMode mode)
        {
            this.name = requireNonNull(name, "name is null");
            this.value = requireNonNull(value, "value is null");
            this.mode = requireNonNull(mode, "mode is null");
        }

        ExpressionNode buildOperation()
        {
            ImmutableList.Builder<ExpressionNode> children = ImmutableList.builder();
            children.add(name.buildOperand().getExpressionNode());
            if (mode != OperationMode.REMOVE && value.isPresent()) {
                children.add(value.get().buildOperand().getExpressionNode());
            }
            return ExpressionNode.fromChildren(children.build(), mode.fmtExpression);
        }
    }

    private final ListMultimap<OperationMode, OperationBuilder> operations;

    /**
     * Creates an empty update. Building its tree fails until an action is added.
     */
    public UpdateBuilder()
    {
        this(ImmutableListMultimap.of());
    }

    private UpdateBuilder(ListMultimap<OperationMode, OperationBuilder> operations)
    {
        this.operations = ImmutableListMultimap.copyOf(operations);
    }

    /**
     * Adds a SET action assigning the given operand to the attribute.
     */
    public UpdateBuilder set(NameBuilder name, OperandBuilder operand)
    {
        return withOperation(new OperationBuilder(name, Optional.of(requireNonNull(operand, "operand is null")), OperationMode.SET));
    }

    /**
     * Adds a REMOVE action for the attribute.
     */
    public UpdateBuilder remove(NameBuilder name)
    {
        return withOperation(new OperationBuilder(name, Optional.empty(), OperationMode.REMOVE));
    }

    /**
     * Adds an ADD action: adds the number to a numeric attribute, or the elements to a set attribute.
     */
    public UpdateBuilder add(NameBuilder name, ValueBuilder value)
    {
        return withOperation(new OperationBuilder(name, Optional.of(requireNonNull(value, "value is null")), OperationMode.ADD));
    }

    /**
     * Adds a DELETE action removing the given elements from a set attribute.
     */
    public UpdateBuilder delete(NameBuilder name, ValueBuilder value)
    {
        return withOperation(new OperationBuilder(name, Optional.of(requireNonNull(value, "value is null")), OperationMode.DELETE));
    }

    private UpdateBuilder withOperation(OperationBuilder operation)
    {
        return new UpdateBuilder(ImmutableListMultimap.<OperationMode, OperationBuilder>builder()
                .putAll(operations)
                .put(operation.mode, operation)
                .build());
    }

    @Override
    public ExpressionNode buildTree()
    {
        if (operations.isEmpty()) {
            throw new UnsetParameterException(BUILD_TREE, "UpdateBuilder");
        }

        StringBuilder fmtExpression = new StringBuilder();
        List<ExpressionNode> childNodes = new ArrayList<>();
        for (OperationMode mode : OperationMode.values()) {
            List<OperationBuilder> operationList = operations.get(mode);
            if (operationList.isEmpty()) {
                continue;
            }
            fmtExpression.append(mode.getKeyword()).append(' ').append(CHILD_PLACEHOLDER).append('\n');
            childNodes.add(buildChildNodes(operationList));
        }
        return ExpressionNode.fromChildren(childNodes, fmtExpression.toString());
    }

    private static ExpressionNode buildChildNodes(List<OperationBuilder> operationList)
    {
        List<ExpressionNode> childNodes = new ArrayList<>(operationList.size());
        for (OperationBuilder operation : operationList) {
            childNodes.add(operation.buildOperation());
        }
        return ExpressionNode.fromChildren(childNodes, COMMA_JOINER.join(Collections.nCopies(operationList.size(), CHILD_PLACEHOLDER)));
    }
}
